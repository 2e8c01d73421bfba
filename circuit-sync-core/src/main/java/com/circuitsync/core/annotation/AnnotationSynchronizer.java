package com.circuitsync.core.annotation;

import com.circuitsync.core.description.DocumentModels;
import com.circuitsync.core.diff.ChangeKind;
import com.circuitsync.core.diff.NetChange;
import com.circuitsync.core.document.SchematicDocument;
import com.circuitsync.core.document.SchematicElements;
import com.circuitsync.core.model.AnnotationKind;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.EndpointKind;
import com.circuitsync.core.model.Net;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.sexpr.SNode.SList;
import com.circuitsync.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Brings the labels of one fragment in line with its net changes.
 *
 * <p>Only nets touched by the plan are considered: a KEEP net, or a net the description
 * never mentions, keeps every label the user drew. A KEEP net counts as touched when one
 * of its pins belongs to a component whose pins moved, for example after a type change. For a touched net each endpoint gets a
 * label carrying the net name at its connection point. Signal nets use local labels,
 * power nets global labels, and nets crossing the fragment boundary hierarchical labels
 * named after the port. Labels of touched names that no longer sit on an endpoint of
 * that net, or have the wrong kind, are removed.
 */
public class AnnotationSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(AnnotationSynchronizer.class);

    private static final List<AnnotationKind> LABEL_KINDS = List.of(
        AnnotationKind.LOCAL_LABEL, AnnotationKind.GLOBAL_LABEL, AnnotationKind.HIERARCHICAL_LABEL);

    /**
     * Label edits made in one fragment.
     */
    public record Result(int added, int removed) {

        public boolean isEmpty() {
            return added == 0 && removed == 0;
        }
    }

    /**
     * Applies the net changes of one namespace to its fragment.
     *
     * @param fragment fragment to edit
     * @param changes net changes of the namespace, endpoints in target keys
     * @param boundaryNets names of nets exposed through a port of this namespace
     * @param anchors connection points after component and sheet edits
     * @return number of labels added and removed
     */
    public Result apply(SchematicDocument fragment, List<NetChange> changes, Set<String> boundaryNets,
                        AnchorResolver anchors) {
        return apply(fragment, changes, boundaryNets, anchors, Set.of());
    }

    /**
     * Applies the net changes of one namespace, also re-anchoring the nets of components
     * whose pins moved.
     *
     * @param movedComponents target keys of matched components whose pin positions changed
     */
    public Result apply(SchematicDocument fragment, List<NetChange> changes, Set<String> boundaryNets,
                        AnchorResolver anchors, Set<String> movedComponents) {
        Set<String> touched = new LinkedHashSet<>();
        Map<String, Net> finalNets = new HashMap<>();
        for (NetChange change : changes) {
            if (change.desired() != null) {
                finalNets.put(change.desired().name(), change.desired());
            }
            if (change.kind() == ChangeKind.KEEP && !hasPinOf(change.desired(), movedComponents)) {
                continue;
            }
            if (change.current() != null) {
                touched.add(change.current().name());
            }
            if (change.desired() != null) {
                touched.add(change.desired().name());
            }
        }
        if (touched.isEmpty()) {
            return new Result(0, 0);
        }

        Map<String, List<Position>> expected = new HashMap<>();
        for (String name : touched) {
            Net net = finalNets.get(name);
            if (net == null) {
                continue;
            }
            List<Position> points = new ArrayList<>();
            for (Endpoint endpoint : net.endpoints()) {
                Optional<Position> anchor = anchors.anchor(endpoint);
                if (anchor.isPresent()) {
                    points.add(anchor.get());
                } else {
                    log.debug("No connection point for {} of net {} in {}", endpoint, name, fragment.fileName());
                }
            }
            expected.put(name, points);
        }

        int removed = sweep(fragment, touched, finalNets, boundaryNets, expected);
        int added = 0;
        for (Map.Entry<String, List<Position>> entry : expected.entrySet()) {
            String name = entry.getKey();
            AnnotationKind kind = kindOf(finalNets.get(name), boundaryNets);
            for (Position anchor : entry.getValue()) {
                if (findLabel(fragment, kind, name, anchor).isEmpty()) {
                    fragment.add(SchematicElements.label(kind, name, anchor, labelUuid(fragment, kind, name, anchor)));
                    added++;
                }
            }
        }
        if (added > 0 || removed > 0) {
            log.info("{}: {} labels added, {} removed", fragment.fileName(), added, removed);
        }
        return new Result(added, removed);
    }

    /**
     * Label kind of a net in a fragment.
     */
    public static AnnotationKind kindOf(Net net, Set<String> boundaryNets) {
        if (boundaryNets.contains(net.name())) {
            return AnnotationKind.HIERARCHICAL_LABEL;
        }
        return net.isPower() ? AnnotationKind.GLOBAL_LABEL : AnnotationKind.LOCAL_LABEL;
    }

    private static boolean hasPinOf(Net net, Set<String> components) {
        if (net == null || components.isEmpty()) {
            return false;
        }
        return net.endpoints().stream()
            .anyMatch(endpoint -> endpoint.kind() == EndpointKind.PIN && components.contains(endpoint.ownerKey()));
    }

    private static int sweep(SchematicDocument fragment, Set<String> touched, Map<String, Net> finalNets,
                             Set<String> boundaryNets, Map<String, List<Position>> expected) {
        int removed = 0;
        for (AnnotationKind kind : LABEL_KINDS) {
            for (SList label : fragment.elements(kind.element())) {
                String text = label.atomValue(1);
                if (!touched.contains(text)) {
                    continue;
                }
                Net net = finalNets.get(text);
                boolean keep = net != null
                    && kindOf(net, boundaryNets) == kind
                    && SchematicElements.position(label)
                        .map(p -> isNear(p, expected.getOrDefault(text, List.of())))
                        .orElse(false);
                if (!keep) {
                    fragment.remove(label);
                    removed++;
                }
            }
        }
        return removed;
    }

    private static Optional<SList> findLabel(SchematicDocument fragment, AnnotationKind kind, String text,
                                             Position anchor) {
        return fragment.elements(kind.element()).stream()
            .filter(label -> label.atomValue(1).equals(text))
            .filter(label -> SchematicElements.position(label).map(p -> isNear(p, List.of(anchor))).orElse(false))
            .findFirst();
    }

    private static boolean isNear(Position point, List<Position> anchors) {
        for (Position anchor : anchors) {
            if (anchor.distanceTo(point) < DocumentModels.ANCHOR_TOLERANCE_MM) {
                return true;
            }
        }
        return false;
    }

    private static String labelUuid(SchematicDocument fragment, AnnotationKind kind, String text, Position anchor) {
        return IdGenerator.uuid(fragment.uuid(), "label", kind.element(), text,
            anchor.x().toPlainString(), anchor.y().toPlainString());
    }
}
