package com.circuitsync.core.diff;

import com.circuitsync.core.diff.MatchStrategy.Match;
import com.circuitsync.core.model.Circuit;
import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.EndpointKind;
import com.circuitsync.core.model.Net;
import com.circuitsync.core.model.SubcircuitInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the {@link EditPlan} turning the current model into the desired one.
 *
 * <p>Components are paired by the configured {@link MatchStrategy} chain. Nets are
 * compared after desired endpoints are translated to target keys:
 * <ol>
 *   <li>a desired explicit name equal to a current name is KEEP, or UPDATE with the
 *       endpoint delta (a grown explicit net stays the same net);</li>
 *   <li>an equal endpoint set is KEEP when the desired net is implicit (the current name
 *       is kept) and UPDATE with a rename when a different explicit name is desired;</li>
 *   <li>everything else is ADD or REMOVE. A grown implicit net therefore becomes a REMOVE
 *       of the old net and an ADD of a net with a regenerated name.</li>
 * </ol>
 * Instances are paired by identity, then by name, then by structure (definition, ports,
 * component types), and their bodies are diffed recursively.
 */
public class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    private final List<MatchStrategy> strategies;
    private final boolean preserveUserComponents;

    /**
     * Engine with the default chain: identity, reference, signature.
     */
    public DiffEngine(boolean preserveUserComponents) {
        this(List.of(new IdentityMatchStrategy(), new ReferenceMatchStrategy(), new SignatureMatchStrategy()),
            preserveUserComponents);
    }

    public DiffEngine(List<MatchStrategy> strategies, boolean preserveUserComponents) {
        this.strategies = List.copyOf(strategies);
        this.preserveUserComponents = preserveUserComponents;
    }

    /**
     * @param current model interpreted from the document
     * @param desired model built from the description
     * @return classification of every entity of both models
     */
    public EditPlan diff(Circuit current, Circuit desired) {
        Map<String, String> targetKeys = new HashMap<>();
        List<ComponentChange> componentChanges = diffComponents(current, desired, targetKeys);

        Set<String> preserved = new HashSet<>();
        for (ComponentChange change : componentChanges) {
            if (change.preserved()) {
                preserved.add(change.current().key());
            }
        }

        List<InstanceChange> instanceChanges = diffInstances(current, desired, targetKeys);
        List<NetChange> netChanges = diffNets(current, desired, targetKeys, preserved);
        return new EditPlan(componentChanges, netChanges, instanceChanges, targetKeys);
    }

    private List<ComponentChange> diffComponents(Circuit current, Circuit desired, Map<String, String> targetKeys) {
        List<Component> unmatchedCurrent = new ArrayList<>(current.components());
        List<Component> unmatchedDesired = new ArrayList<>(desired.components());
        Map<Component, ComponentChange> byDesired = new IdentityHashMap<>();
        Map<Component, ComponentChange> byCurrent = new IdentityHashMap<>();

        for (MatchStrategy strategy : strategies) {
            if (unmatchedCurrent.isEmpty() || unmatchedDesired.isEmpty()) {
                break;
            }
            for (Match match : strategy.match(List.copyOf(unmatchedCurrent), List.copyOf(unmatchedDesired))) {
                PropertyPatch patch = patch(match.current(), match.desired());
                ChangeKind kind = patch.isEmpty() ? ChangeKind.KEEP : ChangeKind.UPDATE;
                ComponentChange change = new ComponentChange(kind, match.current(), match.desired(), patch, strategy.name());
                byDesired.put(match.desired(), change);
                byCurrent.put(match.current(), change);
                unmatchedCurrent.remove(match.current());
                unmatchedDesired.remove(match.desired());
                targetKeys.put(match.desired().key(), match.current().key());
                log.debug("{} {} matched {} by {}", kind, match.desired().reference(),
                    match.current().reference(), strategy.name());
            }
        }

        List<ComponentChange> changes = new ArrayList<>();
        for (Component component : current.components()) {
            ComponentChange change = byCurrent.get(component);
            if (change != null) {
                changes.add(change);
            } else if (preserveUserComponents) {
                changes.add(new ComponentChange(ChangeKind.KEEP, component, null, PropertyPatch.empty(), null));
            } else {
                changes.add(new ComponentChange(ChangeKind.REMOVE, component, null, PropertyPatch.empty(), null));
            }
        }
        for (Component component : desired.components()) {
            if (!byDesired.containsKey(component)) {
                changes.add(new ComponentChange(ChangeKind.ADD, null, component, PropertyPatch.empty(), null));
                targetKeys.put(component.key(), component.key());
            }
        }
        return changes;
    }

    /**
     * Minimal delta from {@code current} to {@code desired}. Only properties named by the
     * description are compared; an empty desired value means removal.
     */
    static PropertyPatch patch(Component current, Component desired) {
        String reference = current.reference().equals(desired.reference()) ? null : desired.reference();
        String typeId = current.typeId().equals(desired.typeId()) ? null : desired.typeId();
        Map<String, String> set = new LinkedHashMap<>();
        Set<String> removed = new LinkedHashSet<>();
        for (Map.Entry<String, String> property : desired.properties().entrySet()) {
            String existing = current.properties().get(property.getKey());
            if (property.getValue().isEmpty()) {
                if (existing != null) {
                    removed.add(property.getKey());
                }
            } else if (!property.getValue().equals(existing)) {
                set.put(property.getKey(), property.getValue());
            }
        }
        return new PropertyPatch(reference, typeId, set, removed);
    }

    private List<InstanceChange> diffInstances(Circuit current, Circuit desired, Map<String, String> targetKeys) {
        Map<String, SubcircuitInstance> currentByIdentity = new LinkedHashMap<>();
        Map<String, SubcircuitInstance> currentByName = new LinkedHashMap<>();
        for (SubcircuitInstance instance : current.instances()) {
            if (instance.identity() != null) {
                currentByIdentity.putIfAbsent(instance.identity(), instance);
            }
            currentByName.putIfAbsent(instance.name(), instance);
        }

        Map<SubcircuitInstance, SubcircuitInstance> pairs = new LinkedHashMap<>();
        Set<SubcircuitInstance> taken = Collections.newSetFromMap(new IdentityHashMap<>());
        for (SubcircuitInstance wanted : desired.instances()) {
            SubcircuitInstance hit = wanted.identity() != null ? currentByIdentity.get(wanted.identity()) : null;
            if (hit != null && taken.add(hit)) {
                pairs.put(wanted, hit);
            }
        }
        for (SubcircuitInstance wanted : desired.instances()) {
            if (pairs.containsKey(wanted)) {
                continue;
            }
            SubcircuitInstance hit = currentByName.get(wanted.name());
            if (hit != null && taken.add(hit)) {
                pairs.put(wanted, hit);
            }
        }
        // a renamed instance without a stable id keeps its fragment when its structure is unchanged
        List<SubcircuitInstance> candidates = current.instances().stream()
            .filter(instance -> !taken.contains(instance))
            .sorted(Comparator.comparing(SubcircuitInstance::name))
            .toList();
        for (SubcircuitInstance wanted : desired.instances()) {
            if (pairs.containsKey(wanted)) {
                continue;
            }
            List<Object> structure = structure(wanted);
            for (SubcircuitInstance candidate : candidates) {
                if (!taken.contains(candidate) && structure.equals(structure(candidate))) {
                    taken.add(candidate);
                    pairs.put(wanted, candidate);
                    log.debug("Instance {} matched {} by structure", wanted.name(), candidate.name());
                    break;
                }
            }
        }

        List<InstanceChange> changes = new ArrayList<>();
        for (SubcircuitInstance instance : current.instances()) {
            if (!taken.contains(instance)) {
                changes.add(new InstanceChange(ChangeKind.REMOVE, instance, null, diff(instance.body(), Circuit.empty())));
            }
        }
        for (SubcircuitInstance wanted : desired.instances()) {
            SubcircuitInstance hit = pairs.get(wanted);
            if (hit == null) {
                changes.add(new InstanceChange(ChangeKind.ADD, null, wanted, diff(Circuit.empty(), wanted.body())));
                targetKeys.put(wanted.key(), wanted.key());
                continue;
            }
            boolean same = hit.name().equals(wanted.name())
                && hit.definition().equals(wanted.definition())
                && new TreeSet<>(hit.ports()).equals(new TreeSet<>(wanted.ports()));
            changes.add(new InstanceChange(same ? ChangeKind.KEEP : ChangeKind.UPDATE, hit, wanted,
                diff(hit.body(), wanted.body())));
            targetKeys.put(wanted.key(), hit.key());
        }
        return changes;
    }

    /**
     * Definition, port names, component types and nested definitions of an instance.
     */
    static List<Object> structure(SubcircuitInstance instance) {
        List<String> types = instance.body().components().stream()
            .map(Component::typeId)
            .sorted()
            .toList();
        List<String> nested = instance.body().instances().stream()
            .map(SubcircuitInstance::definition)
            .sorted()
            .toList();
        return List.of(instance.definition(), new TreeSet<>(instance.ports()), types, nested);
    }

    private List<NetChange> diffNets(Circuit current, Circuit desired, Map<String, String> targetKeys,
                                     Set<String> preserved) {
        List<Net> remainingCurrent = new ArrayList<>(current.nets());
        List<Net> remainingDesired = new ArrayList<>();
        for (Net net : desired.nets()) {
            remainingDesired.add(translate(net, targetKeys));
        }
        List<NetChange> changes = new ArrayList<>();

        // Nets made only of preserved components' pins are outside the description.
        remainingCurrent.removeIf(net -> {
            if (!net.endpoints().isEmpty() && net.endpoints().stream().allMatch(e -> isPreserved(e, preserved))) {
                changes.add(new NetChange(ChangeKind.KEEP, net, net, List.of(), List.of(), false));
                return true;
            }
            return false;
        });

        // 1. explicit name equality
        for (Net wanted : List.copyOf(remainingDesired)) {
            if (!wanted.explicitName()) {
                continue;
            }
            Net hit = find(remainingCurrent, wanted.name());
            if (hit == null) {
                continue;
            }
            remainingCurrent.remove(hit);
            remainingDesired.remove(wanted);
            changes.add(compare(hit, wanted, preserved));
        }

        // 2. equal endpoint set
        for (Net wanted : List.copyOf(remainingDesired)) {
            Set<Endpoint> wantedSet = new TreeSet<>(wanted.endpoints());
            Net hit = null;
            for (Net candidate : remainingCurrent) {
                if (withoutPreserved(candidate, preserved).equals(wantedSet)) {
                    hit = candidate;
                    break;
                }
            }
            if (hit == null) {
                continue;
            }
            remainingCurrent.remove(hit);
            remainingDesired.remove(wanted);
            // an implicit net keeps its current implicit name; any explicit side decides the name
            Net resolved = wanted.explicitName() || hit.explicitName() ? wanted : wanted.withName(hit.name(), false);
            changes.add(compare(hit, resolved, preserved));
        }

        // 3. the rest
        for (Net net : remainingCurrent) {
            List<Endpoint> removed = net.endpoints().stream().filter(e -> !isPreserved(e, preserved)).toList();
            changes.add(new NetChange(ChangeKind.REMOVE, net, null, List.of(), removed, false));
        }
        for (Net net : remainingDesired) {
            changes.add(new NetChange(ChangeKind.ADD, null, net, net.endpoints(), List.of(), false));
        }
        for (NetChange change : changes) {
            if (change.kind() != ChangeKind.KEEP) {
                log.debug("{} net {}", change.kind(), change.entity());
            }
        }
        return changes;
    }

    private static NetChange compare(Net current, Net desired, Set<String> preserved) {
        Set<Endpoint> before = withoutPreserved(current, preserved);
        Set<Endpoint> after = new TreeSet<>(desired.endpoints());
        List<Endpoint> added = after.stream().filter(e -> !before.contains(e)).toList();
        List<Endpoint> removed = before.stream().filter(e -> !after.contains(e)).toList();
        boolean relabel = !current.name().equals(desired.name()) || current.netClass() != desired.netClass();

        // endpoints of preserved components stay on the net
        List<Endpoint> kept = current.endpoints().stream().filter(e -> isPreserved(e, preserved)).toList();
        Net target = desired;
        if (!kept.isEmpty()) {
            List<Endpoint> merged = new ArrayList<>(desired.endpoints());
            merged.addAll(kept);
            target = desired.withEndpoints(merged);
        }
        ChangeKind kind = added.isEmpty() && removed.isEmpty() && !relabel ? ChangeKind.KEEP : ChangeKind.UPDATE;
        return new NetChange(kind, current, target, added, removed, relabel);
    }

    private static Set<Endpoint> withoutPreserved(Net net, Set<String> preserved) {
        Set<Endpoint> result = new TreeSet<>();
        for (Endpoint endpoint : net.endpoints()) {
            if (!isPreserved(endpoint, preserved)) {
                result.add(endpoint);
            }
        }
        return result;
    }

    private static boolean isPreserved(Endpoint endpoint, Set<String> preserved) {
        return endpoint.kind() == EndpointKind.PIN && preserved.contains(endpoint.ownerKey());
    }

    private static Net find(List<Net> nets, String name) {
        for (Net net : nets) {
            if (net.name().equals(name)) {
                return net;
            }
        }
        return null;
    }

    private static Net translate(Net net, Map<String, String> targetKeys) {
        List<Endpoint> endpoints = new ArrayList<>(net.endpoints().size());
        for (Endpoint endpoint : net.endpoints()) {
            String target = Objects.requireNonNullElse(targetKeys.get(endpoint.ownerKey()), endpoint.ownerKey());
            endpoints.add(new Endpoint(endpoint.kind(), target, endpoint.terminal()));
        }
        return net.withEndpoints(endpoints);
    }
}
