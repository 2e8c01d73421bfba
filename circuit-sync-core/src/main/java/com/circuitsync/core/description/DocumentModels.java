package com.circuitsync.core.description;

import com.circuitsync.core.document.ProjectDocument;
import com.circuitsync.core.document.SchematicDocument;
import com.circuitsync.core.document.SchematicElements;
import com.circuitsync.core.library.InMemorySymbolLibrary;
import com.circuitsync.core.library.LibSymbolCodec;
import com.circuitsync.core.model.Annotation;
import com.circuitsync.core.model.AnnotationKind;
import com.circuitsync.core.model.BoundaryPort;
import com.circuitsync.core.model.Circuit;
import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.Net;
import com.circuitsync.core.model.NetClass;
import com.circuitsync.core.model.Pin;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.model.SubcircuitInstance;
import com.circuitsync.core.model.SyncIssue;
import com.circuitsync.core.sexpr.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Interprets a loaded project as the current model.
 *
 * <p>Components come from placed symbols, pin signatures from the fragment's embedded
 * {@code lib_symbols}, sub-circuit instances from {@code sheet} elements. Nets are
 * recovered from labels: a label belongs to every pin or sheet pin whose connection
 * point lies within {@value #ANCHOR_TOLERANCE_MM} mm of the label anchor. Hierarchical
 * labels of a child fragment become its boundary ports.
 */
public final class DocumentModels {

    private static final Logger log = LoggerFactory.getLogger(DocumentModels.class);

    /** Maximum distance between a label anchor and the pin it annotates. */
    public static final double ANCHOR_TOLERANCE_MM = 0.5;

    private DocumentModels() {
        // Utility class
    }

    /**
     * Builds the current model of every fragment reachable from the root.
     */
    public static BuildResult fromDocument(ProjectDocument project) {
        List<SyncIssue> issues = new ArrayList<>();
        Set<String> visiting = new HashSet<>();
        Circuit circuit = build(project, project.root(), visiting, issues);
        return new BuildResult(circuit, issues);
    }

    /**
     * Symbol definitions embedded in every fragment of the project, first occurrence wins.
     */
    public static InMemorySymbolLibrary embeddedLibrary(ProjectDocument project) {
        InMemorySymbolLibrary library = new InMemorySymbolLibrary();
        for (SchematicDocument fragment : project.fragments()) {
            for (SList symbol : fragment.libSymbols()) {
                String libId = symbol.atomValue(1);
                if (library.resolve(libId).isEmpty()) {
                    library.add(LibSymbolCodec.read(symbol, libId));
                }
            }
        }
        return library;
    }

    private static Circuit build(ProjectDocument project, SchematicDocument fragment, Set<String> visiting,
                                 List<SyncIssue> issues) {
        visiting.add(fragment.fileName());
        Map<String, SList> libSymbols = new HashMap<>();
        for (SList symbol : fragment.libSymbols()) {
            libSymbols.put(symbol.atomValue(1), symbol);
        }

        List<Component> components = new ArrayList<>();
        Set<String> keys = new HashSet<>();
        int anonymous = 0;
        for (SList symbol : fragment.elements(SchematicElements.SYMBOL)) {
            if (SchematicElements.isPowerSymbol(symbol)) {
                continue;
            }
            String uuid = SchematicElements.uuid(symbol);
            String identity = uuid.isEmpty() ? null : uuid;
            String key = identity != null ? identity : "anonymous-" + (anonymous++);
            if (!keys.add(key)) {
                log.warn("Duplicate symbol uuid {} in {}", uuid, fragment.fileName());
                key = key + "#" + keys.size();
                keys.add(key);
            }
            String libId = SchematicElements.libId(symbol);
            Map<String, String> properties = new LinkedHashMap<>(SchematicElements.properties(symbol));
            String reference = Optional.ofNullable(properties.remove(SchematicElements.REFERENCE)).orElse("");
            SList libSymbol = libSymbols.get(libId);
            List<Pin> pins = List.of();
            if (libSymbol != null) {
                pins = LibSymbolCodec.readPins(libSymbol, SchematicElements.unit(symbol));
            } else {
                issues.add(SyncIssue.of(IssueKind.UNRESOLVED_REFERENCE, reference.isEmpty() ? key : reference,
                    "Symbol '" + libId + "' is not embedded in " + fragment.fileName() + ", pins unknown"));
            }
            Position position = SchematicElements.position(symbol).orElse(Position.at(BigDecimal.ZERO, BigDecimal.ZERO));
            components.add(new Component(key, identity, reference, libId, properties, position, pins));
        }

        List<SubcircuitInstance> instances = new ArrayList<>();
        Map<Endpoint, Position> portAnchors = new LinkedHashMap<>();
        for (SList sheet : fragment.elements(SchematicElements.SHEET)) {
            String uuid = SchematicElements.uuid(sheet);
            String name = SchematicElements.property(sheet, SchematicElements.SHEET_NAME).orElse("");
            String file = SchematicElements.property(sheet, SchematicElements.SHEET_FILE).orElse("");
            String key = uuid.isEmpty() ? "sheet-" + name : uuid;
            List<String> ports = new ArrayList<>();
            for (SList pin : sheet.all("pin")) {
                String portName = pin.atomValue(1);
                ports.add(portName);
                SchematicElements.position(pin).ifPresent(p -> portAnchors.put(Endpoint.port(key, portName), p));
            }
            Circuit body = Circuit.empty();
            Optional<SchematicDocument> child = project.fragment(file);
            if (child.isPresent() && !visiting.contains(file)) {
                body = build(project, child.get(), visiting, issues);
            }
            String definition = SchematicElements.property(sheet, SchematicElements.SHEET_DEFINITION).orElse(name);
            instances.add(new SubcircuitInstance(key, uuid.isEmpty() ? null : uuid, name, definition, Map.of(), ports, body,
                SchematicElements.position(sheet).orElse(null), file));
        }

        Map<Endpoint, Position> anchors = new LinkedHashMap<>();
        for (Component component : components) {
            for (Pin pin : component.pins()) {
                component.pinPosition(pin.number()).ifPresent(p -> anchors.put(Endpoint.pin(component.key(), pin.number()), p));
            }
        }
        anchors.putAll(portAnchors);

        List<Annotation> annotations = new ArrayList<>();
        for (AnnotationKind kind : List.of(AnnotationKind.LOCAL_LABEL, AnnotationKind.GLOBAL_LABEL,
            AnnotationKind.HIERARCHICAL_LABEL)) {
            for (SList label : fragment.elements(kind.element())) {
                SchematicElements.position(label)
                    .ifPresent(p -> annotations.add(new Annotation(kind, label.atomValue(1), p)));
            }
        }

        Map<String, Set<Endpoint>> netEndpoints = new LinkedHashMap<>();
        Map<String, NetClass> netClasses = new HashMap<>();
        Set<String> ports = new LinkedHashSet<>();
        Map<Endpoint, String> claimed = new HashMap<>();
        for (Annotation annotation : annotations) {
            String name = annotation.text();
            netEndpoints.computeIfAbsent(name, n -> new LinkedHashSet<>());
            if (annotation.kind() == AnnotationKind.GLOBAL_LABEL) {
                netClasses.put(name, NetClass.POWER);
            }
            if (annotation.kind() == AnnotationKind.HIERARCHICAL_LABEL) {
                ports.add(name);
            }
            for (Map.Entry<Endpoint, Position> anchor : anchors.entrySet()) {
                if (anchor.getValue().distanceTo(annotation.position()) >= ANCHOR_TOLERANCE_MM) {
                    continue;
                }
                String owner = claimed.putIfAbsent(anchor.getKey(), name);
                if (owner == null || owner.equals(name)) {
                    netEndpoints.get(name).add(anchor.getKey());
                } else {
                    log.debug("{} in {} carries labels '{}' and '{}', keeping '{}'",
                        anchor.getKey(), fragment.fileName(), owner, name, owner);
                }
            }
        }

        List<Net> nets = new ArrayList<>();
        for (Map.Entry<String, Set<Endpoint>> entry : netEndpoints.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            String name = entry.getKey();
            nets.add(new Net(name, !Net.isImplicitName(name), netClasses.getOrDefault(name, NetClass.SIGNAL),
                new ArrayList<>(entry.getValue())));
        }

        List<BoundaryPort> boundary = ports.stream().map(p -> new BoundaryPort(p, p)).toList();
        visiting.remove(fragment.fileName());
        log.debug("Interpreted {}: {} components, {} nets, {} sheets", fragment.fileName(),
            components.size(), nets.size(), instances.size());
        return new Circuit(components, nets, instances, boundary, annotations);
    }
}
