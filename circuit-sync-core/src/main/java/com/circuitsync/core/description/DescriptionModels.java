package com.circuitsync.core.description;

import com.circuitsync.core.description.CircuitDescription.ComponentSpec;
import com.circuitsync.core.description.CircuitDescription.Connection;
import com.circuitsync.core.description.CircuitDescription.NetSpec;
import com.circuitsync.core.description.CircuitDescription.SubcircuitSpec;
import com.circuitsync.core.library.SymbolDefinition;
import com.circuitsync.core.library.SymbolLibrary;
import com.circuitsync.core.model.BoundaryPort;
import com.circuitsync.core.model.Circuit;
import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.EndpointKind;
import com.circuitsync.core.model.IdentityConflictException;
import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.Net;
import com.circuitsync.core.model.NetClass;
import com.circuitsync.core.model.Pin;
import com.circuitsync.core.model.PinType;
import com.circuitsync.core.model.SubcircuitInstance;
import com.circuitsync.core.model.SyncIssue;
import com.circuitsync.core.util.IdGenerator;
import com.circuitsync.core.util.References;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the desired model from a {@link CircuitDescription}.
 *
 * <p>The build is pure: it reads the description and the symbol library and returns a
 * new model. Every component and instance receives an identity. An explicit stable id
 * is hashed together with the namespace path, so two instances of one definition never
 * share identities. Without a stable id the identity is derived from the reference, or
 * for prefix-only references from the type id and the position among its siblings.
 */
public final class DescriptionModels {

    private static final Logger log = LoggerFactory.getLogger(DescriptionModels.class);

    /** Namespace path of the root circuit. */
    public static final String ROOT_NAMESPACE = "/";

    private static final BigDecimal PLACEHOLDER_PITCH = new BigDecimal("2.54");

    private DescriptionModels() {
        // Utility class
    }

    /**
     * Builds the desired model.
     *
     * @param description caller description
     * @param library symbol lookup
     * @return the model and any unresolved-reference warnings
     * @throws IdentityConflictException when two entities claim one identity or reference
     * @throws IllegalArgumentException when a net connects across namespaces, names an
     *     undeclared port or puts a pin on two nets
     */
    public static BuildResult fromDescription(CircuitDescription description, SymbolLibrary library) {
        List<SyncIssue> issues = new ArrayList<>();
        Circuit circuit = build(description, library, ROOT_NAMESPACE, issues);
        return new BuildResult(deriveImplicitNames(circuit), issues);
    }

    private static Circuit build(CircuitDescription description, SymbolLibrary library, String namespace,
                                 List<SyncIssue> issues) {
        Map<ComponentSpec, Component> components = new IdentityHashMap<>();
        List<Component> ordered = new ArrayList<>();
        Set<String> identities = new HashSet<>();
        Map<String, String> references = new HashMap<>();
        Map<String, Integer> autoOrdinals = new HashMap<>();
        Map<ComponentSpec, Set<String>> usedPins = usedPins(description);

        for (ComponentSpec spec : description.components()) {
            String reference = spec.reference();
            boolean prefixOnly = References.isPrefixOnly(reference);
            if (!prefixOnly && references.put(reference, reference) != null) {
                throw new IdentityConflictException(reference,
                    "Reference " + reference + " is claimed by two components in " + namespace);
            }
            String identity;
            if (spec.id() != null) {
                identity = IdGenerator.uuid(namespace, "component", spec.id());
            } else if (prefixOnly) {
                String prefix = References.prefix(reference);
                int ordinal = autoOrdinals.merge(prefix + "|" + spec.typeId(), 1, Integer::sum);
                identity = IdGenerator.uuid(namespace, "component", "auto", prefix, spec.typeId(), Integer.toString(ordinal));
            } else {
                identity = IdGenerator.uuid(namespace, "component", "ref", reference);
            }
            if (!identities.add(identity)) {
                throw new IdentityConflictException(spec.id() != null ? spec.id() : reference,
                    "Identity " + (spec.id() != null ? spec.id() : reference) + " is claimed twice in " + namespace);
            }

            List<Pin> pins = resolvePins(spec, library, usedPins.getOrDefault(spec, Set.of()), issues);
            Component component = new Component(identity, identity, reference, spec.typeId(),
                spec.properties(), null, pins);
            components.put(spec, component);
            ordered.add(component);
        }

        Map<SubcircuitSpec, SubcircuitInstance> instances = new IdentityHashMap<>();
        List<SubcircuitInstance> orderedInstances = new ArrayList<>();
        Set<String> instanceNames = new HashSet<>();
        for (SubcircuitSpec spec : description.subcircuits()) {
            String identity = spec.id() != null
                ? IdGenerator.uuid(namespace, "sheet", spec.id())
                : IdGenerator.uuid(namespace, "sheet", "name", spec.name());
            if (!identities.add(identity) || !instanceNames.add(spec.name())) {
                throw new IdentityConflictException(spec.id() != null ? spec.id() : spec.name(),
                    "Sub-circuit instance " + spec.name() + " is declared twice in " + namespace);
            }
            Circuit body = build(spec.body(), library, namespace + identity + "/", issues);
            SubcircuitInstance instance = new SubcircuitInstance(identity, identity, spec.name(), spec.definition(),
                spec.parameters(), spec.body().ports(), body, null, null);
            instances.put(spec, instance);
            orderedInstances.add(instance);
        }

        List<Net> nets = new ArrayList<>();
        Map<Endpoint, NetSpec> owners = new HashMap<>();
        int implicitIndex = 0;
        for (NetSpec spec : description.nets()) {
            List<Endpoint> endpoints = new ArrayList<>();
            String label = spec.name() != null ? spec.name() : "<implicit>";
            for (Connection connection : spec.connections()) {
                Endpoint endpoint = toEndpoint(connection, components, instances, label, issues);
                if (endpoint == null) {
                    continue;
                }
                NetSpec previous = owners.putIfAbsent(endpoint, spec);
                if (previous != null && previous != spec) {
                    String previousLabel = previous.name() != null ? previous.name() : "<implicit>";
                    throw new IllegalArgumentException("Pin " + describe(endpoint, components, instances)
                        + " is connected to nets '" + previousLabel + "' and '" + label + "'");
                }
                endpoints.add(endpoint);
            }
            int weight = new TreeSet<>(endpoints).size() + (spec.isPort() ? 1 : 0);
            if (weight < 2) {
                log.debug("Dropping net {} with fewer than two endpoints", label);
                continue;
            }
            NetClass netClass = spec.isPower() ? NetClass.POWER : NetClass.SIGNAL;
            String name = spec.name() != null ? spec.name() : "~implicit-" + (implicitIndex++);
            nets.add(new Net(name, spec.name() != null, netClass, endpoints));
        }

        List<BoundaryPort> ports = description.ports().stream()
            .map(port -> new BoundaryPort(port, port))
            .toList();
        return new Circuit(ordered, nets, orderedInstances, ports, List.of());
    }

    private static Map<ComponentSpec, Set<String>> usedPins(CircuitDescription description) {
        Map<ComponentSpec, Set<String>> used = new IdentityHashMap<>();
        for (NetSpec net : description.nets()) {
            for (Connection connection : net.connections()) {
                if (connection.component() != null) {
                    used.computeIfAbsent(connection.component(), c -> new TreeSet<>(References.NATURAL_ORDER))
                        .add(connection.terminal());
                }
            }
        }
        return used;
    }

    private static List<Pin> resolvePins(ComponentSpec spec, SymbolLibrary library, Set<String> usedPins,
                                         List<SyncIssue> issues) {
        Optional<SymbolDefinition> definition = library.resolve(spec.typeId());
        if (definition.isPresent()) {
            return definition.get().pins();
        }
        issues.add(SyncIssue.of(IssueKind.UNRESOLVED_REFERENCE, spec.reference(),
            "Symbol '" + spec.typeId() + "' not found, using a placeholder pin signature"));
        log.warn("Symbol {} for {} not found in library", spec.typeId(), spec.reference());

        Map<String, PinType> declared = new LinkedHashMap<>(spec.pins());
        for (String pin : usedPins) {
            declared.putIfAbsent(pin, PinType.PASSIVE);
        }
        List<String> numbers = new ArrayList<>(declared.keySet());
        numbers.sort(References.NATURAL_ORDER);
        return placeholderPins(numbers, declared);
    }

    /**
     * Pins stacked vertically at a fixed pitch, pointing left.
     */
    static List<Pin> placeholderPins(List<String> numbers, Map<String, PinType> types) {
        List<Pin> pins = new ArrayList<>(numbers.size());
        for (int i = 0; i < numbers.size(); i++) {
            String number = numbers.get(i);
            BigDecimal y = PLACEHOLDER_PITCH.multiply(BigDecimal.valueOf(i)).negate();
            pins.add(new Pin(number, "", types.getOrDefault(number, PinType.PASSIVE),
                PLACEHOLDER_PITCH.negate(), y, 0));
        }
        return pins;
    }

    private static Endpoint toEndpoint(Connection connection, Map<ComponentSpec, Component> components,
                                       Map<SubcircuitSpec, SubcircuitInstance> instances, String net,
                                       List<SyncIssue> issues) {
        if (connection.component() != null) {
            Component component = components.get(connection.component());
            if (component == null) {
                throw new IllegalArgumentException("Net '" + net + "' connects "
                    + connection.component().reference() + " which belongs to another circuit");
            }
            if (component.pin(connection.terminal()).isEmpty()) {
                issues.add(SyncIssue.of(IssueKind.UNRESOLVED_REFERENCE, component.reference(),
                    "Pin " + connection.terminal() + " not found on " + component.typeId()));
                return null;
            }
            return Endpoint.pin(component.key(), connection.terminal());
        }
        SubcircuitInstance instance = instances.get(connection.instance());
        if (instance == null) {
            throw new IllegalArgumentException("Net '" + net + "' connects instance "
                + connection.instance().name() + " which belongs to another circuit");
        }
        if (!instance.ports().contains(connection.terminal())) {
            throw new IllegalArgumentException("Instance " + instance.name() + " has no port '"
                + connection.terminal() + "'");
        }
        return Endpoint.port(instance.key(), connection.terminal());
    }

    private static String describe(Endpoint endpoint, Map<ComponentSpec, Component> components,
                                   Map<SubcircuitSpec, SubcircuitInstance> instances) {
        if (endpoint.kind() == EndpointKind.PIN) {
            return components.values().stream().filter(c -> c.key().equals(endpoint.ownerKey()))
                .findFirst().map(c -> c.reference() + "." + endpoint.terminal()).orElse(endpoint.toString());
        }
        return instances.values().stream().filter(i -> i.key().equals(endpoint.ownerKey()))
            .findFirst().map(i -> i.name() + "." + endpoint.terminal()).orElse(endpoint.toString());
    }

    /**
     * Renames every implicit net after its lexicographically first endpoint, recursively.
     *
     * <p>Pin endpoints are ordered by (reference, pin number); a net made only of ports is
     * named after the first (instance name, port).
     */
    public static Circuit deriveImplicitNames(Circuit circuit) {
        List<Net> nets = new ArrayList<>();
        for (Net net : circuit.nets()) {
            if (net.explicitName()) {
                nets.add(net);
                continue;
            }
            nets.add(net.withName(implicitName(circuit, net), false));
        }
        List<SubcircuitInstance> instances = new ArrayList<>();
        for (SubcircuitInstance instance : circuit.instances()) {
            instances.add(new SubcircuitInstance(instance.key(), instance.identity(), instance.name(),
                instance.definition(), instance.parameters(), instance.ports(),
                deriveImplicitNames(instance.body()), instance.position(), instance.fileName()));
        }
        return new Circuit(circuit.components(), nets, instances, circuit.ports(), circuit.annotations());
    }

    private static String implicitName(Circuit circuit, Net net) {
        Comparator<String[]> order = Comparator.<String[], String>comparing(a -> a[0])
            .thenComparing(a -> a[1], References.NATURAL_ORDER);
        Optional<String[]> firstPin = net.endpoints().stream()
            .filter(e -> e.kind() == EndpointKind.PIN)
            .map(e -> new String[] {
                circuit.component(e.ownerKey()).map(Component::reference).orElse(e.ownerKey()), e.terminal()})
            .min(order);
        if (firstPin.isPresent()) {
            return Net.implicitName(firstPin.get()[0], firstPin.get()[1]);
        }
        return net.endpoints().stream()
            .map(e -> new String[] {
                circuit.instance(e.ownerKey()).map(SubcircuitInstance::name).orElse(e.ownerKey()), e.terminal()})
            .min(order)
            .map(a -> Net.IMPLICIT_PREFIX + a[0] + "-" + a[1] + ")")
            .orElse(net.name());
    }
}
