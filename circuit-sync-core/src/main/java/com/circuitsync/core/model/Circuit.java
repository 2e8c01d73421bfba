package com.circuitsync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * One namespace of the canonical circuit model: the root circuit or the body of a
 * sub-circuit instance.
 *
 * <p>Components, nets and instances are held in flat collections indexed by key.
 * Endpoints name their owners by key, so the graph has no object cycles and every
 * lookup is a map access. Construction checks that keys are unique and that no
 * endpoint belongs to two nets.
 */
public final class Circuit {

    private static final Circuit EMPTY = new Circuit(List.of(), List.of(), List.of(), List.of(), List.of());

    private final Map<String, Component> components;
    private final Map<String, Net> nets;
    private final Map<Endpoint, Net> netByEndpoint;
    private final Map<String, SubcircuitInstance> instances;
    private final List<BoundaryPort> ports;
    private final List<Annotation> annotations;

    /**
     * @param components components of this namespace
     * @param nets nets of this namespace
     * @param instances nested sub-circuit instances
     * @param ports boundary ports this namespace exposes to its parent
     * @param annotations connectivity markers read from the backing document, empty for desired circuits
     * @throws IllegalArgumentException when a key repeats or an endpoint is in two nets
     */
    public Circuit(
        List<Component> components,
        List<Net> nets,
        List<SubcircuitInstance> instances,
        List<BoundaryPort> ports,
        List<Annotation> annotations
    ) {
        this.components = index(components, Component::key, "component");
        this.nets = index(nets, Net::name, "net");
        this.instances = index(instances, SubcircuitInstance::key, "instance");
        this.ports = List.copyOf(ports);
        this.annotations = List.copyOf(annotations);

        Map<Endpoint, Net> byEndpoint = new HashMap<>();
        for (Net net : this.nets.values()) {
            for (Endpoint endpoint : net.endpoints()) {
                Net previous = byEndpoint.put(endpoint, net);
                if (previous != null) {
                    throw new IllegalArgumentException("Endpoint " + endpoint + " belongs to nets '"
                        + previous.name() + "' and '" + net.name() + "'");
                }
            }
        }
        this.netByEndpoint = Collections.unmodifiableMap(byEndpoint);
    }

    public static Circuit empty() {
        return EMPTY;
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> key, String kind) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T item : items) {
            if (map.put(key.apply(item), item) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " key: " + key.apply(item));
            }
        }
        return Collections.unmodifiableMap(map);
    }

    public List<Component> components() {
        return List.copyOf(components.values());
    }

    public Optional<Component> component(String key) {
        return Optional.ofNullable(components.get(key));
    }

    public List<Net> nets() {
        return List.copyOf(nets.values());
    }

    public Optional<Net> net(String name) {
        return Optional.ofNullable(nets.get(name));
    }

    public Optional<Net> netOf(Endpoint endpoint) {
        return Optional.ofNullable(netByEndpoint.get(endpoint));
    }

    public List<SubcircuitInstance> instances() {
        return List.copyOf(instances.values());
    }

    public Optional<SubcircuitInstance> instance(String key) {
        return Optional.ofNullable(instances.get(key));
    }

    public List<BoundaryPort> ports() {
        return ports;
    }

    public List<Annotation> annotations() {
        return annotations;
    }

    public Optional<BoundaryPort> portForNet(String netName) {
        return ports.stream().filter(p -> p.internalNet().equals(netName)).findFirst();
    }

    /**
     * @return true when this namespace has no components and no instances
     */
    public boolean isEmpty() {
        return components.isEmpty() && instances.isEmpty();
    }

    /**
     * Returns a copy with one component replaced by key.
     */
    public Circuit withComponent(Component component) {
        List<Component> copy = new ArrayList<>(components.values());
        copy.replaceAll(c -> c.key().equals(component.key()) ? component : c);
        return new Circuit(copy, nets(), instances(), ports, annotations);
    }

    @Override
    public String toString() {
        return "Circuit[components=" + components.size() + ", nets=" + nets.size()
            + ", instances=" + instances.size() + ", ports=" + ports.size() + "]";
    }
}
