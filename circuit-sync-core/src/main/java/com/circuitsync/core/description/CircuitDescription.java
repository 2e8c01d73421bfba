package com.circuitsync.core.description;

import com.circuitsync.core.model.PinType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-built description of a circuit: components, nets and sub-circuit instances.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * CircuitDescription circuit = new CircuitDescription();
 * ComponentSpec r1 = circuit.component("R1", "Device:R").property("Value", "10k");
 * ComponentSpec c1 = circuit.component("C1", "Device:C").property("Value", "100n");
 * circuit.net("VIN").connect(r1, "1");
 * circuit.net().connect(r1, "2").connect(c1, "1");
 * circuit.net("GND").power().connect(c1, "2");
 *
 * SubcircuitSpec filter = circuit.subcircuit("filter1", "rc_filter").id("filter-1");
 * filter.body().port("IN").connect(filter.body().component("R1", "Device:R"), "1");
 * circuit.net("VIN").connect(filter, "IN");
 * }</pre>
 *
 * <p>A description is also the body of every sub-circuit instance. Ports declared with
 * {@link #port(String)} are the named nets through which the body connects to its parent.
 */
public class CircuitDescription {

    private final List<ComponentSpec> components = new ArrayList<>();
    private final Map<String, NetSpec> namedNets = new LinkedHashMap<>();
    private final List<NetSpec> nets = new ArrayList<>();
    private final List<SubcircuitSpec> subcircuits = new ArrayList<>();

    /**
     * Adds a component. A reference that is only a prefix ({@code R} or {@code R?}) is
     * numbered during synchronization.
     */
    public ComponentSpec component(String reference, String typeId) {
        ComponentSpec spec = new ComponentSpec(reference, typeId);
        components.add(spec);
        return spec;
    }

    /**
     * Returns the explicitly named net {@code name}, creating it on first use.
     */
    public NetSpec net(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return namedNets.computeIfAbsent(name, n -> {
            NetSpec spec = new NetSpec(n, false);
            nets.add(spec);
            return spec;
        });
    }

    /**
     * Creates an implicit net whose name is derived from its endpoints.
     */
    public NetSpec net() {
        NetSpec spec = new NetSpec(null, false);
        nets.add(spec);
        return spec;
    }

    /**
     * Declares a boundary port of this description. The returned net carries the port
     * name and connects internal pins to the parent through the instance.
     */
    public NetSpec port(String name) {
        NetSpec spec = net(name);
        spec.port = true;
        return spec;
    }

    public SubcircuitSpec subcircuit(String name, String definition) {
        SubcircuitSpec spec = new SubcircuitSpec(name, definition);
        subcircuits.add(spec);
        return spec;
    }

    public List<ComponentSpec> components() {
        return Collections.unmodifiableList(components);
    }

    public List<NetSpec> nets() {
        return Collections.unmodifiableList(nets);
    }

    public List<SubcircuitSpec> subcircuits() {
        return Collections.unmodifiableList(subcircuits);
    }

    /**
     * @return names of declared ports, in declaration order
     */
    public List<String> ports() {
        return nets.stream().filter(n -> n.port).map(n -> n.name).toList();
    }

    /**
     * A component of the description.
     */
    public static final class ComponentSpec {
        private final String reference;
        private final String typeId;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final Map<String, PinType> pins = new LinkedHashMap<>();
        private String id;

        ComponentSpec(String reference, String typeId) {
            this.reference = Objects.requireNonNull(reference, "reference must not be null");
            this.typeId = Objects.requireNonNull(typeId, "typeId must not be null");
        }

        /**
         * Sets a property. An empty value removes the property from the document.
         */
        public ComponentSpec property(String name, String value) {
            properties.put(name, value == null ? "" : value);
            return this;
        }

        /**
         * Sets the stable id, which survives renumbering and property edits.
         */
        public ComponentSpec id(String stableId) {
            this.id = stableId;
            return this;
        }

        /**
         * Declares a pin, used when the symbol library does not know the type id.
         */
        public ComponentSpec pin(String number, PinType type) {
            pins.put(number, type);
            return this;
        }

        public String reference() {
            return reference;
        }

        public String typeId() {
            return typeId;
        }

        public Map<String, String> properties() {
            return Collections.unmodifiableMap(properties);
        }

        public Map<String, PinType> pins() {
            return Collections.unmodifiableMap(pins);
        }

        public String id() {
            return id;
        }
    }

    /**
     * A net of the description.
     */
    public static final class NetSpec {
        private final String name;
        private final List<Connection> connections = new ArrayList<>();
        private boolean power;
        private boolean port;

        NetSpec(String name, boolean power) {
            this.name = name;
            this.power = power;
        }

        public NetSpec connect(ComponentSpec component, String pin) {
            connections.add(new Connection(component, null, pin));
            return this;
        }

        /**
         * Connects to a boundary port of a sub-circuit instance.
         */
        public NetSpec connect(SubcircuitSpec instance, String portName) {
            connections.add(new Connection(null, instance, portName));
            return this;
        }

        /**
         * Marks this net as a power rail, annotated with global labels.
         */
        public NetSpec power() {
            this.power = true;
            return this;
        }

        public String name() {
            return name;
        }

        public boolean isPower() {
            return power;
        }

        public boolean isPort() {
            return port;
        }

        public List<Connection> connections() {
            return Collections.unmodifiableList(connections);
        }
    }

    /**
     * One net connection: either a component pin or an instance port.
     *
     * @param component connected component, null for port connections
     * @param instance connected instance, null for pin connections
     * @param terminal pin number or port name
     */
    public record Connection(ComponentSpec component, SubcircuitSpec instance, String terminal) {
        public Connection {
            Objects.requireNonNull(terminal, "terminal must not be null");
        }
    }

    /**
     * A sub-circuit instance of the description.
     */
    public static final class SubcircuitSpec {
        private final String name;
        private final String definition;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private final CircuitDescription body = new CircuitDescription();
        private String id;

        SubcircuitSpec(String name, String definition) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.definition = definition == null ? name : definition;
        }

        public SubcircuitSpec id(String stableId) {
            this.id = stableId;
            return this;
        }

        public SubcircuitSpec parameter(String key, String value) {
            parameters.put(key, value);
            return this;
        }

        public CircuitDescription body() {
            return body;
        }

        public String name() {
            return name;
        }

        public String definition() {
            return definition;
        }

        public Map<String, String> parameters() {
            return Collections.unmodifiableMap(parameters);
        }

        public String id() {
            return id;
        }
    }
}
