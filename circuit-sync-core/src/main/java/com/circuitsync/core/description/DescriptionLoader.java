package com.circuitsync.core.description;

import com.circuitsync.core.description.CircuitDescription.ComponentSpec;
import com.circuitsync.core.description.CircuitDescription.NetSpec;
import com.circuitsync.core.description.CircuitDescription.SubcircuitSpec;
import com.circuitsync.core.model.PinType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link CircuitDescription} from a YAML or JSON file.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * components:
 *   - ref: R1
 *     type: Device:R
 *     id: r1
 *     properties:
 *       Value: 10k
 * nets:
 *   - name: VIN
 *     connect: [R1.1, filter1.IN]
 *   - connect: [R1.2, C1.1]        # implicit net
 *   - name: GND
 *     power: true
 *     connect: [C1.2]
 * subcircuits:
 *   - name: filter1
 *     definition: rc_filter
 *     id: filter-1
 *     body:
 *       components:
 *         - ref: R1
 *           type: Device:R
 *       ports:
 *         - name: IN
 *           connect: [R1.1]
 * }</pre>
 *
 * <p>Endpoints are written {@code <reference>.<pin>} or {@code <instance>.<port>}.
 */
public final class DescriptionLoader {

    private static final Logger log = LoggerFactory.getLogger(DescriptionLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private DescriptionLoader() {
        // Utility class
    }

    /**
     * Loads a description file; {@code .json} files are read as JSON, anything else as YAML.
     *
     * @param path description file
     * @return the description
     * @throws IOException when the file cannot be read or parsed
     * @throws IllegalArgumentException when an endpoint names an unknown or ambiguous owner
     */
    public static CircuitDescription load(Path path) throws IOException {
        ObjectMapper mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
            ? JSON_MAPPER
            : YAML_MAPPER;
        log.debug("Loading description from: {}", path);
        DescriptionFile file = mapper.readValue(path.toFile(), DescriptionFile.class);
        if (file == null) {
            throw new IOException("Description file is empty: " + path);
        }
        CircuitDescription description = new CircuitDescription();
        apply(file, description);
        log.info("Loaded description from: {} ({} components, {} nets, {} sub-circuits)", path,
            description.components().size(), description.nets().size(), description.subcircuits().size());
        return description;
    }

    private static void apply(DescriptionFile file, CircuitDescription target) {
        Map<String, ComponentSpec> byReference = new HashMap<>();
        Map<String, Integer> referenceCounts = new HashMap<>();
        for (ComponentEntry entry : file.components()) {
            if (entry.ref() == null || entry.type() == null) {
                throw new IllegalArgumentException("Component entries need 'ref' and 'type'");
            }
            ComponentSpec spec = target.component(entry.ref(), entry.type());
            if (entry.id() != null) {
                spec.id(entry.id());
            }
            entry.properties().forEach(spec::property);
            entry.pins().forEach((number, type) -> spec.pin(number, PinType.fromToken(type)));
            byReference.put(entry.ref(), spec);
            referenceCounts.merge(entry.ref(), 1, Integer::sum);
        }

        Map<String, SubcircuitSpec> byName = new HashMap<>();
        for (SubcircuitEntry entry : file.subcircuits()) {
            if (entry.name() == null) {
                throw new IllegalArgumentException("Sub-circuit entries need 'name'");
            }
            SubcircuitSpec spec = target.subcircuit(entry.name(), entry.definition());
            if (entry.id() != null) {
                spec.id(entry.id());
            }
            entry.parameters().forEach(spec::parameter);
            if (entry.body() != null) {
                apply(entry.body(), spec.body());
            }
            byName.put(entry.name(), spec);
        }

        for (NetEntry entry : file.ports()) {
            if (entry.name() == null) {
                throw new IllegalArgumentException("Port entries need 'name'");
            }
            NetSpec port = target.port(entry.name());
            connect(port, entry, byReference, referenceCounts, byName);
        }
        for (NetEntry entry : file.nets()) {
            NetSpec net = entry.name() != null ? target.net(entry.name()) : target.net();
            connect(net, entry, byReference, referenceCounts, byName);
        }
    }

    private static void connect(NetSpec net, NetEntry entry, Map<String, ComponentSpec> byReference,
                                Map<String, Integer> referenceCounts, Map<String, SubcircuitSpec> byName) {
        if (Boolean.TRUE.equals(entry.power())) {
            net.power();
        }
        for (String endpoint : entry.connect()) {
            int dot = endpoint.lastIndexOf('.');
            if (dot <= 0 || dot == endpoint.length() - 1) {
                throw new IllegalArgumentException("Endpoint must be <owner>.<pin>: " + endpoint);
            }
            String owner = endpoint.substring(0, dot);
            String terminal = endpoint.substring(dot + 1);
            if (referenceCounts.getOrDefault(owner, 0) > 1) {
                throw new IllegalArgumentException("Endpoint owner is ambiguous: " + owner);
            }
            ComponentSpec component = byReference.get(owner);
            if (component != null) {
                net.connect(component, terminal);
                continue;
            }
            SubcircuitSpec instance = byName.get(owner);
            if (instance != null) {
                net.connect(instance, terminal);
                continue;
            }
            throw new IllegalArgumentException("Unknown endpoint owner: " + owner);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DescriptionFile(
        @JsonProperty("components") List<ComponentEntry> components,
        @JsonProperty("nets") List<NetEntry> nets,
        @JsonProperty("ports") List<NetEntry> ports,
        @JsonProperty("subcircuits") List<SubcircuitEntry> subcircuits
    ) {
        DescriptionFile {
            components = components == null ? List.of() : components;
            nets = nets == null ? List.of() : nets;
            ports = ports == null ? List.of() : ports;
            subcircuits = subcircuits == null ? List.of() : subcircuits;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ComponentEntry(
        @JsonProperty("ref") String ref,
        @JsonProperty("type") String type,
        @JsonProperty("id") String id,
        @JsonProperty("properties") Map<String, String> properties,
        @JsonProperty("pins") Map<String, String> pins
    ) {
        ComponentEntry {
            properties = properties == null ? Map.of() : properties;
            pins = pins == null ? Map.of() : pins;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NetEntry(
        @JsonProperty("name") String name,
        @JsonProperty("power") Boolean power,
        @JsonProperty("connect") List<String> connect
    ) {
        NetEntry {
            connect = connect == null ? List.of() : connect;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubcircuitEntry(
        @JsonProperty("name") String name,
        @JsonProperty("definition") String definition,
        @JsonProperty("id") String id,
        @JsonProperty("parameters") Map<String, String> parameters,
        @JsonProperty("body") DescriptionFile body
    ) {
        SubcircuitEntry {
            parameters = parameters == null ? Map.of() : parameters;
        }
    }
}
