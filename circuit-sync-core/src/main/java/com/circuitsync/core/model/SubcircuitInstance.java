package com.circuitsync.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named invocation of a sub-circuit definition, owning a private namespace.
 *
 * @param key arena key, unique within the parent circuit
 * @param identity stable identity, null when not yet assigned
 * @param name instance name shown on the sheet
 * @param definition name of the sub-circuit definition
 * @param parameters instantiation parameters
 * @param ports names of the boundary ports, in declaration order
 * @param body the instance's own circuit
 * @param position sheet position in the parent, null when never placed
 * @param fileName backing fragment file name, null when not yet assigned
 */
public record SubcircuitInstance(
    String key,
    String identity,
    String name,
    String definition,
    Map<String, String> parameters,
    List<String> ports,
    Circuit body,
    Position position,
    String fileName
) {
    public SubcircuitInstance {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (definition == null) {
            definition = name;
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        ports = ports == null ? List.of() : List.copyOf(ports);
        if (body == null) {
            body = Circuit.empty();
        }
    }

    public SubcircuitInstance withIdentity(String newIdentity) {
        return new SubcircuitInstance(key, newIdentity, name, definition, parameters, ports, body, position, fileName);
    }
}
