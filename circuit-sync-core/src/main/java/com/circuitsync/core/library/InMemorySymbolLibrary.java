package com.circuitsync.core.library;

import com.circuitsync.core.model.Pin;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Symbol library backed by a map. Used for definitions embedded in a document and as
 * the injectable fake in tests.
 */
public class InMemorySymbolLibrary implements SymbolLibrary {

    private final Map<String, SymbolDefinition> definitions = new LinkedHashMap<>();

    public InMemorySymbolLibrary add(SymbolDefinition definition) {
        definitions.put(definition.typeId(), definition);
        return this;
    }

    /**
     * Registers a definition with the given pins and no default properties.
     */
    public InMemorySymbolLibrary add(String typeId, List<Pin> pins) {
        return add(SymbolDefinition.of(typeId, pins));
    }

    @Override
    public Optional<SymbolDefinition> resolve(String typeId) {
        return Optional.ofNullable(definitions.get(typeId));
    }

    public int size() {
        return definitions.size();
    }
}
