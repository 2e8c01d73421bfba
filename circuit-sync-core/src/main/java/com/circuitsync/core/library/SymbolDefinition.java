package com.circuitsync.core.library;

import com.circuitsync.core.model.Pin;
import com.circuitsync.core.sexpr.SNode.SList;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A library symbol: pin signature, default properties and the tree embedded into a
 * schematic's {@code lib_symbols} section.
 *
 * @param typeId fully qualified id such as {@code Device:R}
 * @param pins pins of unit 1 and of the common unit
 * @param properties default property values (Reference prefix, Value, Footprint, ...)
 * @param librarySymbol symbol tree named {@code typeId}, ready for embedding
 */
public record SymbolDefinition(
    String typeId,
    List<Pin> pins,
    Map<String, String> properties,
    SList librarySymbol
) {
    public SymbolDefinition {
        Objects.requireNonNull(typeId, "typeId must not be null");
        pins = pins == null ? List.of() : List.copyOf(pins);
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        if (librarySymbol == null) {
            librarySymbol = LibSymbolCodec.synthesize(typeId, pins, properties);
        }
    }

    /**
     * Definition without an embedded tree; one is synthesized from the pins.
     */
    public static SymbolDefinition of(String typeId, List<Pin> pins) {
        return new SymbolDefinition(typeId, pins, Map.of(), null);
    }

    public Optional<Pin> pin(String number) {
        return pins.stream().filter(p -> p.number().equals(number)).findFirst();
    }
}
