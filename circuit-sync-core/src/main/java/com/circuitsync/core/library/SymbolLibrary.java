package com.circuitsync.core.library;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of symbol definitions by type id.
 *
 * <p>A miss is not an error: callers fall back to a placeholder signature built from
 * the type id alone.
 */
public interface SymbolLibrary {

    /**
     * @param typeId fully qualified id such as {@code Device:R}
     * @return the definition, or empty when the library does not know the id
     */
    Optional<SymbolDefinition> resolve(String typeId);

    /**
     * Library that asks each of {@code libraries} in order and returns the first hit.
     */
    static SymbolLibrary chain(SymbolLibrary... libraries) {
        List<SymbolLibrary> ordered = List.of(libraries);
        return typeId -> {
            for (SymbolLibrary library : ordered) {
                Optional<SymbolDefinition> hit = library.resolve(typeId);
                if (hit.isPresent()) {
                    return hit;
                }
            }
            return Optional.empty();
        };
    }

    /**
     * Library that never resolves anything.
     */
    static SymbolLibrary none() {
        return typeId -> Optional.empty();
    }
}
