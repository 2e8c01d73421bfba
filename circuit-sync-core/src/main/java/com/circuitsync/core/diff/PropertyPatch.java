package com.circuitsync.core.diff;

import java.util.Map;
import java.util.Set;

/**
 * Minimal attribute delta of a matched component. Fields that do not change are null or empty.
 *
 * @param reference new reference label, null when unchanged
 * @param typeId new type id, null when unchanged
 * @param set properties to set
 * @param removed properties to remove
 */
public record PropertyPatch(String reference, String typeId, Map<String, String> set, Set<String> removed) {

    private static final PropertyPatch EMPTY = new PropertyPatch(null, null, Map.of(), Set.of());

    public PropertyPatch {
        set = set == null ? Map.of() : Map.copyOf(set);
        removed = removed == null ? Set.of() : Set.copyOf(removed);
    }

    public static PropertyPatch empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return reference == null && typeId == null && set.isEmpty() && removed.isEmpty();
    }
}
