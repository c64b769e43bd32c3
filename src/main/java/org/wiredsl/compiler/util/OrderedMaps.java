package org.wiredsl.compiler.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for immutable maps that keep insertion order, which {@link Map#copyOf(Map)} does not.
 */
public final class OrderedMaps {

    private OrderedMaps() {}

    /**
     * @param source The map to copy, may be null.
     * @return An unmodifiable, insertion ordered copy; empty if {@code source} is null.
     */
    public static <K, V> Map<K, V> copyOf(Map<K, V> source) {
        if (source == null || source.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
