package com.brush.matching.catalog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for walking untyped YAML trees.
 */
public final class YamlMaps {

    private YamlMaps() {
    }

    /**
     * Returns the value as a string-keyed mapping, preserving order.
     * A {@code null} value is treated as an empty mapping.
     *
     * @throws CatalogException if the value is not a mapping
     */
    public static Map<String, Object> asMapping(Object value, String where) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new CatalogException(where + ": expected a mapping, got "
                    + value.getClass().getSimpleName());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }
}
