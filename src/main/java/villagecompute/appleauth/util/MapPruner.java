/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.util;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Removes absent values from profile-style maps before they leave the adapter.
 *
 * <p>
 * An entry is dropped when its value is {@code null}, an empty string, an empty collection or a map that is empty
 * after its own pruning. Nested maps are pruned recursively. {@code false} and {@code 0} are values, not absences.
 */
public final class MapPruner {

    private MapPruner() {
        // Utility class, no instantiation
    }

    /**
     * Returns a pruned copy; the input is not modified. Insertion order is preserved.
     *
     * @param source
     *            map to prune, may be {@code null}
     * @return pruned copy (never {@code null})
     */
    public static Map<String, Object> prune(Map<String, ?> source) {
        Map<String, Object> pruned = new LinkedHashMap<>();
        if (source == null) {
            return pruned;
        }
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                value = prune(stringKeys(nested));
            }
            if (!isEmpty(value)) {
                pruned.put(entry.getKey(), value);
            }
        }
        return pruned;
    }

    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
