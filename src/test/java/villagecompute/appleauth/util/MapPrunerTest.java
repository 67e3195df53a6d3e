/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class MapPrunerTest {

    @Test
    void testPrune_nestedNulls() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("c", null);
        nested.put("d", 1);
        Map<String, Object> input = new HashMap<>();
        input.put("a", null);
        input.put("b", nested);

        assertEquals(Map.of("b", Map.of("d", 1)), MapPruner.prune(input));
    }

    @Test
    void testPrune_isIdempotent() {
        Map<String, Object> input = new HashMap<>();
        input.put("name", "");
        input.put("tags", List.of());
        input.put("profile", Map.of("first", "Ada", "empty", Map.of()));

        Map<String, Object> once = MapPruner.prune(input);

        assertEquals(once, MapPruner.prune(once));
        assertEquals(Map.of("profile", Map.of("first", "Ada")), once);
    }

    @Test
    void testPrune_keepsFalseAndZero() {
        Map<String, Object> input = Map.of("email_verified", false, "count", 0);

        assertEquals(input, MapPruner.prune(input));
    }

    @Test
    void testPrune_mapEmptiedByPruningIsRemoved() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("x", null);
        Map<String, Object> input = new HashMap<>();
        input.put("outer", Map.of("inner", inner));

        assertTrue(MapPruner.prune(input).isEmpty());
    }
}
