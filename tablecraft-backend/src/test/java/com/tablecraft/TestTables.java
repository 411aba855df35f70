package com.tablecraft;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for small in-memory tables used across tests.
 */
public final class TestTables {

    private TestTables() {
    }

    /**
     * Ordered record from alternating keys and values; values may be null.
     */
    public static Map<String, Object> row(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @SafeVarargs
    public static List<Map<String, Object>> table(Map<String, Object>... rows) {
        return new ArrayList<>(Arrays.asList(rows));
    }

    /**
     * Region sales used by the aggregate examples.
     */
    public static List<Map<String, Object>> regionSales() {
        return table(
                row("region", "North", "sales", 100, "product", "A"),
                row("region", "North", "sales", 150, "product", "B"),
                row("region", "South", "sales", 200, "product", "A"),
                row("region", "South", "sales", 120, "product", "B"));
    }

    public static List<Map<String, Object>> people() {
        return table(
                row("name", "Alice", "age", 30, "city", "New York"),
                row("name", "Bob", "age", 25, "city", "Los Angeles"),
                row("name", "Charlie", "age", 35, "city", "New York"));
    }

    public static List<String> columnsOf(Map<String, Object> row) {
        return new ArrayList<>(row.keySet());
    }
}
