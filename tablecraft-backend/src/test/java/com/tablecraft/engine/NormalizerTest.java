package com.tablecraft.engine;

import com.tablecraft.model.NormalizationMethod;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.tablecraft.TestTables.row;
import static com.tablecraft.TestTables.table;
import static org.junit.jupiter.api.Assertions.*;

public class NormalizerTest {

    private final Normalizer normalizer = new Normalizer(new SchemaInference());

    private static List<Map<String, Object>> column(String name, Object... values) {
        List<Map<String, Object>> rows = table();
        for (Object v : values) {
            rows.add(row("id", rows.size(), name, v));
        }
        return rows;
    }

    private static List<Object> values(List<Map<String, Object>> rows, String name) {
        return rows.stream().map(r -> r.get(name)).collect(Collectors.toList());
    }

    private static void assertDoubles(List<Double> expected, List<Object> actual) {
        assertEquals(expected.size(), actual.size());
        for (int i = 0; i < expected.size(); i++) {
            assertEquals(expected.get(i), (Double) actual.get(i), 1e-9, "index " + i);
        }
    }

    @Test
    void testMinMax() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 10, 20, 30), List.of("x"), NormalizationMethod.MIN_MAX);
        assertEquals(List.of(0.0, 0.5, 1.0), values(out.getData(), "x"));
    }

    @Test
    void testMinMaxOfConstantColumnIsZero() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 7, 7), List.of("x"), NormalizationMethod.MIN_MAX);
        assertEquals(List.of(0.0, 0.0), values(out.getData(), "x"));
    }

    @Test
    void testMinMaxRescalesAgainRatherThanBeingIdempotent() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 0.2, 0.5, 0.8), List.of("x"), NormalizationMethod.MIN_MAX);
        assertDoubles(List.of(0.0, 0.5, 1.0), values(out.getData(), "x"));
    }

    @Test
    void testZScoreUsesPopulationStd() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 1, 2, 3), List.of("x"), NormalizationMethod.Z_SCORE);
        double std = Math.sqrt(2.0 / 3.0);
        assertDoubles(List.of(-1 / std, 0.0, 1 / std), values(out.getData(), "x"));
    }

    @Test
    void testZScoreOfConstantColumnIsZero() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 5, 5, 5), List.of("x"), NormalizationMethod.Z_SCORE);
        assertEquals(List.of(0.0, 0.0, 0.0), values(out.getData(), "x"));
    }

    @Test
    void testRobustUsesMedianAndInterquartileRange() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 1, 2, 3, 4, 5), List.of("x"), NormalizationMethod.ROBUST);
        assertDoubles(List.of(-1.0, -0.5, 0.0, 0.5, 1.0), values(out.getData(), "x"));
    }

    @Test
    void testRobustWithZeroIqrIsZero() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 4, 4, 4, 4, 9), List.of("x"), NormalizationMethod.ROBUST);
        assertEquals(List.of(0.0, 0.0, 0.0, 0.0, 0.0), values(out.getData(), "x"));
    }

    @Test
    void testNullsAndNonNumbersPassThrough() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 0, null, "n/a", 10), List.of("x"), NormalizationMethod.MIN_MAX);
        assertEquals(Arrays.asList(0.0, null, "n/a", 1.0), values(out.getData(), "x"));
    }

    @Test
    void testOnlyRequestedColumnsChange() {
        List<Map<String, Object>> input = table(
                row("name", "A", "price", 100, "qty", 10),
                row("name", "B", "price", 200, "qty", 5),
                row("name", "C", "qty", 8));
        Normalizer.NormalizedTable out = normalizer.normalize(input, List.of("price"), NormalizationMethod.MIN_MAX);

        assertEquals(3, out.getData().size());
        assertEquals(List.of("A", "B", "C"), values(out.getData(), "name"));
        assertEquals(List.of(10, 5, 8), values(out.getData(), "qty"));
        assertFalse(out.getData().get(2).containsKey("price"));
        assertEquals(100, input.get(0).get("price"));
    }

    @Test
    void testStatisticsDescribeOriginalValues() {
        Normalizer.NormalizedTable out = normalizer.normalize(column("x", 10, 20, 30), List.of("x", "x"), NormalizationMethod.MIN_MAX);

        assertEquals(List.of("x"), out.getColumns());
        Map<String, Object> stats = out.getStatistics().get("x");
        assertEquals(10, stats.get("min"));
        assertEquals(30, stats.get("max"));
        assertEquals(20.0, stats.get("mean"));
        assertEquals(20.0, stats.get("median"));
        assertEquals(0.5, (Double) stats.get("normalized_mean"), 1e-12);
    }

    @Test
    void testMissingColumnFails() {
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(column("x", 1, 2), List.of("y"), NormalizationMethod.MIN_MAX));
    }

    @Test
    void testColumnWithoutNumbersFails() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> normalizer.normalize(column("x", "a", null), List.of("x"), NormalizationMethod.Z_SCORE));
        assertTrue(e.getMessage().contains("x"));
    }

    @Test
    void testEmptyColumnListFails() {
        assertThrows(ValidationException.class,
                () -> normalizer.normalize(column("x", 1), List.of(), NormalizationMethod.MIN_MAX));
    }
}
