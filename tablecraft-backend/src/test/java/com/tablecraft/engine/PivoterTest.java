package com.tablecraft.engine;

import com.tablecraft.model.Statistic;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tablecraft.TestTables.columnsOf;
import static com.tablecraft.TestTables.row;
import static com.tablecraft.TestTables.table;
import static org.junit.jupiter.api.Assertions.*;

public class PivoterTest {

    private final SchemaInference schemaInference = new SchemaInference();
    private final Pivoter pivoter = new Pivoter(schemaInference);
    private final Aggregator aggregator = new Aggregator(schemaInference);

    private static List<Map<String, Object>> sales() {
        return table(
                row("region", "North", "product", "A", "sales", 100),
                row("region", "North", "product", "B", "sales", 150),
                row("region", "South", "product", "A", "sales", 200),
                row("region", "South", "product", "C", "sales", 120),
                row("region", "North", "product", "A", "sales", 50));
    }

    @Test
    void testPivotFillsUnseenCombinationsWithNull() {
        Pivoter.PivotTable out = pivoter.pivot(sales(), "region", "product", "sales", Statistic.SUM);

        assertEquals(2, out.getData().size());
        Map<String, Object> north = out.getData().get(0);
        Map<String, Object> south = out.getData().get(1);
        assertEquals(List.of("region", "A", "B", "C"), columnsOf(north));
        assertEquals(List.of("region", "A", "B", "C"), columnsOf(south));

        assertEquals("North", north.get("region"));
        assertEquals(150L, north.get("A"));
        assertEquals(150L, north.get("B"));
        assertNull(north.get("C"));
        assertTrue(north.containsKey("C"));

        assertEquals(200L, south.get("A"));
        assertNull(south.get("B"));
        assertEquals(120L, south.get("C"));
        assertEquals(List.of("A", "B", "C"), out.getPivotColumnNames());
    }

    @Test
    void testPivotWithMeanAndCount() {
        Pivoter.PivotTable mean = pivoter.pivot(sales(), "region", "product", "sales", Statistic.MEAN);
        assertEquals(75.0, mean.getData().get(0).get("A"));

        Pivoter.PivotTable count = pivoter.pivot(sales(), "region", "product", "sales", Statistic.COUNT);
        assertEquals(2L, count.getData().get(0).get("A"));
        assertEquals(1L, count.getData().get(1).get("C"));
    }

    @Test
    void testPivotMatchesAggregateOfSameBuckets() {
        Pivoter.PivotTable wide = pivoter.pivot(sales(), "region", "product", "sales", Statistic.SUM);
        Map<String, List<Statistic>> aggregations = new LinkedHashMap<>();
        aggregations.put("sales", List.of(Statistic.SUM));
        List<Map<String, Object>> longForm = aggregator.aggregate(sales(), List.of("region", "product"), aggregations);

        int filled = 0;
        for (Map<String, Object> row : wide.getData()) {
            for (String column : wide.getPivotColumnNames()) {
                if (row.get(column) != null) {
                    filled++;
                }
            }
        }
        assertEquals(longForm.size(), filled);
        for (Map<String, Object> cell : longForm) {
            Map<String, Object> wideRow = wide.getData().stream()
                    .filter(r -> r.get("region").equals(cell.get("region")))
                    .findFirst()
                    .orElseThrow();
            assertEquals(cell.get("sales"), wideRow.get((String) cell.get("product")));
        }
    }

    @Test
    void testNumericPivotValuesBecomeColumnNames() {
        Pivoter.PivotTable out = pivoter.pivot(table(
                row("store", "s1", "year", 2023, "revenue", 1.5),
                row("store", "s1", "year", 2024, "revenue", 2.5),
                row("store", "s2", "year", 2023.0, "revenue", 4)), "store", "year", "revenue", Statistic.MAX);

        assertEquals(List.of("2023", "2024"), out.getPivotColumnNames());
        assertEquals(4, out.getData().get(1).get("2023"));
        assertNull(out.getData().get(1).get("2024"));
    }

    @Test
    void testRecordsWithNullIndexOrPivotAreSkipped() {
        Pivoter.PivotTable out = pivoter.pivot(table(
                row("k", "a", "p", "x", "v", 1),
                row("k", null, "p", "x", "v", 2),
                row("k", "a", "v", 3)), "k", "p", "v", Statistic.SUM);

        assertEquals(2, out.getSkippedRows());
        assertEquals(List.of(row("k", "a", "x", 1L)), out.getData());
    }

    @Test
    void testMissingColumnsFail() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> pivoter.pivot(sales(), "region", "category", "sales", Statistic.SUM));
        assertTrue(e.getMessage().contains("category"));
    }

    @Test
    void testPivotValuesWithSameNameFail() {
        assertThrows(ValidationException.class, () -> pivoter.pivot(table(
                row("k", "a", "p", 1, "v", 1),
                row("k", "a", "p", "1", "v", 2)), "k", "p", "v", Statistic.SUM));
    }

    @Test
    void testPivotValueNamedLikeIndexFails() {
        assertThrows(ValidationException.class, () -> pivoter.pivot(table(
                row("k", "a", "p", "k", "v", 1)), "k", "p", "v", Statistic.SUM));
    }

    @Test
    void testEmptyTable() {
        Pivoter.PivotTable out = pivoter.pivot(table(), "k", "p", "v", Statistic.SUM);
        assertTrue(out.getData().isEmpty());
    }
}
