package com.tablecraft.engine;

import com.tablecraft.model.Schema;
import com.tablecraft.model.Statistic;
import com.tablecraft.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reshapes long-form records into a wide table.
 *
 * <p>One output row per distinct index value, one output column per distinct pivot value, both
 * in first-seen order. Cells hold the reduced {@code values} of their (index, pivot) bucket, or
 * null when the combination never occurred.
 */
@Component
public class Pivoter {

    private final SchemaInference schemaInference;

    public Pivoter(SchemaInference schemaInference) {
        this.schemaInference = schemaInference;
    }

    /**
     * Result of a pivot: the wide table, the pivot-derived column names and the number of input
     * records skipped because their index or pivot value was null.
     */
    public static final class PivotTable {
        private final List<Map<String, Object>> data;
        private final List<String> pivotColumnNames;
        private final int skippedRows;

        PivotTable(List<Map<String, Object>> data, List<String> pivotColumnNames, int skippedRows) {
            this.data = data;
            this.pivotColumnNames = pivotColumnNames;
            this.skippedRows = skippedRows;
        }

        public List<Map<String, Object>> getData() {
            return data;
        }

        public List<String> getPivotColumnNames() {
            return pivotColumnNames;
        }

        public int getSkippedRows() {
            return skippedRows;
        }
    }

    public PivotTable pivot(
            List<Map<String, Object>> table,
            String index,
            String pivotColumns,
            String values,
            Statistic aggfunc
    ) {
        if (table.isEmpty()) {
            return new PivotTable(new ArrayList<>(), new ArrayList<>(), 0);
        }
        Schema schema = schemaInference.infer(table);
        schemaInference.requireColumns(schema, List.of(index, pivotColumns, values), "pivot");

        Map<GroupKey, Object> indexValues = new LinkedHashMap<>();
        Map<GroupKey, String> pivotNames = new LinkedHashMap<>();
        Map<String, GroupKey> namesTaken = new LinkedHashMap<>();
        Map<GroupKey, Map<GroupKey, List<Object>>> cells = new LinkedHashMap<>();
        int skipped = 0;

        for (Map<String, Object> record : table) {
            Object indexValue = Values.get(record, index);
            Object pivotValue = Values.get(record, pivotColumns);
            if (indexValue == null || pivotValue == null) {
                skipped++;
                continue;
            }
            GroupKey indexKey = GroupKey.of(indexValue);
            GroupKey pivotKey = GroupKey.of(pivotValue);
            indexValues.putIfAbsent(indexKey, indexValue);
            if (!pivotNames.containsKey(pivotKey)) {
                String name = Values.asString(pivotValue);
                if (name.equals(index)) {
                    throw new ValidationException("Pivot value '" + name + "' collides with the index column name");
                }
                GroupKey owner = namesTaken.putIfAbsent(name, pivotKey);
                if (owner != null) {
                    throw new ValidationException("Pivot values " + owner + " and " + pivotKey
                            + " both map to column name '" + name + "'");
                }
                pivotNames.put(pivotKey, name);
            }
            cells.computeIfAbsent(indexKey, k -> new LinkedHashMap<>())
                    .computeIfAbsent(pivotKey, k -> new ArrayList<>())
                    .add(Values.get(record, values));
        }

        List<Map<String, Object>> out = new ArrayList<>(indexValues.size());
        for (Map.Entry<GroupKey, Object> indexEntry : indexValues.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(index, indexEntry.getValue());
            Map<GroupKey, List<Object>> rowCells = cells.get(indexEntry.getKey());
            for (Map.Entry<GroupKey, String> pivotEntry : pivotNames.entrySet()) {
                List<Object> bucket = rowCells.get(pivotEntry.getKey());
                row.put(pivotEntry.getValue(), bucket == null ? null : Statistics.reduce(aggfunc, bucket, values));
            }
            out.add(row);
        }
        return new PivotTable(out, new ArrayList<>(pivotNames.values()), skipped);
    }
}
