package com.tablecraft.engine;

import com.tablecraft.model.Schema;
import com.tablecraft.model.Statistic;
import com.tablecraft.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Groups records by key columns and reduces value columns with named statistics.
 *
 * <p>Buckets are emitted in the order their key was first seen while scanning the input.
 */
@Component
public class Aggregator {

    static final String ROW_COUNT_COLUMN = "count";

    private final SchemaInference schemaInference;

    public Aggregator(SchemaInference schemaInference) {
        this.schemaInference = schemaInference;
    }

    /**
     * Aggregates a table.
     *
     * @param table input table
     * @param groupBy grouping columns, non-empty
     * @param aggregations column to statistics, in output order; empty means row count per group
     * @return one row per distinct group key
     */
    public List<Map<String, Object>> aggregate(
            List<Map<String, Object>> table,
            List<String> groupBy,
            Map<String, List<Statistic>> aggregations
    ) {
        if (groupBy == null || groupBy.isEmpty()) {
            throw new ValidationException("group_by must name at least one column");
        }
        List<String> keys = new ArrayList<>(new LinkedHashSet<>(groupBy));

        if (!table.isEmpty() && !aggregations.isEmpty()) {
            Schema schema = schemaInference.infer(table);
            schemaInference.requireColumns(schema, new ArrayList<>(aggregations.keySet()), "aggregation");
        }

        List<OutputColumn> outputs = outputColumns(keys, aggregations);

        Map<GroupKey, List<Map<String, Object>>> buckets = new LinkedHashMap<>();
        for (Map<String, Object> record : table) {
            buckets.computeIfAbsent(GroupKey.of(record, keys), k -> new ArrayList<>()).add(record);
        }

        List<Map<String, Object>> out = new ArrayList<>(buckets.size());
        for (Map.Entry<GroupKey, List<Map<String, Object>>> bucket : buckets.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                row.put(keys.get(i), bucket.getKey().rawAt(i));
            }
            List<Map<String, Object>> records = bucket.getValue();
            if (outputs.isEmpty()) {
                row.put(ROW_COUNT_COLUMN, (long) records.size());
            }
            for (OutputColumn output : outputs) {
                List<Object> values = new ArrayList<>(records.size());
                for (Map<String, Object> record : records) {
                    values.add(Values.get(record, output.source));
                }
                row.put(output.name, Statistics.reduce(output.statistic, values, output.source));
            }
            out.add(row);
        }
        return out;
    }

    /**
     * Output column naming: a column with one statistic keeps its name, a column with several
     * becomes {@code column_statistic}.
     */
    private static List<OutputColumn> outputColumns(List<String> keys, Map<String, List<Statistic>> aggregations) {
        List<OutputColumn> outputs = new ArrayList<>();
        for (Map.Entry<String, List<Statistic>> entry : aggregations.entrySet()) {
            List<Statistic> statistics = new ArrayList<>(new LinkedHashSet<>(entry.getValue()));
            if (statistics.isEmpty()) {
                throw new ValidationException("No aggregation function given for column: " + entry.getKey());
            }
            for (Statistic statistic : statistics) {
                String name = statistics.size() == 1
                        ? entry.getKey()
                        : entry.getKey() + "_" + statistic.wireName();
                outputs.add(new OutputColumn(entry.getKey(), statistic, name));
            }
        }

        LinkedHashSet<String> seen = new LinkedHashSet<>(keys);
        if (outputs.isEmpty() && seen.contains(ROW_COUNT_COLUMN)) {
            throw new ValidationException("Output column '" + ROW_COUNT_COLUMN + "' collides with a group_by column");
        }
        for (OutputColumn output : outputs) {
            if (!seen.add(output.name)) {
                throw new ValidationException("Output column '" + output.name
                        + "' collides with a group_by or another aggregation column");
            }
        }
        return outputs;
    }

    private static final class OutputColumn {
        private final String source;
        private final Statistic statistic;
        private final String name;

        private OutputColumn(String source, Statistic statistic, String name) {
            this.source = source;
            this.statistic = statistic;
            this.name = name;
        }
    }
}
