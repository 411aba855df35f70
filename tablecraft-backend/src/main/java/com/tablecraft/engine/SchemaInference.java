package com.tablecraft.engine;

import com.tablecraft.model.ColumnKind;
import com.tablecraft.model.Schema;
import com.tablecraft.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives column names and value kinds from a record set.
 *
 * <p>A column is {@link ColumnKind#NUMERIC} when it has at least one non-null value and every
 * non-null value is a number, so a single stray string demotes the column to
 * {@link ColumnKind#MIXED}.
 */
@Component
public class SchemaInference {

    public Schema infer(List<Map<String, Object>> table) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (Map<String, Object> record : table) {
            if (record == null) {
                continue;
            }
            for (Map.Entry<String, Object> entry : record.entrySet()) {
                tallies.computeIfAbsent(entry.getKey(), k -> new Tally()).accept(entry.getValue());
            }
        }

        List<Schema.Column> columns = new ArrayList<>(tallies.size());
        for (Map.Entry<String, Tally> entry : tallies.entrySet()) {
            Tally t = entry.getValue();
            columns.add(Schema.Column.builder()
                    .name(entry.getKey())
                    .kind(t.kind())
                    .nonNullCount(t.nonNull)
                    .numericCount(t.numeric)
                    .nullCount(table.size() - t.nonNull)
                    .build());
        }
        return Schema.builder().columns(columns).build();
    }

    /**
     * Fails unless every column is present in at least one record.
     *
     * @param schema inferred schema
     * @param columns referenced columns
     * @param role what the columns are used for, used in the error message
     */
    public void requireColumns(Schema schema, List<String> columns, String role) {
        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!schema.hasColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing " + role + " columns: " + missing
                    + " (available: " + schema.columnNames() + ")");
        }
    }

    private static final class Tally {
        private int nonNull;
        private int numeric;
        private int strings;
        private int booleans;

        void accept(Object v) {
            if (v == null) {
                return;
            }
            nonNull++;
            if (Values.isNumber(v)) {
                numeric++;
            } else if (v instanceof String) {
                strings++;
            } else if (v instanceof Boolean) {
                booleans++;
            }
        }

        ColumnKind kind() {
            if (nonNull == 0) {
                return ColumnKind.NULL;
            }
            if (numeric == nonNull) {
                return ColumnKind.NUMERIC;
            }
            if (strings == nonNull) {
                return ColumnKind.STRING;
            }
            if (booleans == nonNull) {
                return ColumnKind.BOOLEAN;
            }
            return ColumnKind.MIXED;
        }
    }
}
