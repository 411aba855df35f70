package com.tablecraft.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Schema derived from a table. Columns appear in first-seen order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Schema {
    @Builder.Default
    private List<Column> columns = new ArrayList<>();

    public boolean hasColumn(String name) {
        return find(name) != null;
    }

    public Column find(String name) {
        for (Column column : columns) {
            if (column.getName().equals(name)) {
                return column;
            }
        }
        return null;
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    public List<String> numericColumns() {
        return columns.stream()
                .filter(c -> c.getKind() == ColumnKind.NUMERIC)
                .map(Column::getName)
                .collect(Collectors.toList());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Column {
        private String name;
        private ColumnKind kind;
        /** Records carrying a non-null value. */
        private int nonNullCount;
        /** Records carrying a number, a subset of {@code nonNullCount}. */
        private int numericCount;
        /** Records where the column is null or absent. */
        private int nullCount;
    }
}
