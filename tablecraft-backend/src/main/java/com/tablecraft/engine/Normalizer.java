package com.tablecraft.engine;

import com.tablecraft.model.NormalizationMethod;
import com.tablecraft.model.Schema;
import com.tablecraft.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Rescales numeric columns with one of three statistical methods.
 *
 * <p>Two passes: column statistics are computed over the original values first, then values are
 * rewritten. Nulls and non-numeric values pass through untouched, as do all other columns.
 */
@Component
public class Normalizer {

    private final SchemaInference schemaInference;

    public Normalizer(SchemaInference schemaInference) {
        this.schemaInference = schemaInference;
    }

    /**
     * Result of a normalization: the new table plus per-column statistics.
     */
    public static final class NormalizedTable {
        private final List<Map<String, Object>> data;
        private final List<String> columns;
        private final Map<String, Map<String, Object>> statistics;

        NormalizedTable(List<Map<String, Object>> data, List<String> columns, Map<String, Map<String, Object>> statistics) {
            this.data = data;
            this.columns = columns;
            this.statistics = statistics;
        }

        public List<Map<String, Object>> getData() {
            return data;
        }

        public List<String> getColumns() {
            return columns;
        }

        public Map<String, Map<String, Object>> getStatistics() {
            return statistics;
        }
    }

    public NormalizedTable normalize(List<Map<String, Object>> table, List<String> columns, NormalizationMethod method) {
        if (columns == null || columns.isEmpty()) {
            throw new ValidationException("columns must name at least one column");
        }
        List<String> targets = new ArrayList<>(new LinkedHashSet<>(columns));

        if (table.isEmpty()) {
            return new NormalizedTable(new ArrayList<>(), targets, new LinkedHashMap<>());
        }

        Schema schema = schemaInference.infer(table);
        schemaInference.requireColumns(schema, targets, "normalization");

        Map<String, ColumnScale> scales = new LinkedHashMap<>();
        for (String column : targets) {
            if (schema.find(column).getNumericCount() == 0) {
                throw new ValidationException("Column '" + column + "' has no numeric values to normalize");
            }
            scales.put(column, ColumnScale.of(column, method, table));
        }

        List<Map<String, Object>> out = new ArrayList<>(table.size());
        for (Map<String, Object> record : table) {
            Map<String, Object> row = new LinkedHashMap<>(record);
            for (ColumnScale scale : scales.values()) {
                Object v = record.get(scale.column);
                if (Values.isNumber(v)) {
                    row.put(scale.column, scale.apply(((Number) v).doubleValue()));
                }
            }
            out.add(row);
        }

        Map<String, Map<String, Object>> statistics = new LinkedHashMap<>();
        for (ColumnScale scale : scales.values()) {
            statistics.put(scale.column, scale.describe(out));
        }
        return new NormalizedTable(out, targets, statistics);
    }

    /**
     * Affine rescaling {@code (x - center) / spread} for one column; a zero spread maps every
     * value to 0.
     */
    private static final class ColumnScale {
        private final String column;
        private final List<Number> original;
        private final double center;
        private final double spread;

        private ColumnScale(String column, List<Number> original, double center, double spread) {
            this.column = column;
            this.original = original;
            this.center = center;
            this.spread = spread;
        }

        static ColumnScale of(String column, NormalizationMethod method, List<Map<String, Object>> table) {
            List<Object> raw = new ArrayList<>(table.size());
            for (Map<String, Object> record : table) {
                raw.add(Values.get(record, column));
            }
            List<Number> numbers = Statistics.numericValues(raw);

            double center;
            double spread;
            switch (method) {
                case MIN_MAX:
                    center = Statistics.min(numbers).doubleValue();
                    spread = Statistics.max(numbers).doubleValue() - center;
                    break;
                case Z_SCORE:
                    center = Statistics.mean(numbers);
                    spread = Statistics.populationStd(numbers);
                    break;
                case ROBUST:
                    center = Statistics.median(numbers);
                    spread = Statistics.quantile(numbers, 0.75) - Statistics.quantile(numbers, 0.25);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported normalization method: " + method);
            }
            if (!Double.isFinite(center) || !Double.isFinite(spread)) {
                throw new ComputationException(column, method.wireName(), "Normalization statistics are not finite");
            }
            return new ColumnScale(column, numbers, center, spread);
        }

        double apply(double x) {
            if (spread == 0.0) {
                return 0.0;
            }
            return (x - center) / spread;
        }

        Map<String, Object> describe(List<Map<String, Object>> normalized) {
            List<Object> raw = new ArrayList<>(normalized.size());
            for (Map<String, Object> record : normalized) {
                raw.add(Values.get(record, column));
            }
            List<Number> rewritten = Statistics.numericValues(raw);

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("count", original.size());
            stats.put("min", Statistics.min(original));
            stats.put("max", Statistics.max(original));
            stats.put("mean", Statistics.mean(original));
            stats.put("std", Statistics.populationStd(original));
            stats.put("median", Statistics.median(original));
            stats.put("q1", Statistics.quantile(original, 0.25));
            stats.put("q3", Statistics.quantile(original, 0.75));
            stats.put("normalized_mean", Statistics.mean(rewritten));
            stats.put("normalized_std", Statistics.populationStd(rewritten));
            return stats;
        }
    }
}
