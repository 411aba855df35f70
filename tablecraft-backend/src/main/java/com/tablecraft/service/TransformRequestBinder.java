package com.tablecraft.service;

import com.tablecraft.engine.ValidationException;
import com.tablecraft.model.AggregateParameters;
import com.tablecraft.model.Condition;
import com.tablecraft.model.FilterOperator;
import com.tablecraft.model.FilterParameters;
import com.tablecraft.model.NormalizationMethod;
import com.tablecraft.model.NormalizeParameters;
import com.tablecraft.model.PivotParameters;
import com.tablecraft.model.Statistic;
import com.tablecraft.model.TransformParameters;
import com.tablecraft.model.TransformationType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the loosely typed wire parameters of a request to the typed variant of its
 * transformation type.
 *
 * <p>Missing required keys always fail; the only defaults are {@code method=min_max} for
 * normalize, {@code aggfunc=sum} for pivot and "row count" for an aggregate without
 * {@code aggregations}.
 */
@Component
public class TransformRequestBinder {

    public TransformParameters bind(TransformationType type, Map<String, Object> parameters) {
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        switch (type) {
            case AGGREGATE:
                return bindAggregate(params);
            case FILTER:
                return bindFilter(params);
            case NORMALIZE:
                return bindNormalize(params);
            case PIVOT:
                return bindPivot(params);
            default:
                throw new ValidationException("Unknown transformation type: " + type);
        }
    }

    private AggregateParameters bindAggregate(Map<String, Object> params) {
        List<String> groupBy = requireColumnList(params, "group_by", "Aggregate");

        Map<String, List<Statistic>> aggregations = new LinkedHashMap<>();
        Object raw = params.get("aggregations");
        if (raw != null) {
            if (!(raw instanceof Map<?, ?> map)) {
                throw new ValidationException("aggregations must map column names to aggregation functions");
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String column = String.valueOf(entry.getKey());
                List<Statistic> statistics = new ArrayList<>();
                for (Object tag : asList(entry.getValue())) {
                    if (!(tag instanceof String s)) {
                        throw new ValidationException("Aggregation function for column '" + column + "' must be a string");
                    }
                    statistics.add(Statistic.fromWireName(s));
                }
                if (statistics.isEmpty()) {
                    throw new ValidationException("No aggregation function given for column: " + column);
                }
                aggregations.put(column, statistics);
            }
        }
        return AggregateParameters.builder().groupBy(groupBy).aggregations(aggregations).build();
    }

    private FilterParameters bindFilter(Map<String, Object> params) {
        if (!params.containsKey("conditions") || params.get("conditions") == null) {
            throw new ValidationException("Filter transformation requires 'conditions' parameter");
        }
        Object raw = params.get("conditions");
        List<Condition> conditions = new ArrayList<>();
        if (raw instanceof Map<?, ?> single) {
            conditions.add(bindCondition(single, 0));
        } else if (raw instanceof Collection<?> many) {
            int i = 0;
            for (Object item : many) {
                if (!(item instanceof Map<?, ?> m)) {
                    throw new ValidationException("Condition at index " + i + " must be an object");
                }
                conditions.add(bindCondition(m, i));
                i++;
            }
        } else {
            throw new ValidationException("conditions must be a condition object or a list of them");
        }
        if (conditions.isEmpty()) {
            throw new ValidationException("conditions must contain at least one condition");
        }
        return FilterParameters.builder().conditions(conditions).build();
    }

    private Condition bindCondition(Map<?, ?> raw, int position) {
        Object field = raw.get("field");
        if (!(field instanceof String f) || f.isBlank()) {
            throw new ValidationException("Condition at index " + position + " requires a 'field'");
        }
        Object operator = raw.get("operator");
        if (!(operator instanceof String op) || op.isBlank()) {
            throw new ValidationException("Condition at index " + position + " requires an 'operator'");
        }
        if (!raw.containsKey("value")) {
            throw new ValidationException("Condition at index " + position + " requires a 'value'");
        }
        return Condition.builder()
                .field(f)
                .operator(FilterOperator.fromWireName(op))
                .value(raw.get("value"))
                .build();
    }

    private NormalizeParameters bindNormalize(Map<String, Object> params) {
        List<String> columns = requireColumnList(params, "columns", "Normalize");
        NormalizationMethod method = NormalizationMethod.MIN_MAX;
        Object raw = params.get("method");
        if (raw != null) {
            if (!(raw instanceof String s)) {
                throw new ValidationException("method must be a string");
            }
            method = NormalizationMethod.fromWireName(s);
        }
        return NormalizeParameters.builder().columns(columns).method(method).build();
    }

    private PivotParameters bindPivot(Map<String, Object> params) {
        Object pivotColumns = params.containsKey("pivot_columns") ? params.get("pivot_columns") : params.get("columns");
        String index = asColumnName(params.get("index"));
        String spread = asColumnName(pivotColumns);
        String values = asColumnName(params.get("values"));
        if (index == null || spread == null || values == null) {
            throw new ValidationException(
                    "Pivot transformation requires 'index', 'pivot_columns', and 'values' parameters");
        }

        Statistic aggfunc = Statistic.SUM;
        Object raw = params.get("aggfunc");
        if (raw != null) {
            if (!(raw instanceof String s)) {
                throw new ValidationException("aggfunc must be a string");
            }
            aggfunc = Statistic.fromWireName(s);
        }
        return PivotParameters.builder()
                .index(index)
                .pivotColumns(spread)
                .values(values)
                .aggfunc(aggfunc)
                .build();
    }

    private static List<String> requireColumnList(Map<String, Object> params, String key, String transformation) {
        Object raw = params.get(key);
        if (raw == null) {
            throw new ValidationException(transformation + " transformation requires '" + key + "' parameter");
        }
        List<String> columns = new ArrayList<>();
        for (Object item : asList(raw)) {
            String name = asColumnName(item);
            if (name == null) {
                throw new ValidationException(key + " must contain non-blank column names");
            }
            columns.add(name);
        }
        if (columns.isEmpty()) {
            throw new ValidationException(key + " must name at least one column");
        }
        return columns;
    }

    private static String asColumnName(Object raw) {
        if (raw instanceof String s && !s.isBlank()) {
            return s;
        }
        return null;
    }

    private static List<?> asList(Object raw) {
        if (raw instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        return raw == null ? List.of() : List.of(raw);
    }
}
