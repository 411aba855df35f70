package com.tablecraft.engine;

import com.tablecraft.model.Condition;
import com.tablecraft.model.Schema;
import com.tablecraft.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * Evaluates filter conditions against records.
 *
 * <p>Evaluation never raises: a missing field reads as null, and ordering operators on
 * non-numbers are simply false.
 */
@Component
public class ConditionEvaluator {

    private final SchemaInference schemaInference;

    public ConditionEvaluator(SchemaInference schemaInference) {
        this.schemaInference = schemaInference;
    }

    public boolean matches(Map<String, Object> record, Condition condition) {
        Object actual = Values.get(record, condition.getField());
        Object expected = condition.getValue();
        switch (condition.getOperator()) {
            case EQ:
                return Values.looselyEquals(actual, expected);
            case NE:
                return !Values.looselyEquals(actual, expected);
            case GT:
                return compare(actual, expected, c -> c > 0);
            case GTE:
                return compare(actual, expected, c -> c >= 0);
            case LT:
                return compare(actual, expected, c -> c < 0);
            case LTE:
                return compare(actual, expected, c -> c <= 0);
            case CONTAINS:
                return actual != null && expected != null
                        && Values.asString(actual).contains(Values.asString(expected));
            case IN:
                for (Object candidate : Values.asSequence(expected)) {
                    if (Values.looselyEquals(actual, candidate)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new IllegalArgumentException("Unsupported operator: " + condition.getOperator());
        }
    }

    /**
     * AND of all conditions; an empty list matches everything.
     */
    public boolean matches(Map<String, Object> record, List<Condition> conditions) {
        for (Condition condition : conditions) {
            if (!matches(record, condition)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Keeps the records satisfying every condition, in input order.
     *
     * @param table input table
     * @param conditions conditions combined with AND
     * @return fresh table holding copies of the kept records
     */
    public List<Map<String, Object>> filter(List<Map<String, Object>> table, List<Condition> conditions) {
        if (!table.isEmpty()) {
            Schema schema = schemaInference.infer(table);
            List<String> fields = conditions.stream()
                    .map(Condition::getField)
                    .distinct()
                    .collect(Collectors.toList());
            schemaInference.requireColumns(schema, fields, "filter");
        }

        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> record : table) {
            if (matches(record, conditions)) {
                out.add(new LinkedHashMap<>(record));
            }
        }
        return out;
    }

    private static boolean compare(Object actual, Object expected, IntPredicate test) {
        Integer c = Values.compareNumbers(actual, expected);
        return c != null && test.test(c);
    }
}
