package com.tablecraft.engine;

import com.tablecraft.model.Condition;
import com.tablecraft.model.FilterOperator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.tablecraft.TestTables.people;
import static com.tablecraft.TestTables.row;
import static com.tablecraft.TestTables.table;
import static org.junit.jupiter.api.Assertions.*;

public class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator(new SchemaInference());

    private static Condition cond(String field, FilterOperator op, Object value) {
        return Condition.builder().field(field).operator(op).value(value).build();
    }

    @Test
    void testEqualityComparesNumbersByValue() {
        Map<String, Object> record = row("age", 30);
        assertTrue(evaluator.matches(record, cond("age", FilterOperator.EQ, 30.0)));
        assertTrue(evaluator.matches(record, cond("age", FilterOperator.EQ, 30L)));
        assertFalse(evaluator.matches(record, cond("age", FilterOperator.NE, 30)));
    }

    @Test
    void testEqualityCoercesNumericStrings() {
        assertTrue(evaluator.matches(row("code", "42"), cond("code", FilterOperator.EQ, 42)));
        assertFalse(evaluator.matches(row("code", "42a"), cond("code", FilterOperator.EQ, 42)));
    }

    @Test
    void testEqualityFallsBackToStringComparison() {
        assertTrue(evaluator.matches(row("flag", true), cond("flag", FilterOperator.EQ, "true")));
        assertTrue(evaluator.matches(row("city", "Oslo"), cond("city", FilterOperator.EQ, "Oslo")));
        assertFalse(evaluator.matches(row("city", "Oslo"), cond("city", FilterOperator.EQ, "oslo")));
    }

    @Test
    void testOrderingOperatorsAreNumericOnly() {
        Map<String, Object> record = row("age", 30, "name", "Zed");
        assertTrue(evaluator.matches(record, cond("age", FilterOperator.GT, 29.5)));
        assertTrue(evaluator.matches(record, cond("age", FilterOperator.GTE, 30)));
        assertFalse(evaluator.matches(record, cond("age", FilterOperator.LT, 30)));
        assertTrue(evaluator.matches(record, cond("age", FilterOperator.LTE, 30)));
        assertFalse(evaluator.matches(record, cond("name", FilterOperator.GT, "A")));
        assertFalse(evaluator.matches(record, cond("age", FilterOperator.GT, "10")));
    }

    @Test
    void testMissingFieldReadsAsNull() {
        Map<String, Object> record = row("name", "Alice");
        assertTrue(evaluator.matches(record, cond("age", FilterOperator.EQ, null)));
        assertTrue(evaluator.matches(record, cond("age", FilterOperator.NE, 30)));
        assertFalse(evaluator.matches(record, cond("age", FilterOperator.GTE, 0)));
        assertFalse(evaluator.matches(record, cond("age", FilterOperator.CONTAINS, "")));
    }

    @Test
    void testContainsIsCaseSensitiveSubstring() {
        Map<String, Object> record = row("city", "New York", "zip", 10001);
        assertTrue(evaluator.matches(record, cond("city", FilterOperator.CONTAINS, "York")));
        assertFalse(evaluator.matches(record, cond("city", FilterOperator.CONTAINS, "york")));
        assertTrue(evaluator.matches(record, cond("zip", FilterOperator.CONTAINS, 100)));
    }

    @Test
    void testInChecksMembership() {
        Map<String, Object> record = row("region", "North", "score", 2);
        assertTrue(evaluator.matches(record, cond("region", FilterOperator.IN, List.of("South", "North"))));
        assertFalse(evaluator.matches(record, cond("region", FilterOperator.IN, List.of("East"))));
        assertTrue(evaluator.matches(record, cond("score", FilterOperator.IN, List.of(1.0, 2.0))));
        assertTrue(evaluator.matches(record, cond("region", FilterOperator.IN, "North")));
    }

    @Test
    void testConditionsCombineWithAnd() {
        List<Condition> conditions = List.of(
                cond("age", FilterOperator.GTE, 30),
                cond("city", FilterOperator.EQ, "New York"));
        assertTrue(evaluator.matches(row("age", 31, "city", "New York"), conditions));
        assertFalse(evaluator.matches(row("age", 31, "city", "Boston"), conditions));
        assertTrue(evaluator.matches(row("age", 1), List.of()));
    }

    @Test
    void testFilterKeepsMatchingRecordsInOrder() {
        List<Map<String, Object>> out = evaluator.filter(people(), List.of(cond("age", FilterOperator.GTE, 30)));

        assertEquals(2, out.size());
        assertEquals("Alice", out.get(0).get("name"));
        assertEquals("Charlie", out.get(1).get("name"));
    }

    @Test
    void testFilterResultIsSubsetSatisfyingEveryCondition() {
        List<Condition> conditions = List.of(
                cond("age", FilterOperator.LT, 35),
                cond("city", FilterOperator.CONTAINS, "o"));
        List<Map<String, Object>> input = people();
        List<Map<String, Object>> out = evaluator.filter(input, conditions);

        assertTrue(out.size() <= input.size());
        for (Map<String, Object> record : out) {
            assertTrue(evaluator.matches(record, conditions));
        }
    }

    @Test
    void testFilterOnUnknownFieldFails() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> evaluator.filter(people(), List.of(cond("salary", FilterOperator.GT, 1))));
        assertTrue(e.getMessage().contains("salary"));
    }

    @Test
    void testFilterAcceptsFieldPresentInSomeRecords() {
        List<Map<String, Object>> input = table(
                row("name", "a"),
                row("name", "b", "vip", true));
        List<Map<String, Object>> out = evaluator.filter(input, List.of(cond("vip", FilterOperator.EQ, true)));

        assertEquals(1, out.size());
        assertEquals("b", out.get(0).get("name"));
    }
}
