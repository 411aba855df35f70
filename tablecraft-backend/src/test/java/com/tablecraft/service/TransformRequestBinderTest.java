package com.tablecraft.service;

import com.tablecraft.engine.ValidationException;
import com.tablecraft.model.AggregateParameters;
import com.tablecraft.model.FilterOperator;
import com.tablecraft.model.FilterParameters;
import com.tablecraft.model.NormalizationMethod;
import com.tablecraft.model.NormalizeParameters;
import com.tablecraft.model.PivotParameters;
import com.tablecraft.model.Statistic;
import com.tablecraft.model.TransformationType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.tablecraft.TestTables.row;
import static org.junit.jupiter.api.Assertions.*;

public class TransformRequestBinderTest {

    private final TransformRequestBinder binder = new TransformRequestBinder();

    @Test
    void testAggregateParameters() {
        AggregateParameters p = (AggregateParameters) binder.bind(TransformationType.AGGREGATE, row(
                "group_by", List.of("region", "year"),
                "aggregations", row("sales", "sum", "qty", List.of("mean", "max"))));

        assertEquals(List.of("region", "year"), p.getGroupBy());
        assertEquals(List.of("sales", "qty"), List.copyOf(p.getAggregations().keySet()));
        assertEquals(List.of(Statistic.SUM), p.getAggregations().get("sales"));
        assertEquals(List.of(Statistic.MEAN, Statistic.MAX), p.getAggregations().get("qty"));
    }

    @Test
    void testAggregateAcceptsSingleGroupColumnAndNoAggregations() {
        AggregateParameters p = (AggregateParameters) binder.bind(TransformationType.AGGREGATE, row("group_by", "region"));

        assertEquals(List.of("region"), p.getGroupBy());
        assertTrue(p.getAggregations().isEmpty());
    }

    @Test
    void testAggregateRequiresGroupBy() {
        assertThrows(ValidationException.class,
                () -> binder.bind(TransformationType.AGGREGATE, row("aggregations", row("sales", "sum"))));
        assertThrows(ValidationException.class,
                () -> binder.bind(TransformationType.AGGREGATE, row("group_by", List.of())));
    }

    @Test
    void testAggregateRejectsUnknownStatistic() {
        ValidationException e = assertThrows(ValidationException.class, () -> binder.bind(TransformationType.AGGREGATE,
                row("group_by", List.of("region"), "aggregations", row("sales", "median"))));
        assertTrue(e.getMessage().contains("median"));
    }

    @Test
    void testFilterAcceptsSingleCondition() {
        FilterParameters p = (FilterParameters) binder.bind(TransformationType.FILTER,
                row("conditions", row("field", "age", "operator", "gte", "value", 30)));

        assertEquals(1, p.getConditions().size());
        assertEquals("age", p.getConditions().get(0).getField());
        assertEquals(FilterOperator.GTE, p.getConditions().get(0).getOperator());
        assertEquals(30, p.getConditions().get(0).getValue());
    }

    @Test
    void testFilterAcceptsConditionList() {
        FilterParameters p = (FilterParameters) binder.bind(TransformationType.FILTER, row("conditions", List.of(
                row("field", "age", "operator", "gte", "value", 30),
                row("field", "city", "operator", "in", "value", List.of("Oslo", "Rome")))));

        assertEquals(2, p.getConditions().size());
        assertEquals(FilterOperator.IN, p.getConditions().get(1).getOperator());
    }

    @Test
    void testFilterAllowsExplicitNullValue() {
        FilterParameters p = (FilterParameters) binder.bind(TransformationType.FILTER,
                row("conditions", row("field", "note", "operator", "eq", "value", null)));
        assertNull(p.getConditions().get(0).getValue());
    }

    @Test
    void testFilterRejectsMalformedConditions() {
        assertThrows(ValidationException.class, () -> binder.bind(TransformationType.FILTER, new HashMap<>()));
        assertThrows(ValidationException.class, () -> binder.bind(TransformationType.FILTER, row("conditions", List.of())));
        assertThrows(ValidationException.class, () -> binder.bind(TransformationType.FILTER,
                row("conditions", row("field", "age", "operator", "between", "value", 1))));
        assertThrows(ValidationException.class, () -> binder.bind(TransformationType.FILTER,
                row("conditions", row("field", "age", "operator", "eq"))));
        assertThrows(ValidationException.class, () -> binder.bind(TransformationType.FILTER,
                row("conditions", List.of("age > 3"))));
    }

    @Test
    void testNormalizeDefaultsToMinMax() {
        NormalizeParameters p = (NormalizeParameters) binder.bind(TransformationType.NORMALIZE,
                row("columns", List.of("price")));

        assertEquals(List.of("price"), p.getColumns());
        assertEquals(NormalizationMethod.MIN_MAX, p.getMethod());
    }

    @Test
    void testNormalizeMethodNamesAreNormalized() {
        NormalizeParameters p = (NormalizeParameters) binder.bind(TransformationType.NORMALIZE,
                row("columns", List.of("price"), "method", "Z-Score"));
        assertEquals(NormalizationMethod.Z_SCORE, p.getMethod());

        assertThrows(ValidationException.class, () -> binder.bind(TransformationType.NORMALIZE,
                row("columns", List.of("price"), "method", "log")));
    }

    @Test
    void testPivotDefaultsToSum() {
        PivotParameters p = (PivotParameters) binder.bind(TransformationType.PIVOT,
                row("index", "region", "pivot_columns", "product", "values", "sales"));

        assertEquals("region", p.getIndex());
        assertEquals("product", p.getPivotColumns());
        assertEquals("sales", p.getValues());
        assertEquals(Statistic.SUM, p.getAggfunc());
    }

    @Test
    void testPivotAcceptsColumnsAlias() {
        PivotParameters p = (PivotParameters) binder.bind(TransformationType.PIVOT,
                row("index", "region", "columns", "product", "values", "sales", "aggfunc", "mean"));

        assertEquals("product", p.getPivotColumns());
        assertEquals(Statistic.MEAN, p.getAggfunc());
    }

    @Test
    void testPivotRequiresAllThreeColumns() {
        assertThrows(ValidationException.class, () -> binder.bind(TransformationType.PIVOT,
                row("index", "region", "values", "sales")));
    }

    @Test
    void testNullParametersBehaveAsEmpty() {
        Map<String, Object> none = null;
        assertThrows(ValidationException.class, () -> binder.bind(TransformationType.NORMALIZE, none));
    }
}
