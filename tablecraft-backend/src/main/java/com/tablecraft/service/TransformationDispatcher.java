package com.tablecraft.service;

import com.tablecraft.api.TransformRequest;
import com.tablecraft.engine.Aggregator;
import com.tablecraft.engine.ConditionEvaluator;
import com.tablecraft.engine.Normalizer;
import com.tablecraft.engine.Pivoter;
import com.tablecraft.engine.ValidationException;
import com.tablecraft.model.AggregateParameters;
import com.tablecraft.model.FilterParameters;
import com.tablecraft.model.NormalizeParameters;
import com.tablecraft.model.PivotParameters;
import com.tablecraft.model.Statistic;
import com.tablecraft.model.TransformParameters;
import com.tablecraft.model.TransformationResult;
import com.tablecraft.model.TransformationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates a transformation request, routes it to the matching engine component, times the
 * component call and assembles the result envelope.
 *
 * <p>Stateless and synchronous. Component errors propagate unchanged; no partial table is ever
 * returned.
 */
@Slf4j
@Service
public class TransformationDispatcher {

    private final TransformRequestBinder binder;
    private final Aggregator aggregator;
    private final ConditionEvaluator conditionEvaluator;
    private final Normalizer normalizer;
    private final Pivoter pivoter;

    public TransformationDispatcher(
            TransformRequestBinder binder,
            Aggregator aggregator,
            ConditionEvaluator conditionEvaluator,
            Normalizer normalizer,
            Pivoter pivoter
    ) {
        this.binder = binder;
        this.aggregator = aggregator;
        this.conditionEvaluator = conditionEvaluator;
        this.normalizer = normalizer;
        this.pivoter = pivoter;
    }

    /**
     * Execute one transformation request.
     *
     * @param request wire request
     * @return transformed table with metadata and component timing
     */
    public TransformationResult execute(TransformRequest request) {
        if (request == null) {
            throw new ValidationException("Request is required");
        }
        TransformationType type = TransformationType.fromWireName(request.getTransformationType());
        List<Map<String, Object>> data = validateData(request.getData());
        TransformParameters parameters;
        try {
            parameters = binder.bind(type, request.getParameters());
        } catch (ValidationException e) {
            log.warn("Invalid {} parameters: {}", type.wireName(), e.getMessage());
            throw e;
        }
        return execute(data, parameters);
    }

    /**
     * Execute a transformation whose parameters are already bound.
     *
     * @param data input table
     * @param parameters typed parameters
     * @return transformed table with metadata and component timing
     */
    public TransformationResult execute(List<Map<String, Object>> data, TransformParameters parameters) {
        TransformationType type = parameters.type();
        if (data.isEmpty()) {
            log.info("Skipping {} transformation for empty data", type.wireName());
            return TransformationResult.builder()
                    .transformationType(type)
                    .data(new ArrayList<>())
                    .metadata(emptyMetadata(parameters))
                    .processingTimeMs(0.0)
                    .build();
        }

        log.info("Processing {} transformation for {} records", type.wireName(), data.size());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("original_rows", data.size());
        List<Map<String, Object>> out;

        long start = System.nanoTime();
        long elapsed;
        try {
            switch (type) {
                case AGGREGATE: {
                    AggregateParameters p = (AggregateParameters) parameters;
                    out = aggregator.aggregate(data, p.getGroupBy(), p.getAggregations());
                    elapsed = System.nanoTime() - start;
                    metadata.put("transformed_rows", out.size());
                    metadata.put("groups_created", out.size());
                    metadata.put("group_by_columns", p.getGroupBy());
                    metadata.put("aggregation_functions", describeAggregations(p.getAggregations()));
                    break;
                }
                case FILTER: {
                    FilterParameters p = (FilterParameters) parameters;
                    out = conditionEvaluator.filter(data, p.getConditions());
                    elapsed = System.nanoTime() - start;
                    metadata.put("transformed_rows", out.size());
                    metadata.put("filtered_rows", out.size());
                    metadata.put("conditions_applied", p.getConditions().size());
                    metadata.put("filter_ratio", (double) out.size() / data.size());
                    break;
                }
                case NORMALIZE: {
                    NormalizeParameters p = (NormalizeParameters) parameters;
                    Normalizer.NormalizedTable normalized = normalizer.normalize(data, p.getColumns(), p.getMethod());
                    elapsed = System.nanoTime() - start;
                    out = normalized.getData();
                    metadata.put("transformed_rows", out.size());
                    metadata.put("normalized_columns", normalized.getColumns());
                    metadata.put("columns_normalized", normalized.getColumns().size());
                    metadata.put("normalization_method", p.getMethod().wireName());
                    metadata.put("statistics", normalized.getStatistics());
                    break;
                }
                case PIVOT: {
                    PivotParameters p = (PivotParameters) parameters;
                    Pivoter.PivotTable pivoted = pivoter.pivot(
                            data, p.getIndex(), p.getPivotColumns(), p.getValues(), p.getAggfunc());
                    elapsed = System.nanoTime() - start;
                    out = pivoted.getData();
                    metadata.put("transformed_rows", out.size());
                    metadata.put("pivoted_rows", out.size());
                    metadata.put("index_column", p.getIndex());
                    metadata.put("pivot_columns", p.getPivotColumns());
                    metadata.put("values_column", p.getValues());
                    metadata.put("aggregation_function", p.getAggfunc().wireName());
                    metadata.put("columns_created", pivoted.getPivotColumnNames());
                    metadata.put("skipped_rows", pivoted.getSkippedRows());
                    break;
                }
                default:
                    throw new ValidationException("Unknown transformation type: " + type);
            }
        } catch (ValidationException e) {
            log.warn("Transformation {} rejected: {}", type.wireName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Transformation {} failed", type.wireName(), e);
            throw e;
        }

        double processingTimeMs = roundMillis(elapsed);
        log.info("Transformation {} completed in {}ms. Input: {} records, Output: {} records",
                type.wireName(), processingTimeMs, data.size(), out.size());

        return TransformationResult.builder()
                .transformationType(type)
                .data(out)
                .metadata(metadata)
                .processingTimeMs(processingTimeMs)
                .build();
    }

    private static List<Map<String, Object>> validateData(List<Map<String, Object>> data) {
        if (data == null) {
            throw new ValidationException("Data is required");
        }
        for (int i = 0; i < data.size(); i++) {
            if (data.get(i) == null) {
                throw new ValidationException("Record at index " + i + " must be an object");
            }
        }
        return data;
    }

    private static Map<String, Object> emptyMetadata(TransformParameters parameters) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("original_rows", 0);
        metadata.put("transformed_rows", 0);
        switch (parameters.type()) {
            case AGGREGATE:
                metadata.put("groups_created", 0);
                break;
            case FILTER:
                metadata.put("filtered_rows", 0);
                metadata.put("conditions_applied", ((FilterParameters) parameters).getConditions().size());
                metadata.put("filter_ratio", 0.0);
                break;
            case NORMALIZE:
                metadata.put("columns_normalized", 0);
                break;
            case PIVOT:
                metadata.put("pivoted_rows", 0);
                metadata.put("skipped_rows", 0);
                break;
            default:
                break;
        }
        return metadata;
    }

    private static Map<String, Object> describeAggregations(Map<String, List<Statistic>> aggregations) {
        Map<String, Object> described = new LinkedHashMap<>();
        if (aggregations.isEmpty()) {
            described.put("*", List.of(Statistic.COUNT.wireName()));
            return described;
        }
        for (Map.Entry<String, List<Statistic>> entry : aggregations.entrySet()) {
            described.put(entry.getKey(), entry.getValue().stream()
                    .map(Statistic::wireName)
                    .distinct()
                    .collect(Collectors.toList()));
        }
        return described;
    }

    private static double roundMillis(long nanos) {
        return Math.round(nanos / 10_000.0) / 100.0;
    }
}
