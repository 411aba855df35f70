package com.tablecraft.controller;

import com.tablecraft.api.BatchTransformRequest;
import com.tablecraft.api.BatchTransformResponse;
import com.tablecraft.api.ErrorResponse;
import com.tablecraft.api.PipelineRequest;
import com.tablecraft.api.PipelineResponse;
import com.tablecraft.api.SchemaRequest;
import com.tablecraft.api.SchemaResponse;
import com.tablecraft.api.TransformRequest;
import com.tablecraft.api.TransformResponse;
import com.tablecraft.api.TransformationsResponse;
import com.tablecraft.engine.SchemaInference;
import com.tablecraft.engine.ValidationException;
import com.tablecraft.model.BatchItemResult;
import com.tablecraft.model.FilterOperator;
import com.tablecraft.model.NormalizationMethod;
import com.tablecraft.model.PipelineResult;
import com.tablecraft.model.Schema;
import com.tablecraft.model.Statistic;
import com.tablecraft.model.TransformationResult;
import com.tablecraft.model.TransformationType;
import com.tablecraft.service.BatchRunner;
import com.tablecraft.service.PipelineRunner;
import com.tablecraft.service.TransformationDispatcher;
import com.tablecraft.web.TraceIdFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class TransformController {

    private static final Logger log = LoggerFactory.getLogger(TransformController.class);

    private final TransformationDispatcher dispatcher;
    private final BatchRunner batchRunner;
    private final PipelineRunner pipelineRunner;
    private final SchemaInference schemaInference;
    private final int maxRows;
    private final int maxBatchRequests;

    public TransformController(
            TransformationDispatcher dispatcher,
            BatchRunner batchRunner,
            PipelineRunner pipelineRunner,
            SchemaInference schemaInference,
            @Value("${tablecraft.max-rows:10000}") int maxRows,
            @Value("${tablecraft.batch.max-requests:100}") int maxBatchRequests
    ) {
        this.dispatcher = dispatcher;
        this.batchRunner = batchRunner;
        this.pipelineRunner = pipelineRunner;
        this.schemaInference = schemaInference;
        this.maxRows = maxRows;
        this.maxBatchRequests = maxBatchRequests;
    }

    /**
     * Apply one transformation.
     *
     * POST /v1/transform
     *
     * @param request data, transformation type and parameters
     * @return transformed data with metadata and processing time
     */
    @PostMapping("/transform")
    public ResponseEntity<TransformResponse> transform(@Valid @RequestBody TransformRequest request) {
        checkRowLimit(request.getData(), "data");
        TransformationResult result = dispatcher.execute(request);
        return ResponseEntity.ok(TransformResponse.builder()
                .success(true)
                .message("Successfully applied " + result.getTransformationType().wireName() + " transformation")
                .data(result.getData())
                .metadata(result.getMetadata())
                .processingTimeMs(result.getProcessingTimeMs())
                .build());
    }

    /**
     * Apply independent transformations; a failing item does not fail the call.
     *
     * POST /v1/transform/batch
     */
    @PostMapping("/transform/batch")
    public ResponseEntity<BatchTransformResponse> batch(@Valid @RequestBody BatchTransformRequest request) {
        List<TransformRequest> requests = request.getRequests();
        if (requests.size() > maxBatchRequests) {
            throw new ValidationException("Batch exceeds " + maxBatchRequests + " requests: " + requests.size());
        }

        long start = System.nanoTime();
        List<BatchItemResult> results = batchRunner.executeAll(requests);
        double elapsedMs = Math.round((System.nanoTime() - start) / 10_000.0) / 100.0;

        BatchTransformResponse response = new BatchTransformResponse();
        for (BatchItemResult r : results) {
            BatchTransformResponse.Item item = new BatchTransformResponse.Item();
            item.setIndex(r.getIndex());
            item.setSuccess(r.isSuccess());
            TransformRequest source = requests.get(r.getIndex());
            item.setTransformationType(source != null ? source.getTransformationType() : null);
            if (r.isSuccess()) {
                item.setData(r.getResult().getData());
                item.setMetadata(r.getResult().getMetadata());
                item.setProcessingTimeMs(r.getResult().getProcessingTimeMs());
            } else {
                item.setError(ErrorResponse.builder()
                        .code(r.getErrorCode())
                        .message(r.getErrorMessage())
                        .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                        .build());
            }
            response.getResults().add(item);
        }
        int failed = (int) results.stream().filter(r -> !r.isSuccess()).count();
        response.setTotal(results.size());
        response.setFailed(failed);
        response.setSucceeded(results.size() - failed);
        response.setSuccess(failed == 0);
        response.setProcessingTimeMs(elapsedMs);
        return ResponseEntity.ok(response);
    }

    /**
     * Apply ordered steps to one table, each step consuming the previous output.
     *
     * POST /v1/transform/pipeline
     */
    @PostMapping("/transform/pipeline")
    public ResponseEntity<PipelineResponse> pipeline(@Valid @RequestBody PipelineRequest request) {
        checkRowLimit(request.getData(), "data");
        PipelineResult result = pipelineRunner.run(request.getData(), request.getTransformations());
        return ResponseEntity.ok(PipelineResponse.builder()
                .success(true)
                .message("Successfully applied " + result.getSteps().size() + " transformations")
                .data(result.getData())
                .transformationSteps(result.getSteps())
                .processingTimeMs(result.getProcessingTimeMs())
                .build());
    }

    /**
     * Describe the columns of a table.
     *
     * POST /v1/schema
     */
    @PostMapping("/schema")
    public ResponseEntity<SchemaResponse> schema(@Valid @RequestBody SchemaRequest request) {
        checkRowLimit(request.getData(), "data");
        Schema schema = schemaInference.infer(request.getData());

        SchemaResponse response = new SchemaResponse();
        response.setRowCount(request.getData().size());
        for (Schema.Column column : schema.getColumns()) {
            SchemaResponse.ColumnEntry entry = new SchemaResponse.ColumnEntry();
            entry.setName(column.getName());
            entry.setKind(column.getKind().wireName());
            entry.setNonNullCount(column.getNonNullCount());
            entry.setNullCount(column.getNullCount());
            response.getColumns().add(entry);
        }
        response.setNumericColumns(schema.numericColumns());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /v1/transformations
     */
    @GetMapping("/transformations")
    public ResponseEntity<TransformationsResponse> transformations() {
        TransformationsResponse response = new TransformationsResponse();
        response.setAvailableTransformations(TransformationType.wireNames());
        response.setSupportedOperators(FilterOperator.wireNames());
        response.setSupportedAggregations(Statistic.wireNames());
        response.setSupportedNormalizations(NormalizationMethod.wireNames());

        response.getTransformationDetails().put("aggregate", detail(TransformationType.AGGREGATE,
                List.of("group_by"), List.of("aggregations"),
                orderedMap("group_by", List.of("region", "category"),
                        "aggregations", orderedMap("sales", "sum", "quantity", "mean"))));
        response.getTransformationDetails().put("filter", detail(TransformationType.FILTER,
                List.of("conditions"), List.of(),
                orderedMap("conditions", List.of(
                        orderedMap("field", "age", "operator", "gte", "value", 18),
                        orderedMap("field", "status", "operator", "eq", "value", "active")))));
        response.getTransformationDetails().put("normalize", detail(TransformationType.NORMALIZE,
                List.of("columns"), List.of("method"),
                orderedMap("columns", List.of("price", "quantity"), "method", "min_max")));
        response.getTransformationDetails().put("pivot", detail(TransformationType.PIVOT,
                List.of("index", "pivot_columns", "values"), List.of("aggfunc"),
                orderedMap("index", "date", "pivot_columns", "product", "values", "sales", "aggfunc", "sum")));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("message", "Data transformation API is running");
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }

    private void checkRowLimit(List<Map<String, Object>> data, String field) {
        if (data != null && data.size() > maxRows) {
            log.warn("Rejected {} with {} rows (limit {})", field, data.size(), maxRows);
            throw new ValidationException(field + " exceeds " + maxRows + " rows: " + data.size());
        }
    }

    private static TransformationsResponse.Detail detail(
            TransformationType type,
            List<String> required,
            List<String> optional,
            Map<String, Object> example
    ) {
        TransformationsResponse.Detail detail = new TransformationsResponse.Detail();
        detail.setDescription(type.description());
        detail.setRequiredParameters(required);
        detail.setOptionalParameters(optional);
        detail.setExampleParameters(example);
        return detail;
    }

    private static Map<String, Object> orderedMap(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
