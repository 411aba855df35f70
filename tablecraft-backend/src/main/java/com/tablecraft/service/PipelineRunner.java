package com.tablecraft.service;

import com.tablecraft.api.PipelineRequest;
import com.tablecraft.api.TransformRequest;
import com.tablecraft.engine.PipelineStepException;
import com.tablecraft.engine.ValidationException;
import com.tablecraft.model.PipelineResult;
import com.tablecraft.model.TransformationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies ordered transformation steps to one table; each step consumes the previous step's
 * output. The first failing step aborts the run.
 */
@Slf4j
@Component
public class PipelineRunner {

    private final TransformationDispatcher dispatcher;

    public PipelineRunner(TransformationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public PipelineResult run(List<Map<String, Object>> data, List<PipelineRequest.Step> steps) {
        if (data == null) {
            throw new ValidationException("Data is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new ValidationException("Transformations are required");
        }

        long start = System.nanoTime();
        List<Map<String, Object>> current = data;
        List<PipelineResult.StepResult> stepResults = new ArrayList<>(steps.size());

        for (int i = 0; i < steps.size(); i++) {
            PipelineRequest.Step step = steps.get(i);
            String type = step != null ? step.getTransformationType() : null;
            if (type == null || type.isBlank()) {
                throw new PipelineStepException(i + 1, null,
                        new ValidationException("Transformation type missing for step " + (i + 1)));
            }
            Map<String, Object> parameters = step.getParameters() != null ? step.getParameters() : new LinkedHashMap<>();

            TransformationResult result;
            try {
                result = dispatcher.execute(TransformRequest.builder()
                        .data(current)
                        .transformationType(type)
                        .parameters(parameters)
                        .build());
            } catch (RuntimeException e) {
                log.warn("Pipeline aborted at step {} ({}): {}", i + 1, type, e.getMessage());
                throw new PipelineStepException(i + 1, type, e);
            }

            current = result.getData();
            stepResults.add(PipelineResult.StepResult.builder()
                    .step(i + 1)
                    .transformationType(result.getTransformationType().wireName())
                    .parameters(parameters)
                    .metadata(result.getMetadata())
                    .processingTimeMs(result.getProcessingTimeMs())
                    .build());
        }

        double elapsedMs = Math.round((System.nanoTime() - start) / 10_000.0) / 100.0;
        log.info("Pipeline completed: steps={}, rows={} -> {}, elapsed={}ms",
                steps.size(), data.size(), current.size(), elapsedMs);

        return PipelineResult.builder()
                .data(current)
                .steps(stepResults)
                .processingTimeMs(elapsedMs)
                .build();
    }
}
