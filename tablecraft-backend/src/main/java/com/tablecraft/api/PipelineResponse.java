package com.tablecraft.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tablecraft.model.PipelineResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PipelineResponse {
    private boolean success;
    private String message;
    private List<Map<String, Object>> data;
    private List<PipelineResult.StepResult> transformationSteps;
    private double processingTimeMs;
}
