package com.tablecraft.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResult {
    @Builder.Default
    private List<Map<String, Object>> data = new ArrayList<>();

    @Builder.Default
    private List<StepResult> steps = new ArrayList<>();

    private double processingTimeMs;

    /**
     * Metadata of one executed step (1-based).
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class StepResult {
        private int step;
        private String transformationType;
        private Map<String, Object> parameters;
        private Map<String, Object> metadata;
        private double processingTimeMs;
    }
}
