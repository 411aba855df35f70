package com.tablecraft.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /v1/transform/pipeline}: one table run through ordered steps.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PipelineRequest {
    @NotNull(message = "Data is required")
    private List<Map<String, Object>> data = new ArrayList<>();

    @Valid
    @NotEmpty(message = "Transformations are required")
    private List<Step> transformations = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Step {
        @NotBlank(message = "Transformation type is required")
        private String transformationType;

        private Map<String, Object> parameters = new LinkedHashMap<>();
    }
}
