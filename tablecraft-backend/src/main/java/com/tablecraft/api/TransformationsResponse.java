package com.tablecraft.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response for {@code GET /v1/transformations}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransformationsResponse {
    private List<String> availableTransformations = new ArrayList<>();
    private Map<String, Detail> transformationDetails = new LinkedHashMap<>();
    private List<String> supportedOperators = new ArrayList<>();
    private List<String> supportedAggregations = new ArrayList<>();
    private List<String> supportedNormalizations = new ArrayList<>();

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Detail {
        private String description;
        private List<String> requiredParameters = new ArrayList<>();
        private List<String> optionalParameters = new ArrayList<>();
        private Map<String, Object> exampleParameters = new LinkedHashMap<>();
    }
}
