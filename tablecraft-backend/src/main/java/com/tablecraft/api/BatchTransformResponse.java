package com.tablecraft.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Response for {@code POST /v1/transform/batch}. {@code results} has the same length and order as
 * the request list.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchTransformResponse {
    private boolean success;
    private int total;
    private int succeeded;
    private int failed;
    private List<Item> results = new ArrayList<>();
    private double processingTimeMs;

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Item {
        private int index;
        private boolean success;
        private String transformationType;
        private List<Map<String, Object>> data;
        private Map<String, Object> metadata;
        private Double processingTimeMs;

        /**
         * Set only for failed items.
         */
        private ErrorResponse error;
    }
}
