package com.tablecraft.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Response for {@code POST /v1/schema}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SchemaResponse {
    private int rowCount;
    private List<ColumnEntry> columns = new ArrayList<>();
    private List<String> numericColumns = new ArrayList<>();

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ColumnEntry {
        private String name;

        /**
         * One of numeric, string, boolean, mixed, null.
         */
        private String kind;
        private int nonNullCount;
        private int nullCount;
    }
}
