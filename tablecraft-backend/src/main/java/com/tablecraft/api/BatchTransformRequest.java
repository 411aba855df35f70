package com.tablecraft.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body of {@code POST /v1/transform/batch}: independent requests, each processed on its own.
 * Items are not bean-validated here; an invalid item fails alone as a batch entry.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchTransformRequest {
    @NotEmpty(message = "Requests are required")
    private List<TransformRequest> requests = new ArrayList<>();
}
