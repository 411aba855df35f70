package com.tablecraft.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /v1/transform} and one item of a batch.
 *
 * <p>{@code parameters} stays loosely typed on the wire; the binder turns it into the typed
 * variant for {@code transformation_type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransformRequest {
    @NotNull(message = "Data is required")
    @Builder.Default
    private List<Map<String, Object>> data = new ArrayList<>();

    @NotBlank(message = "Transformation type is required")
    private String transformationType;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();
}
