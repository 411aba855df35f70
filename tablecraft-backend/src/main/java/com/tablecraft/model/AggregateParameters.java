package com.tablecraft.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of an {@code aggregate} transformation.
 *
 * <p>{@code aggregations} keeps insertion order; it decides the order of output columns. An empty
 * map means "count rows per group".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateParameters implements TransformParameters {
    @Builder.Default
    private List<String> groupBy = new ArrayList<>();

    @Builder.Default
    private Map<String, List<Statistic>> aggregations = new LinkedHashMap<>();

    @Override
    public TransformationType type() {
        return TransformationType.AGGREGATE;
    }
}
