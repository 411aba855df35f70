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
 * Output of one transformation: the new table, descriptive counters and the time spent inside
 * the component call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransformationResult {
    private TransformationType transformationType;

    @Builder.Default
    private List<Map<String, Object>> data = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private double processingTimeMs;
}
