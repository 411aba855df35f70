package com.tablecraft.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizeParameters implements TransformParameters {
    @Builder.Default
    private List<String> columns = new ArrayList<>();

    @Builder.Default
    private NormalizationMethod method = NormalizationMethod.MIN_MAX;

    @Override
    public TransformationType type() {
        return TransformationType.NORMALIZE;
    }
}
