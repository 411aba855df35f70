package com.tablecraft.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PivotParameters implements TransformParameters {
    private String index;
    private String pivotColumns;
    private String values;

    @Builder.Default
    private Statistic aggfunc = Statistic.SUM;

    @Override
    public TransformationType type() {
        return TransformationType.PIVOT;
    }
}
