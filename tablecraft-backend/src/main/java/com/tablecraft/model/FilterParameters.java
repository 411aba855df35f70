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
public class FilterParameters implements TransformParameters {
    /**
     * Conditions combined with AND. A single wire condition becomes a one-element list.
     */
    @Builder.Default
    private List<Condition> conditions = new ArrayList<>();

    @Override
    public TransformationType type() {
        return TransformationType.FILTER;
    }
}
