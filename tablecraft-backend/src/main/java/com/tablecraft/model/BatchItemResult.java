package com.tablecraft.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one item of a batch call. Exactly one of {@code result} and {@code errorCode} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchItemResult {
    private int index;
    private boolean success;
    private TransformationResult result;
    private String errorCode;
    private String errorMessage;
}
