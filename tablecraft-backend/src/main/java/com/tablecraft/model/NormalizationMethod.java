package com.tablecraft.model;

import com.tablecraft.engine.ValidationException;
import com.tablecraft.util.WireNames;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public enum NormalizationMethod {
    /** (x - min) / (max - min) */
    MIN_MAX("min_max"),
    /** (x - mean) / population std */
    Z_SCORE("z_score"),
    /** (x - median) / (Q3 - Q1) */
    ROBUST("robust");

    private final String wireName;

    NormalizationMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static NormalizationMethod fromWireName(String tag) {
        String normalized = WireNames.normalize(tag);
        for (NormalizationMethod method : values()) {
            if (method.wireName.equals(normalized)) {
                return method;
            }
        }
        throw new ValidationException("Unknown normalization method: " + tag);
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(NormalizationMethod::wireName).collect(Collectors.toList());
    }
}
