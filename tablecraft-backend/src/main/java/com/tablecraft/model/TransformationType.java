package com.tablecraft.model;

import com.tablecraft.engine.ValidationException;
import com.tablecraft.util.WireNames;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public enum TransformationType {
    AGGREGATE("aggregate", "Group data by specified columns and apply aggregation functions"),
    FILTER("filter", "Filter data based on specified conditions"),
    NORMALIZE("normalize", "Normalize numerical columns using various methods"),
    PIVOT("pivot", "Pivot data to create a cross-tabulated format");

    private final String wireName;
    private final String description;

    TransformationType(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    public static TransformationType fromWireName(String tag) {
        String normalized = WireNames.normalize(tag);
        for (TransformationType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown transformation type: " + tag
                + " (expected one of " + wireNames() + ")");
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(TransformationType::wireName).collect(Collectors.toList());
    }
}
