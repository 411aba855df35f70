package com.tablecraft.model;

import com.tablecraft.engine.ValidationException;
import com.tablecraft.util.WireNames;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Comparison operators accepted in filter conditions.
 */
public enum FilterOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    IN("in");

    private final String wireName;

    FilterOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FilterOperator fromWireName(String tag) {
        String normalized = WireNames.normalize(tag);
        for (FilterOperator op : values()) {
            if (op.wireName.equals(normalized)) {
                return op;
            }
        }
        throw new ValidationException("Unknown operator: " + tag);
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(FilterOperator::wireName).collect(Collectors.toList());
    }
}
