package com.tablecraft.model;

import com.tablecraft.engine.ValidationException;
import com.tablecraft.util.WireNames;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Named reductions applied to the values of one column within a bucket.
 */
public enum Statistic {
    SUM("sum"),
    MEAN("mean"),
    COUNT("count"),
    MIN("min"),
    MAX("max"),
    STD("std");

    private final String wireName;

    Statistic(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Statistic fromWireName(String tag) {
        String normalized = WireNames.normalize(tag);
        for (Statistic statistic : values()) {
            if (statistic.wireName.equals(normalized)) {
                return statistic;
            }
        }
        throw new ValidationException("Unknown aggregation function: " + tag
                + " (expected one of " + wireNames() + ")");
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(Statistic::wireName).collect(Collectors.toList());
    }
}
