package com.tablecraft.util;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes incoming wire tags (transformation types, operators, statistics, methods) into
 * their canonical lower-case form.
 *
 * This must run before any enum lookup so that {@code "Min-Max"} and {@code "min_max"} resolve
 * to the same constant.
 */
public final class WireNames {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("minmax", "min_max"),
            Map.entry("zscore", "z_score"),
            Map.entry("average", "mean"),
            Map.entry("avg", "mean"),
            Map.entry("stddev", "std"),
            Map.entry("==", "eq"),
            Map.entry("!=", "ne"),
            Map.entry(">", "gt"),
            Map.entry(">=", "gte"),
            Map.entry("<", "lt"),
            Map.entry("<=", "lte")
    );

    private WireNames() {
    }

    /**
     * Normalize a wire tag.
     *
     * @param tag incoming tag
     * @return normalized tag (trimmed, lowercased, dashes folded to underscores, alias mapping)
     */
    public static String normalize(String tag) {
        if (tag == null) {
            return "";
        }
        String v = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (v.isBlank()) {
            return "";
        }
        return ALIASES.getOrDefault(v, v);
    }
}
