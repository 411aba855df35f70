package com.tablecraft.model;

import java.util.Locale;

/**
 * Kind of the non-null values seen in one column.
 */
public enum ColumnKind {
    NUMERIC,
    STRING,
    BOOLEAN,
    MIXED,
    NULL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
