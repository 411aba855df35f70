package com.tablecraft.engine;

import com.tablecraft.util.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Bucket key built from the values of the grouping columns of one record.
 *
 * <p>Equality uses the canonical form of each component (see {@link Values#canonical(Object)}),
 * so {@code 1} and {@code 1.0} share a bucket while {@code 1} and {@code "1"} do not. A missing
 * column contributes a null component. The raw values of the first record seen are kept for
 * output.
 */
final class GroupKey {
    private final List<Object> canonical;
    private final List<Object> raw;

    private GroupKey(List<Object> canonical, List<Object> raw) {
        this.canonical = canonical;
        this.raw = raw;
    }

    static GroupKey of(Map<String, Object> record, List<String> columns) {
        List<Object> canonical = new ArrayList<>(columns.size());
        List<Object> raw = new ArrayList<>(columns.size());
        for (String column : columns) {
            Object v = Values.get(record, column);
            raw.add(v);
            canonical.add(Values.canonical(v));
        }
        return new GroupKey(Collections.unmodifiableList(canonical), Collections.unmodifiableList(raw));
    }

    static GroupKey of(Object value) {
        return new GroupKey(
                Collections.singletonList(Values.canonical(value)),
                Collections.singletonList(value));
    }

    Object rawAt(int i) {
        return raw.get(i);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupKey other)) {
            return false;
        }
        return canonical.equals(other.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return raw.toString();
    }
}
