package com.tablecraft.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;

/**
 * Semantics of the dynamically typed scalars carried by records.
 *
 * <p>Numbers are any finite {@link Number}; booleans and numeric-looking strings are not numbers.
 * Equality and group keys go through {@link #canonical(Object)} so that {@code 30} and
 * {@code 30.0} compare equal and land in the same bucket.
 */
public final class Values {

    private Values() {
    }

    /**
     * Reads a column from a record; an absent column reads as null.
     *
     * @param record record
     * @param column column name
     * @return value or null
     */
    public static Object get(Map<String, Object> record, String column) {
        if (record == null) {
            return null;
        }
        return record.get(column);
    }

    public static boolean isNumber(Object v) {
        if (v instanceof Double d) {
            return Double.isFinite(d);
        }
        if (v instanceof Float f) {
            return Float.isFinite(f);
        }
        return v instanceof Number;
    }

    public static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger;
    }

    /**
     * Exact decimal form of a finite number.
     *
     * @param n finite number
     * @return decimal value
     */
    public static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        return BigDecimal.valueOf(n.doubleValue());
    }

    /**
     * Canonical form used for equality and grouping. Numbers become scale-stripped decimals,
     * everything else is kept as is. Null stays null.
     *
     * @param v raw value
     * @return canonical value
     */
    public static Object canonical(Object v) {
        if (isNumber(v)) {
            BigDecimal d = toDecimal((Number) v);
            return d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
        }
        return v;
    }

    /**
     * Parses a value as a decimal when it is a number or a string holding one.
     *
     * @param v raw value
     * @return decimal, or null when the value is not numeric
     */
    public static BigDecimal numericOrNull(Object v) {
        if (isNumber(v)) {
            return toDecimal((Number) v);
        }
        if (v instanceof String s) {
            String t = s.trim();
            if (t.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(t);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Equality after coercing both sides to a common comparable type.
     *
     * <p>Numbers (and a number against a numeric string) compare by value, booleans as booleans,
     * strings as strings; any other pairing compares string representations. Null equals only null.
     *
     * @param a left value
     * @param b right value
     * @return whether both sides are equal
     */
    public static boolean looselyEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        if (isNumber(a) || isNumber(b)) {
            BigDecimal da = numericOrNull(a);
            BigDecimal db = numericOrNull(b);
            if (da != null && db != null) {
                return da.compareTo(db) == 0;
            }
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return a.equals(b);
        }
        return asString(a).equals(asString(b));
    }

    /**
     * Numeric comparison; null when either side is not a number.
     *
     * @param a left value
     * @param b right value
     * @return comparison result or null
     */
    public static Integer compareNumbers(Object a, Object b) {
        if (!isNumber(a) || !isNumber(b)) {
            return null;
        }
        return toDecimal((Number) a).compareTo(toDecimal((Number) b));
    }

    public static String asString(Object v) {
        return String.valueOf(v);
    }

    /**
     * Treats a collection as a sequence and anything else as a one-element sequence.
     *
     * @param v raw value
     * @return sequence view
     */
    public static Collection<?> asSequence(Object v) {
        if (v instanceof Collection<?> c) {
            return c;
        }
        if (v instanceof Object[] arr) {
            return Arrays.asList(arr);
        }
        return Collections.singletonList(v);
    }
}
