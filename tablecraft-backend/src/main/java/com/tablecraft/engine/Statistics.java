package com.tablecraft.engine;

import com.tablecraft.model.Statistic;
import com.tablecraft.util.Values;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Pure reducers shared by the aggregator, the pivoter and the normalizer.
 *
 * <p>Every numeric reducer skips nulls and non-numeric values. {@code count} is the only
 * statistic that looks at non-numeric values: it counts everything that is not null.
 */
public final class Statistics {

    private Statistics() {
    }

    /**
     * Applies a named statistic to the raw values of one column within a bucket.
     *
     * @param statistic statistic to apply
     * @param rawValues raw column values, nulls included
     * @param column column name, used in error messages
     * @return reduced value, possibly null
     */
    public static Object reduce(Statistic statistic, Collection<?> rawValues, String column) {
        if (statistic == Statistic.COUNT) {
            return count(rawValues);
        }
        List<Number> numbers = numericValues(rawValues);
        Object result;
        switch (statistic) {
            case SUM:
                result = sum(numbers);
                break;
            case MEAN:
                result = mean(numbers);
                break;
            case MIN:
                result = min(numbers);
                break;
            case MAX:
                result = max(numbers);
                break;
            case STD:
                result = sampleStd(numbers);
                break;
            default:
                throw new IllegalArgumentException("Unsupported statistic: " + statistic);
        }
        if (result instanceof Double d && !Double.isFinite(d)) {
            throw new ComputationException(column, statistic.wireName(), "Statistic is not finite");
        }
        return result;
    }

    public static List<Number> numericValues(Collection<?> rawValues) {
        List<Number> out = new ArrayList<>(rawValues.size());
        for (Object v : rawValues) {
            if (Values.isNumber(v)) {
                out.add((Number) v);
            }
        }
        return out;
    }

    public static long count(Collection<?> rawValues) {
        long n = 0;
        for (Object v : rawValues) {
            if (v != null) {
                n++;
            }
        }
        return n;
    }

    /**
     * Sum that stays integral when every value is integral; 0 for no values.
     */
    public static Number sum(List<Number> numbers) {
        boolean integral = numbers.stream().allMatch(Values::isIntegral);
        if (integral) {
            BigInteger total = BigInteger.ZERO;
            for (Number n : numbers) {
                total = total.add(n instanceof BigInteger bi ? bi : BigInteger.valueOf(n.longValue()));
            }
            return total.bitLength() < 64 ? (Number) total.longValue() : total;
        }
        // Kahan summation
        double total = 0.0;
        double compensation = 0.0;
        for (Number n : numbers) {
            double y = n.doubleValue() - compensation;
            double t = total + y;
            compensation = (t - total) - y;
            total = t;
        }
        return total;
    }

    public static Double mean(List<Number> numbers) {
        if (numbers.isEmpty()) {
            return null;
        }
        return sum(numbers).doubleValue() / numbers.size();
    }

    public static Number min(List<Number> numbers) {
        Number best = null;
        for (Number n : numbers) {
            if (best == null || Values.compareNumbers(n, best) < 0) {
                best = n;
            }
        }
        return best;
    }

    public static Number max(List<Number> numbers) {
        Number best = null;
        for (Number n : numbers) {
            if (best == null || Values.compareNumbers(n, best) > 0) {
                best = n;
            }
        }
        return best;
    }

    /**
     * Sample standard deviation (divides by n - 1); null for fewer than two values.
     */
    public static Double sampleStd(List<Number> numbers) {
        if (numbers.size() < 2) {
            return null;
        }
        return Math.sqrt(sumOfSquaredDeviations(numbers) / (numbers.size() - 1));
    }

    /**
     * Population standard deviation (divides by n); null for no values.
     */
    public static Double populationStd(List<Number> numbers) {
        if (numbers.isEmpty()) {
            return null;
        }
        return Math.sqrt(sumOfSquaredDeviations(numbers) / numbers.size());
    }

    public static Double median(List<Number> numbers) {
        return quantile(numbers, 0.5);
    }

    /**
     * Quantile by linear interpolation between closest ranks, {@code q} in [0, 1].
     *
     * @return quantile, or null for no values
     */
    public static Double quantile(List<Number> numbers, double q) {
        if (numbers.isEmpty()) {
            return null;
        }
        if (q < 0.0 || q > 1.0) {
            throw new IllegalArgumentException("Quantile out of range: " + q);
        }
        double[] sorted = numbers.stream().mapToDouble(Number::doubleValue).toArray();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    private static double sumOfSquaredDeviations(List<Number> numbers) {
        double mean = mean(numbers);
        double acc = 0.0;
        for (Number n : numbers) {
            double d = n.doubleValue() - mean;
            acc += d * d;
        }
        return acc;
    }
}
