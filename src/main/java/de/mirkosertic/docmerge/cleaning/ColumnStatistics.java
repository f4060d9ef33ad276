package de.mirkosertic.docmerge.cleaning;

import de.mirkosertic.docmerge.table.CellValues;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Descriptive statistics over column values. Missing values are ignored.
 */
final class ColumnStatistics {

    private ColumnStatistics() {
        // Utility class, no instances
    }

    static List<Double> numbers(final List<Object> values) {
        final List<Double> result = new ArrayList<>(values.size());
        for (final Object value : values) {
            if (value instanceof Number) {
                result.add(((Number) value).doubleValue());
            }
        }
        return result;
    }

    static double mean(final List<Double> values) {
        if (values.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0;
        for (final double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    static double median(final List<Double> values) {
        return quantile(values, 0.5);
    }

    /**
     * Quantile with linear interpolation between the two closest ranks.
     */
    static double quantile(final List<Double> values, final double q) {
        if (values.isEmpty()) {
            return Double.NaN;
        }
        final List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        final double position = q * (sorted.size() - 1);
        final int lower = (int) Math.floor(position);
        final int upper = (int) Math.ceil(position);
        final double fraction = position - lower;
        return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * fraction;
    }

    /**
     * Sample standard deviation (n - 1 in the denominator).
     */
    static double standardDeviation(final List<Double> values) {
        if (values.size() < 2) {
            return Double.NaN;
        }
        final double mean = mean(values);
        double squares = 0;
        for (final double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.size() - 1));
    }

    /**
     * Most frequent value. Ties are resolved in favour of the smallest value.
     *
     * @return the mode, or null if there is no non-null value
     */
    static @Nullable Object mode(final List<Object> values) {
        final Map<Object, Integer> counts = new LinkedHashMap<>();
        for (final Object value : values) {
            if (value != null) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        Object best = null;
        int bestCount = 0;
        for (final Map.Entry<Object, Integer> entry : counts.entrySet()) {
            final int count = entry.getValue();
            if (count > bestCount || count == bestCount && CellValues.compare(entry.getKey(), best) < 0) {
                best = entry.getKey();
                bestCount = count;
            }
        }
        return best;
    }
}
