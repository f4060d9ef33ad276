package de.mirkosertic.docmerge.cleaning;

import de.mirkosertic.docmerge.table.CellValues;
import de.mirkosertic.docmerge.table.ColumnType;
import de.mirkosertic.docmerge.table.Table;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans a single table in five fixed steps: deduplication, null handling, column name
 * normalization, type inference and outlier detection.
 *
 * <p>The input table is never modified, every call to {@link #clean(Table)} works on its own copy
 * and produces a fresh {@link CleaningReport}.</p>
 */
public class DataCleaner {

    private static final Logger logger = LoggerFactory.getLogger(DataCleaner.class);

    private static final Pattern SPECIAL_CHARS = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    static final double CONVERSION_THRESHOLD = 0.8;
    static final double IQR_FACTOR = 1.5;
    static final String OUTLIER_SUFFIX = "_outlier";

    private final CleaningConfig config;

    public DataCleaner() {
        this(new CleaningConfig());
    }

    public DataCleaner(final CleaningConfig config) {
        this.config = new CleaningConfig(config);
    }

    public CleaningResult clean(final Table table) {
        final Frame frame = Frame.of(table);
        final CleaningReport.Builder report = CleaningReport.builder(frame.shape());

        if (config.isRemoveDuplicates()) {
            removeDuplicates(frame, report);
        }
        if (config.isHandleNulls()) {
            handleNulls(frame, report);
        }
        if (config.isNormalizeNames()) {
            normalizeNames(frame, report);
        }
        if (config.isInferTypes()) {
            inferTypes(frame, report);
        }
        if (config.isDetectOutliers()) {
            detectOutliers(frame, report);
        }

        final CleaningReport result = report.build(frame.shape());
        logger.debug("Cleaned table {}:\n{}", table.getName(), result.render());
        return new CleaningResult(frame.toTable(), result);
    }

    void removeDuplicates(final Frame frame, final CleaningReport.Builder report) {
        final List<Integer> keyColumns = new ArrayList<>();
        final List<String> subset = config.getDuplicateSubset();
        if (subset == null || subset.isEmpty()) {
            for (int c = 0; c < frame.columnCount(); c++) {
                keyColumns.add(c);
            }
        } else {
            for (final String column : subset) {
                final int index = frame.indexOf(column);
                if (index < 0) {
                    throw new IllegalArgumentException("Unknown column in duplicate subset: " + column);
                }
                keyColumns.add(index);
            }
        }

        final List<List<Object>> keys = new ArrayList<>(frame.rowCount());
        final Map<List<Object>, Integer> occurrences = new HashMap<>();
        for (int r = 0; r < frame.rowCount(); r++) {
            final List<Object> key = new ArrayList<>(keyColumns.size());
            for (final int c : keyColumns) {
                key.add(frame.column(c).get(r));
            }
            keys.add(key);
            occurrences.merge(key, 1, Integer::sum);
        }

        final BitSet keep = new BitSet(frame.rowCount());
        final Set<List<Object>> seen = new HashSet<>();
        switch (config.getKeepDuplicate()) {
            case FIRST -> {
                for (int r = 0; r < keys.size(); r++) {
                    if (seen.add(keys.get(r))) {
                        keep.set(r);
                    }
                }
            }
            case LAST -> {
                for (int r = keys.size() - 1; r >= 0; r--) {
                    if (seen.add(keys.get(r))) {
                        keep.set(r);
                    }
                }
            }
            case NONE -> {
                for (int r = 0; r < keys.size(); r++) {
                    if (occurrences.get(keys.get(r)) == 1) {
                        keep.set(r);
                    }
                }
            }
        }

        final int removed = frame.rowCount() - keep.cardinality();
        if (removed > 0) {
            frame.retainRows(keep);
            logger.debug("Removed {} duplicate rows", removed);
        }
        report.duplicatesRemoved(removed);
    }

    void handleNulls(final Frame frame, final CleaningReport.Builder report) {
        if (frame.rowCount() > 0) {
            final List<Integer> dropped = new ArrayList<>();
            for (int c = 0; c < frame.columnCount(); c++) {
                final double ratio = (double) frame.nullCount(c) / frame.rowCount();
                if (ratio > config.getNullThreshold()) {
                    report.columnDropped(frame.name(c));
                    dropped.add(c);
                }
            }
            for (int i = dropped.size() - 1; i >= 0; i--) {
                frame.removeColumn(dropped.get(i));
            }
            if (!dropped.isEmpty()) {
                logger.debug("Dropped {} columns with more than {}% nulls",
                        dropped.size(), config.getNullThreshold() * 100);
            }
        }

        for (int c = 0; c < frame.columnCount(); c++) {
            final int nullCount = frame.nullCount(c);
            if (nullCount == 0) {
                continue;
            }
            final ColumnType type = frame.type(c);
            final List<Object> values = frame.column(c);

            switch (config.getFillStrategy()) {
                case DROP -> {
                    final BitSet keep = new BitSet(frame.rowCount());
                    for (int r = 0; r < values.size(); r++) {
                        if (values.get(r) != null) {
                            keep.set(r);
                        }
                    }
                    frame.retainRows(keep);
                }
                case MEAN -> {
                    if (type.isNumeric()) {
                        frame.replaceColumn(c, fillAsDouble(values, ColumnStatistics.mean(ColumnStatistics.numbers(values))));
                    } else {
                        frame.replaceColumn(c, fill(values, defaultValue(type)));
                    }
                }
                case MEDIAN -> {
                    if (type.isNumeric()) {
                        frame.replaceColumn(c, fillAsDouble(values, ColumnStatistics.median(ColumnStatistics.numbers(values))));
                    } else {
                        frame.replaceColumn(c, fill(values, defaultValue(type)));
                    }
                }
                case MODE -> {
                    final Object mode = ColumnStatistics.mode(values);
                    if (mode != null) {
                        frame.replaceColumn(c, fill(values, mode));
                    }
                }
                case FFILL -> frame.replaceColumn(c, forwardFill(values));
                case BFILL -> {
                    final List<Object> reversed = new ArrayList<>(values);
                    Collections.reverse(reversed);
                    final List<Object> filled = forwardFill(reversed);
                    Collections.reverse(filled);
                    frame.replaceColumn(c, filled);
                }
                case DEFAULT -> frame.replaceColumn(c, fill(values, defaultValue(type)));
            }
            report.nullsFilled(frame.name(c), nullCount);
        }
    }

    private static Object defaultValue(final ColumnType type) {
        if (type == ColumnType.INTEGER) {
            return 0L;
        }
        if (type == ColumnType.FLOAT) {
            return 0.0;
        }
        return "";
    }

    private static List<Object> fill(final List<Object> values, final Object replacement) {
        final List<Object> result = new ArrayList<>(values.size());
        for (final Object value : values) {
            result.add(value == null ? replacement : value);
        }
        return result;
    }

    private static List<Object> fillAsDouble(final List<Object> values, final double replacement) {
        final List<Object> result = new ArrayList<>(values.size());
        for (final Object value : values) {
            result.add(value == null ? replacement : ((Number) value).doubleValue());
        }
        return result;
    }

    private static List<Object> forwardFill(final List<Object> values) {
        final List<Object> result = new ArrayList<>(values.size());
        Object last = null;
        for (final Object value : values) {
            if (value != null) {
                last = value;
            }
            result.add(last);
        }
        return result;
    }

    void normalizeNames(final Frame frame, final CleaningReport.Builder report) {
        final Set<String> used = new HashSet<>();
        final List<String> normalized = new ArrayList<>(frame.columnCount());
        for (int c = 0; c < frame.columnCount(); c++) {
            String name = normalizeName(frame.name(c));
            if (name.isEmpty()) {
                name = "column_" + (c + 1);
            }
            String candidate = name;
            int suffix = 2;
            while (!used.add(candidate)) {
                candidate = name + "_" + suffix++;
            }
            normalized.add(candidate);
        }

        for (int c = 0; c < frame.columnCount(); c++) {
            final String original = frame.name(c);
            final String renamed = normalized.get(c);
            if (!renamed.equals(original)) {
                report.columnRenamed(original, renamed);
                frame.rename(c, renamed);
            }
        }
    }

    /**
     * Remove everything but word characters and whitespace, turn whitespace runs into underscores
     * and lowercase the result.
     */
    public static String normalizeName(final String name) {
        final String stripped = SPECIAL_CHARS.matcher(name).replaceAll("").strip();
        return WHITESPACE.matcher(stripped).replaceAll("_").toLowerCase(Locale.ROOT);
    }

    void inferTypes(final Frame frame, final CleaningReport.Builder report) {
        final int rows = frame.rowCount();
        if (rows == 0) {
            return;
        }
        for (int c = 0; c < frame.columnCount(); c++) {
            if (frame.type(c) != ColumnType.TEXT) {
                continue;
            }
            final String from = ColumnType.TEXT.dtype();
            final List<Object> values = frame.column(c);

            final List<Number> numbers = new ArrayList<>(rows);
            int converted = 0;
            boolean integral = true;
            for (final Object value : values) {
                final Number number = toNumber(value);
                numbers.add(number);
                if (number != null) {
                    converted++;
                    integral &= number instanceof Long;
                }
            }
            if ((double) converted / rows >= CONVERSION_THRESHOLD) {
                final boolean asLong = integral && converted == rows;
                final List<Object> result = new ArrayList<>(rows);
                for (final Number number : numbers) {
                    if (number == null) {
                        result.add(null);
                    } else {
                        result.add(asLong ? (Object) number.longValue() : (Object) number.doubleValue());
                    }
                }
                frame.replaceColumn(c, result);
                report.typeConverted(frame.name(c), from + " → "
                        + (asLong ? ColumnType.INTEGER : ColumnType.FLOAT).dtype());
                continue;
            }

            if (!config.isParseDates()) {
                continue;
            }
            final List<Object> dates = new ArrayList<>(rows);
            converted = 0;
            for (final Object value : values) {
                final LocalDateTime date = toDateTime(value);
                dates.add(date);
                if (date != null) {
                    converted++;
                }
            }
            if ((double) converted / rows >= CONVERSION_THRESHOLD) {
                frame.replaceColumn(c, dates);
                report.typeConverted(frame.name(c), from + " → " + ColumnType.DATETIME.dtype());
            }
        }
    }

    private static @Nullable Number toNumber(final @Nullable Object value) {
        if (value instanceof Long || value instanceof Double) {
            return (Number) value;
        }
        if (value instanceof String) {
            return CellValues.parseNumber((String) value);
        }
        return null;
    }

    private static @Nullable LocalDateTime toDateTime(final @Nullable Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof String) {
            return CellValues.parseDateTime((String) value);
        }
        return null;
    }

    void detectOutliers(final Frame frame, final CleaningReport.Builder report) {
        final List<Integer> numericColumns = new ArrayList<>();
        for (int c = 0; c < frame.columnCount(); c++) {
            if (frame.type(c).isNumeric()) {
                numericColumns.add(c);
            }
        }

        int total = 0;
        for (final int c : numericColumns) {
            // An earlier flag column may have replaced this one
            if (!frame.type(c).isNumeric()) {
                continue;
            }
            final List<Object> values = frame.column(c);
            final List<Double> numbers = ColumnStatistics.numbers(values);
            if (numbers.isEmpty()) {
                continue;
            }

            final double lower;
            final double upper;
            if (config.getOutlierMethod() == OutlierMethod.IQR) {
                final double q1 = ColumnStatistics.quantile(numbers, 0.25);
                final double q3 = ColumnStatistics.quantile(numbers, 0.75);
                final double iqr = q3 - q1;
                lower = q1 - IQR_FACTOR * iqr;
                upper = q3 + IQR_FACTOR * iqr;
            } else {
                final double mean = ColumnStatistics.mean(numbers);
                final double std = ColumnStatistics.standardDeviation(numbers);
                if (Double.isNaN(std) || std == 0.0) {
                    continue;
                }
                lower = mean - config.getZScoreThreshold() * std;
                upper = mean + config.getZScoreThreshold() * std;
            }

            final List<Object> flags = new ArrayList<>(values.size());
            int flagged = 0;
            for (final Object value : values) {
                final boolean outlier = value != null
                        && (((Number) value).doubleValue() < lower || ((Number) value).doubleValue() > upper);
                flags.add(outlier);
                if (outlier) {
                    flagged++;
                }
            }
            if (flagged > 0) {
                final String flagColumn = frame.name(c) + OUTLIER_SUFFIX;
                final int existing = frame.indexOf(flagColumn);
                if (existing >= 0) {
                    frame.replaceColumn(existing, flags);
                } else {
                    frame.addColumn(flagColumn, flags);
                }
                total += flagged;
            }
        }

        if (total > 0) {
            logger.debug("Detected {} outliers", total);
        }
        report.outliersDetected(total);
    }
}
