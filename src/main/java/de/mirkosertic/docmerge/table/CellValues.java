package de.mirkosertic.docmerge.table;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Conversions between raw cell text and the typed values a {@link Table} holds.
 *
 * <p>Supported value types are {@link String}, {@link Long}, {@link Double}, {@link Boolean}
 * and {@link LocalDateTime}. Missing cells are {@code null}.</p>
 */
public final class CellValues {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final DateTimeFormatter DATE_TIME_OUTPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy"),
            DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH)
    );

    private CellValues() {
        // Utility class, no instances
    }

    /**
     * Map an arbitrary value onto one of the supported cell types.
     */
    public static @Nullable Object normalize(final @Nullable Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Long
                || value instanceof Double
                || value instanceof Boolean
                || value instanceof LocalDateTime) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneId.systemDefault());
        }
        return value.toString();
    }

    public static boolean isBlank(final @Nullable Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }

    /**
     * Parse a number the way a lenient numeric coercion would: integers become {@link Long},
     * decimals and exponent notation become {@link Double}.
     *
     * @return the parsed number, or null if the text is not numeric
     */
    public static @Nullable Number parseNumber(final @Nullable String text) {
        if (text == null) {
            return null;
        }
        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (INTEGER.matcher(trimmed).matches()) {
            try {
                return Long.parseLong(trimmed);
            } catch (final NumberFormatException e) {
                // Does not fit into a long
                return Double.parseDouble(trimmed);
            }
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        return null;
    }

    public static @Nullable Boolean parseBoolean(final @Nullable String text) {
        if (text == null) {
            return null;
        }
        final String trimmed = text.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return Boolean.FALSE;
        }
        return null;
    }

    /**
     * Parse a date or date/time in one of the commonly used notations.
     *
     * @return the parsed value, or null if no known format matches
     */
    public static @Nullable LocalDateTime parseDateTime(final @Nullable String text) {
        if (text == null) {
            return null;
        }
        final String trimmed = text.trim();
        if (trimmed.length() < 6 || !Character.isDigit(trimmed.charAt(0)) && !Character.isLetter(trimmed.charAt(0))) {
            return null;
        }
        for (final DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(trimmed, format);
            } catch (final DateTimeParseException e) {
                // try next format
            }
        }
        for (final DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format).atStartOfDay();
            } catch (final DateTimeParseException e) {
                // try next format
            }
        }
        return null;
    }

    /**
     * Convert a column of raw text cells into typed values.
     * <ul>
     *   <li>Blank cells become null.</li>
     *   <li>If every remaining cell is an integer the column becomes {@link Long}, or {@link Double}
     *       if the column has blank cells.</li>
     *   <li>If every remaining cell is numeric the column becomes {@link Double}.</li>
     *   <li>If every remaining cell is true/false the column becomes {@link Boolean}.</li>
     *   <li>Otherwise the text is kept.</li>
     * </ul>
     */
    public static List<Object> coerceColumn(final List<String> raw) {
        final List<Number> numbers = new ArrayList<>(raw.size());
        boolean numeric = true;
        boolean integral = true;
        boolean hasNulls = false;
        boolean any = false;

        for (final String cell : raw) {
            if (isBlank(cell)) {
                hasNulls = true;
                numbers.add(null);
                continue;
            }
            any = true;
            final Number number = parseNumber(cell);
            if (number == null) {
                numeric = false;
                break;
            }
            integral &= number instanceof Long;
            numbers.add(number);
        }

        final List<Object> result = new ArrayList<>(raw.size());
        if (any && numeric) {
            for (final Number number : numbers) {
                if (number == null) {
                    result.add(null);
                } else if (integral && !hasNulls) {
                    result.add(number.longValue());
                } else {
                    result.add(number.doubleValue());
                }
            }
            return result;
        }

        boolean booleans = any;
        for (final String cell : raw) {
            if (!isBlank(cell) && parseBoolean(cell) == null) {
                booleans = false;
                break;
            }
        }
        for (final String cell : raw) {
            if (isBlank(cell)) {
                result.add(null);
            } else {
                result.add(booleans ? parseBoolean(cell) : cell);
            }
        }
        return result;
    }

    /**
     * Narrow a column of doubles to longs when every value is integral and none is missing.
     */
    public static List<Object> narrowIntegers(final List<Object> values) {
        if (values.isEmpty()) {
            return values;
        }
        for (final Object value : values) {
            if (!(value instanceof Double)) {
                return values;
            }
            final double d = (Double) value;
            if (d != Math.rint(d) || Double.isInfinite(d) || Math.abs(d) > 9.0E15) {
                return values;
            }
        }
        final List<Object> result = new ArrayList<>(values.size());
        for (final Object value : values) {
            result.add(((Double) value).longValue());
        }
        return result;
    }

    /**
     * Render a cell value as text. Null renders as an empty string.
     */
    public static String format(final @Nullable Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            final double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Double.toString(d);
            }
            final String text = Double.toString(d);
            return text.contains("E") ? BigDecimal.valueOf(d).toPlainString() : text;
        }
        if (value instanceof LocalDateTime) {
            final LocalDateTime dateTime = (LocalDateTime) value;
            if (dateTime.truncatedTo(ChronoUnit.DAYS).equals(dateTime)) {
                return dateTime.toLocalDate().toString();
            }
            return DATE_TIME_OUTPUT.format(dateTime);
        }
        return value.toString();
    }

    /**
     * Ordering used for "smallest value wins" decisions. Numbers compare numerically,
     * values of the same comparable type compare naturally, anything else by type name and text.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(final Object left, final Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left.getClass() == right.getClass() && left instanceof Comparable) {
            return ((Comparable) left).compareTo(right);
        }
        final int byType = left.getClass().getName().compareTo(right.getClass().getName());
        return byType != 0 ? byType : format(left).compareTo(format(right));
    }
}
