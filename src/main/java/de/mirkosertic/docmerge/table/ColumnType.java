package de.mirkosertic.docmerge.table;

import java.time.LocalDateTime;

/**
 * Type of a table column, derived from the values it holds.
 */
public enum ColumnType {

    INTEGER("int64"),
    FLOAT("float64"),
    BOOLEAN("bool"),
    DATETIME("datetime64"),
    TEXT("object"),
    /** Column without any non-null value. */
    EMPTY("empty");

    private final String dtype;

    ColumnType(final String dtype) {
        this.dtype = dtype;
    }

    /**
     * Short type tag used in metrics and cleaning reports.
     */
    public String dtype() {
        return dtype;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    /**
     * Determine the type of a column from its values. Nulls are ignored.
     */
    public static ColumnType of(final Iterable<?> values) {
        boolean any = false;
        boolean allIntegers = true;
        boolean allNumbers = true;
        boolean allBooleans = true;
        boolean allDates = true;

        for (final Object value : values) {
            if (value == null) {
                continue;
            }
            any = true;
            final boolean number = value instanceof Number;
            allNumbers &= number;
            allIntegers &= number && (value instanceof Long || value instanceof Integer);
            allBooleans &= value instanceof Boolean;
            allDates &= value instanceof LocalDateTime;
        }

        if (!any) {
            return EMPTY;
        }
        if (allIntegers) {
            return INTEGER;
        }
        if (allNumbers) {
            return FLOAT;
        }
        if (allBooleans) {
            return BOOLEAN;
        }
        if (allDates) {
            return DATETIME;
        }
        return TEXT;
    }
}
