package de.mirkosertic.docmerge.cleaning;

import java.util.Locale;

/**
 * How missing values of a column are replaced.
 * <p>
 * {@link #MEAN} and {@link #MEDIAN} only apply to numeric columns, other columns fall back to
 * {@link #DEFAULT}.
 */
public enum FillStrategy {
    MEAN,
    MEDIAN,
    MODE,
    FFILL,
    BFILL,
    DROP,
    /** Zero for numeric columns, empty string for everything else. */
    DEFAULT;

    public static FillStrategy parse(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
