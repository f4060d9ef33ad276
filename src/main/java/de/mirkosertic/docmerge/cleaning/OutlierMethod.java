package de.mirkosertic.docmerge.cleaning;

import java.util.Locale;

public enum OutlierMethod {
    /** Values outside {@code [Q1 - 1.5 * IQR, Q3 + 1.5 * IQR]}. */
    IQR,
    /** Values whose absolute z-score exceeds the configured threshold. */
    ZSCORE;

    public static OutlierMethod parse(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace("-", ""));
    }
}
