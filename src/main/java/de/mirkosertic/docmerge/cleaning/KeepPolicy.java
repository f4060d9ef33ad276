package de.mirkosertic.docmerge.cleaning;

import java.util.Locale;

/**
 * Which occurrence of a duplicate row survives deduplication.
 */
public enum KeepPolicy {
    FIRST,
    LAST,
    /** Drop every row that has a duplicate. */
    NONE;

    public static KeepPolicy parse(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
