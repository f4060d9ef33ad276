package de.mirkosertic.docmerge.merge;

import org.apache.poi.ss.util.WorkbookUtil;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Derives worksheet names from source file names.
 * <p>
 * A source with a single table gets its file stem as sheet name, a source with several tables gets
 * {@code <stem>_T<n>}. Names are made valid for the workbook format and cut to 31 characters.
 * Since sheet names must be unique ignoring case, a name that is already taken gets a
 * {@code " (2)"}, {@code " (3)"} ... suffix.
 */
class SheetNamer {

    static final int MAX_SHEET_NAME_LENGTH = 31;

    private final Set<String> used = new HashSet<>();

    SheetNamer(final String... reserved) {
        for (final String name : reserved) {
            used.add(name.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * @param tableIndex 0-based index of the table within its source
     * @param tableCount number of tables of the source
     */
    String next(final String stem, final int tableIndex, final int tableCount) {
        final String base = stem.isBlank() ? "Sheet" : stem;
        final String proposal = tableCount == 1 ? base : base + "_T" + (tableIndex + 1);
        final String safe = WorkbookUtil.createSafeSheetName(proposal);

        String candidate = safe;
        int counter = 2;
        while (used.contains(candidate.toLowerCase(Locale.ROOT))) {
            final String suffix = " (" + counter++ + ")";
            final int keep = Math.min(safe.length(), MAX_SHEET_NAME_LENGTH - suffix.length());
            candidate = safe.substring(0, keep) + suffix;
        }
        used.add(candidate.toLowerCase(Locale.ROOT));
        return candidate;
    }
}
