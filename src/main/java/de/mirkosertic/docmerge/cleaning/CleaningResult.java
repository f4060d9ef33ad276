package de.mirkosertic.docmerge.cleaning;

import de.mirkosertic.docmerge.table.Table;

/**
 * Cleaned copy of a table together with the report of the pass that produced it.
 */
public record CleaningResult(Table table, CleaningReport report) {
}
