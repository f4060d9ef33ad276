package de.mirkosertic.docmerge.parser;

import java.util.List;
import java.util.Map;

/**
 * Per-sheet statistics of a workbook.
 *
 * @param summary numeric column name to its summary statistics
 */
public record SheetMetrics(
        String sheetName,
        int rowCount,
        int columnCount,
        List<String> columns,
        Map<String, ColumnSummary> summary
) {

    public record ColumnSummary(double mean, double min, double max, double sum) {
    }
}
