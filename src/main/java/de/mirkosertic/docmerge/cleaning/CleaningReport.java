package de.mirkosertic.docmerge.cleaning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a single cleaning pass did to one table.
 *
 * @param nullsFilled     column name to number of missing values handled
 * @param typesConverted  column name to {@code "<from> → <to>"} dtype description
 * @param columnsRenamed  original column name to normalized name, changed names only
 */
public record CleaningReport(
        TableShape originalShape,
        TableShape finalShape,
        int duplicatesRemoved,
        Map<String, Integer> nullsFilled,
        List<String> columnsDropped,
        Map<String, String> typesConverted,
        Map<String, String> columnsRenamed,
        int outliersDetected
) {

    private static final String RULE = "=".repeat(60);

    public record TableShape(int rows, int columns) {

        @Override
        public String toString() {
            return "(" + rows + ", " + columns + ")";
        }
    }

    public CleaningReport {
        nullsFilled = Collections.unmodifiableMap(new LinkedHashMap<>(nullsFilled));
        columnsDropped = List.copyOf(columnsDropped);
        typesConverted = Collections.unmodifiableMap(new LinkedHashMap<>(typesConverted));
        columnsRenamed = Collections.unmodifiableMap(new LinkedHashMap<>(columnsRenamed));
    }

    public static Builder builder(final TableShape originalShape) {
        return new Builder(originalShape);
    }

    /**
     * Human readable summary block.
     */
    public String render() {
        final List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("Data Cleaning Report");
        lines.add(RULE);
        lines.add("Shape: " + originalShape + " → " + finalShape);
        lines.add("");

        if (duplicatesRemoved > 0) {
            lines.add("✓ Removed " + duplicatesRemoved + " duplicate rows");
        }
        if (!nullsFilled.isEmpty()) {
            lines.add("✓ Filled nulls in " + nullsFilled.size() + " columns:");
            nullsFilled.forEach((column, count) -> lines.add("  - " + column + ": " + count + " values"));
        }
        if (!columnsDropped.isEmpty()) {
            lines.add("✓ Dropped " + columnsDropped.size() + " columns:");
            columnsDropped.forEach(column -> lines.add("  - " + column));
        }
        if (!typesConverted.isEmpty()) {
            lines.add("✓ Converted data types in " + typesConverted.size() + " columns:");
            typesConverted.forEach((column, conversion) -> lines.add("  - " + column + ": " + conversion));
        }
        if (!columnsRenamed.isEmpty()) {
            lines.add("✓ Renamed " + columnsRenamed.size() + " columns");
        }
        if (outliersDetected > 0) {
            lines.add("✓ Detected " + outliersDetected + " outliers");
        }
        lines.add(RULE);
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return render();
    }

    public static final class Builder {

        private final TableShape originalShape;
        private int duplicatesRemoved;
        private final Map<String, Integer> nullsFilled = new LinkedHashMap<>();
        private final List<String> columnsDropped = new ArrayList<>();
        private final Map<String, String> typesConverted = new LinkedHashMap<>();
        private final Map<String, String> columnsRenamed = new LinkedHashMap<>();
        private int outliersDetected;

        private Builder(final TableShape originalShape) {
            this.originalShape = originalShape;
        }

        public Builder duplicatesRemoved(final int count) {
            this.duplicatesRemoved = count;
            return this;
        }

        public Builder nullsFilled(final String column, final int count) {
            nullsFilled.put(column, count);
            return this;
        }

        public Builder columnDropped(final String column) {
            columnsDropped.add(column);
            return this;
        }

        public Builder typeConverted(final String column, final String conversion) {
            typesConverted.put(column, conversion);
            return this;
        }

        public Builder columnRenamed(final String from, final String to) {
            columnsRenamed.put(from, to);
            return this;
        }

        public Builder outliersDetected(final int count) {
            this.outliersDetected = count;
            return this;
        }

        public CleaningReport build(final TableShape finalShape) {
            return new CleaningReport(originalShape, finalShape, duplicatesRemoved, nullsFilled,
                    columnsDropped, typesConverted, columnsRenamed, outliersDetected);
        }
    }
}
