package de.mirkosertic.docmerge.parser;

import de.mirkosertic.docmerge.table.Table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Scalar statistics about a parsed document, in insertion order.
 */
public record DocumentMetrics(Map<String, Object> values) {

    public static final String ROW_COUNT = "row_count";
    public static final String COLUMN_COUNT = "column_count";
    public static final String SHEET_COUNT = "sheet_count";
    public static final String TOTAL_CELLS = "total_cells";
    public static final String PAGE_COUNT = "page_count";
    public static final String WORD_COUNT = "word_count";
    public static final String CHARACTER_COUNT = "character_count";
    public static final String PARAGRAPH_COUNT = "paragraph_count";
    public static final String TABLE_COUNT = "table_count";
    public static final String LINE_COUNT = "line_count";
    public static final String NUMERIC_COLUMNS = "numeric_columns";
    public static final String TEXT_COLUMNS = "text_columns";
    public static final String DATA_TYPES = "data_types";

    public DocumentMetrics {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Row, column and type statistics of a single table.
     */
    public static DocumentMetrics forTable(final Table table) {
        final int numeric = table.numericColumnCount();
        return builder()
                .put(ROW_COUNT, table.rowCount())
                .put(COLUMN_COUNT, table.columnCount())
                .put(DATA_TYPES, table.dataTypes())
                .put(NUMERIC_COLUMNS, numeric)
                .put(TEXT_COLUMNS, table.columnCount() - numeric)
                .build();
    }

    /**
     * Word, character and line counts of a text. Words are separated by whitespace, lines by newlines.
     */
    public static Builder forText(final String text) {
        return builder()
                .put(WORD_COUNT, countWords(text))
                .put(CHARACTER_COUNT, text.length())
                .put(LINE_COUNT, countLines(text));
    }

    static int countWords(final String text) {
        final String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }

    static int countLines(final String text) {
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }

    public boolean has(final String key) {
        return values.containsKey(key);
    }

    public OptionalInt getInt(final String key) {
        final Object value = values.get(key);
        if (value instanceof Number) {
            return OptionalInt.of(((Number) value).intValue());
        }
        return OptionalInt.empty();
    }

    public int rowCount() {
        return getInt(ROW_COUNT).orElse(0);
    }

    public int columnCount() {
        return getInt(COLUMN_COUNT).orElse(0);
    }

    public int pageCount() {
        return getInt(PAGE_COUNT).orElse(0);
    }

    public int wordCount() {
        return getInt(WORD_COUNT).orElse(0);
    }

    public int tableCount() {
        return getInt(TABLE_COUNT).orElse(0);
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> dataTypes() {
        final Object value = values.get(DATA_TYPES);
        if (value instanceof Map) {
            return (Map<String, String>) value;
        }
        return Map.of();
    }

    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(final String key, final Object value) {
            values.put(key, value instanceof Map ? Collections.unmodifiableMap(new LinkedHashMap<>((Map<?, ?>) value)) : value);
            return this;
        }

        public Builder putAll(final DocumentMetrics metrics) {
            values.putAll(metrics.values());
            return this;
        }

        public DocumentMetrics build() {
            return new DocumentMetrics(values);
        }
    }
}
