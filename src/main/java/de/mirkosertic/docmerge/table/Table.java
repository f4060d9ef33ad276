package de.mirkosertic.docmerge.table;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, rectangular table of typed cells.
 *
 * <p>Column names are unique. Blank header cells are named {@code Unnamed: <index>}, repeated
 * names get a {@code .1}, {@code .2} suffix. Every row has exactly one cell per column; cells are
 * {@code null} or one of the types accepted by {@link CellValues#normalize(Object)}.</p>
 */
public final class Table {

    private final @Nullable String name;
    private final List<String> columns;
    private final List<List<Object>> rows;

    public Table(final @Nullable String name, final List<String> columns, final List<? extends List<?>> rows) {
        this.name = name;
        this.columns = Collections.unmodifiableList(uniqueColumnNames(columns));

        final List<List<Object>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            final List<?> row = rows.get(i);
            if (row.size() != columns.size()) {
                throw new MalformedTableException(
                        String.format("Row %d has %d cells, expected %d", i, row.size(), columns.size()));
            }
            final List<Object> normalized = new ArrayList<>(row.size());
            for (final Object cell : row) {
                normalized.add(CellValues.normalize(cell));
            }
            copy.add(Collections.unmodifiableList(normalized));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Table of(final List<String> columns, final List<? extends List<?>> rows) {
        return new Table(null, columns, rows);
    }

    /**
     * Build a table from raw text rows. The first row is the header, the remaining rows are data.
     * Every data column is converted with {@link CellValues#coerceColumn(List)}.
     */
    public static Table fromRawRows(final @Nullable String name, final List<List<String>> rawRows) {
        if (rawRows.isEmpty()) {
            throw new MalformedTableException("Table has no header row");
        }
        final List<String> header = rawRows.get(0);
        final int width = header.size();
        final List<List<String>> data = rawRows.subList(1, rawRows.size());
        for (int i = 0; i < data.size(); i++) {
            if (data.get(i).size() != width) {
                throw new MalformedTableException(
                        String.format("Row %d has %d cells, expected %d", i, data.get(i).size(), width));
            }
        }

        final List<List<Object>> byColumn = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            final List<String> raw = new ArrayList<>(data.size());
            for (final List<String> row : data) {
                raw.add(row.get(c));
            }
            byColumn.add(CellValues.coerceColumn(raw));
        }

        final List<List<Object>> rows = new ArrayList<>(data.size());
        for (int r = 0; r < data.size(); r++) {
            final List<Object> row = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                row.add(byColumn.get(c).get(r));
            }
            rows.add(row);
        }
        return new Table(name, header, rows);
    }

    static List<String> uniqueColumnNames(final List<String> names) {
        final List<String> result = new ArrayList<>(names.size());
        final Set<String> seen = new HashSet<>();
        final Map<String, Integer> counters = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            final String raw = names.get(i);
            final String base = raw == null || raw.isBlank() ? "Unnamed: " + i : raw.trim();
            String candidate = base;
            while (seen.contains(candidate)) {
                final int next = counters.merge(base, 1, Integer::sum);
                candidate = base + "." + next;
            }
            seen.add(candidate);
            result.add(candidate);
        }
        return result;
    }

    public @Nullable String getName() {
        return name;
    }

    public Table withName(final @Nullable String newName) {
        return new Table(newName, columns, rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * @return index of the column, or -1 if there is no such column
     */
    public int columnIndex(final String column) {
        return columns.indexOf(column);
    }

    public @Nullable Object cell(final int row, final int column) {
        return rows.get(row).get(column);
    }

    public List<Object> column(final int index) {
        final List<Object> values = new ArrayList<>(rows.size());
        for (final List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    public List<Object> column(final String column) {
        final int index = columnIndex(column);
        if (index < 0) {
            throw new IllegalArgumentException("No such column: " + column);
        }
        return column(index);
    }

    public ColumnType columnType(final int index) {
        return ColumnType.of(column(index));
    }

    public ColumnType columnType(final String column) {
        return ColumnType.of(column(column));
    }

    /**
     * Column name to dtype tag, in column order.
     */
    public Map<String, String> dataTypes() {
        final Map<String, String> types = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            types.put(columns.get(i), columnType(i).dtype());
        }
        return types;
    }

    public int numericColumnCount() {
        int count = 0;
        for (int i = 0; i < columns.size(); i++) {
            if (columnType(i).isNumeric()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Render the table as fixed-width text: one line per row, cells right-aligned to the widest
     * value of their column and separated by a single space.
     */
    public String toText() {
        final int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).length();
            for (final List<Object> row : rows) {
                widths[c] = Math.max(widths[c], CellValues.format(row.get(c)).length());
            }
        }

        final StringBuilder result = new StringBuilder();
        appendLine(result, columns, widths);
        for (final List<Object> row : rows) {
            result.append('\n');
            final List<String> cells = new ArrayList<>(row.size());
            for (final Object cell : row) {
                cells.add(CellValues.format(cell));
            }
            appendLine(result, cells, widths);
        }
        return result.toString();
    }

    private static void appendLine(final StringBuilder target, final List<String> cells, final int[] widths) {
        for (int c = 0; c < cells.size(); c++) {
            if (c > 0) {
                target.append(' ');
            }
            final String cell = cells.get(c);
            target.append(" ".repeat(Math.max(0, widths[c] - cell.length()))).append(cell);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table)) {
            return false;
        }
        final Table other = (Table) o;
        return Objects.equals(name, other.name) && columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, rows);
    }

    @Override
    public String toString() {
        return "Table{name=" + name + ", columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
