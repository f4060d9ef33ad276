package de.mirkosertic.docmerge.cleaning;

import de.mirkosertic.docmerge.table.ColumnType;
import de.mirkosertic.docmerge.table.Table;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Mutable column-major working copy of a table used during one cleaning pass.
 */
final class Frame {

    private final @Nullable String name;
    private final List<String> names;
    private final List<List<Object>> columns;
    private int rowCount;

    private Frame(final @Nullable String name, final List<String> names, final List<List<Object>> columns,
                  final int rowCount) {
        this.name = name;
        this.names = names;
        this.columns = columns;
        this.rowCount = rowCount;
    }

    static Frame of(final Table table) {
        final List<List<Object>> columns = new ArrayList<>(table.columnCount());
        for (int c = 0; c < table.columnCount(); c++) {
            columns.add(new ArrayList<>(table.column(c)));
        }
        return new Frame(table.getName(), new ArrayList<>(table.getColumns()), columns, table.rowCount());
    }

    int rowCount() {
        return rowCount;
    }

    int columnCount() {
        return names.size();
    }

    List<String> names() {
        return names;
    }

    String name(final int column) {
        return names.get(column);
    }

    void rename(final int column, final String newName) {
        names.set(column, newName);
    }

    int indexOf(final String column) {
        return names.indexOf(column);
    }

    List<Object> column(final int column) {
        return columns.get(column);
    }

    ColumnType type(final int column) {
        return ColumnType.of(columns.get(column));
    }

    void replaceColumn(final int column, final List<Object> values) {
        columns.set(column, new ArrayList<>(values));
    }

    void removeColumn(final int column) {
        names.remove(column);
        columns.remove(column);
    }

    void addColumn(final String columnName, final List<Object> values) {
        names.add(columnName);
        columns.add(new ArrayList<>(values));
    }

    List<Object> row(final int row) {
        final List<Object> values = new ArrayList<>(columns.size());
        for (final List<Object> column : columns) {
            values.add(column.get(row));
        }
        return values;
    }

    int nullCount(final int column) {
        int count = 0;
        for (final Object value : columns.get(column)) {
            if (value == null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Keep only the rows whose bit is set, preserving their order.
     */
    void retainRows(final BitSet keep) {
        for (int c = 0; c < columns.size(); c++) {
            final List<Object> source = columns.get(c);
            final List<Object> retained = new ArrayList<>(keep.cardinality());
            for (int r = keep.nextSetBit(0); r >= 0; r = keep.nextSetBit(r + 1)) {
                retained.add(source.get(r));
            }
            columns.set(c, retained);
        }
        rowCount = keep.cardinality();
    }

    CleaningReport.TableShape shape() {
        return new CleaningReport.TableShape(rowCount, names.size());
    }

    Table toTable() {
        final List<List<Object>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            rows.add(row(r));
        }
        return new Table(name, names, rows);
    }
}
