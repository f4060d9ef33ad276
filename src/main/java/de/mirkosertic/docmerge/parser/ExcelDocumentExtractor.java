package de.mirkosertic.docmerge.parser;

import de.mirkosertic.docmerge.table.CellValues;
import de.mirkosertic.docmerge.table.Table;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Extracts every sheet of an {@code .xlsx} or {@code .xls} workbook as a table.
 *
 * <p>The workbook is read completely in the constructor and closed again. The first non-empty row
 * of each sheet is the header; fully empty rows are skipped.</p>
 */
public class ExcelDocumentExtractor implements DocumentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ExcelDocumentExtractor.class);

    private final Path file;
    private final Map<String, Table> sheets;

    public ExcelDocumentExtractor(final Path file) throws IOException {
        this.file = DocumentExtractor.requireExisting(file);

        try (final Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            final DataFormatter formatter = new DataFormatter();
            final Map<String, Table> loaded = new LinkedHashMap<>();
            for (final Sheet sheet : workbook) {
                loaded.put(sheet.getSheetName(), readSheet(sheet, formatter));
            }
            this.sheets = Collections.unmodifiableMap(loaded);
        } catch (final EncryptedDocumentException | IllegalArgumentException | POIXMLException e) {
            logger.error("Error opening workbook: {}", file, e);
            throw new IOException("Failed to parse document", e);
        }
        logger.debug("Loaded {} sheets from {}", sheets.size(), file);
    }

    private static Table readSheet(final Sheet sheet, final DataFormatter formatter) {
        int width = 0;
        final List<Row> rows = new ArrayList<>();
        for (final Row row : sheet) {
            if (isEmpty(row)) {
                continue;
            }
            rows.add(row);
            width = Math.max(width, row.getLastCellNum());
        }
        if (rows.isEmpty()) {
            return new Table(sheet.getSheetName(), List.of(), List.of());
        }

        final Row headerRow = rows.get(0);
        final List<String> header = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            final Cell cell = headerRow.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            header.add(cell == null ? "" : formatter.formatCellValue(cell).trim());
        }

        final List<List<Object>> columns = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            final List<Object> values = new ArrayList<>(rows.size() - 1);
            for (int r = 1; r < rows.size(); r++) {
                values.add(cellValue(rows.get(r).getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL)));
            }
            columns.add(CellValues.narrowIntegers(values));
        }

        final List<List<Object>> data = new ArrayList<>(rows.size() - 1);
        for (int r = 0; r < rows.size() - 1; r++) {
            final List<Object> row = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                row.add(columns.get(c).get(r));
            }
            data.add(row);
        }
        return new Table(sheet.getSheetName(), header, data);
    }

    private static boolean isEmpty(final Row row) {
        for (final Cell cell : row) {
            if (cellValue(cell) != null) {
                return false;
            }
        }
        return true;
    }

    static @Nullable Object cellValue(final @Nullable Cell cell) {
        if (cell == null) {
            return null;
        }
        final CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return switch (type) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue()
                    : (Object) cell.getNumericCellValue();
            case STRING -> {
                final String text = cell.getStringCellValue();
                yield text == null || text.isBlank() ? null : text;
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }

    public List<String> getSheetNames() {
        return List.copyOf(sheets.keySet());
    }

    public Optional<Table> getTable(final String sheetName) {
        return Optional.ofNullable(sheets.get(sheetName));
    }

    /**
     * Statistics of the first sheet.
     */
    public Optional<SheetMetrics> extractSheetMetrics() {
        if (sheets.isEmpty()) {
            return Optional.empty();
        }
        return extractSheetMetrics(sheets.keySet().iterator().next());
    }

    /**
     * Row and column counts of a sheet plus mean, min, max and sum of every numeric column.
     *
     * @return the statistics, or empty if there is no sheet with that name
     */
    public Optional<SheetMetrics> extractSheetMetrics(final String sheetName) {
        final Table table = sheets.get(sheetName);
        if (table == null) {
            return Optional.empty();
        }

        final Map<String, SheetMetrics.ColumnSummary> summary = new LinkedHashMap<>();
        for (int c = 0; c < table.columnCount(); c++) {
            if (!table.columnType(c).isNumeric()) {
                continue;
            }
            final List<Double> values = table.column(c).stream()
                    .filter(v -> v != null)
                    .map(v -> ((Number) v).doubleValue())
                    .collect(Collectors.toList());
            final double sum = values.stream().mapToDouble(Double::doubleValue).sum();
            summary.put(table.getColumns().get(c), new SheetMetrics.ColumnSummary(
                    sum / values.size(),
                    values.stream().mapToDouble(Double::doubleValue).min().orElse(Double.NaN),
                    values.stream().mapToDouble(Double::doubleValue).max().orElse(Double.NaN),
                    sum
            ));
        }

        return Optional.of(new SheetMetrics(
                sheetName,
                table.rowCount(),
                table.columnCount(),
                table.getColumns(),
                summary
        ));
    }

    @Override
    public String extractText() {
        return sheets.entrySet().stream()
                .map(e -> "=== " + e.getKey() + " ===\n" + e.getValue().toText())
                .collect(Collectors.joining("\n\n"));
    }

    @Override
    public List<Table> extractTables() {
        return List.copyOf(sheets.values());
    }

    @Override
    public DocumentMetadata getMetadata() throws IOException {
        return DocumentMetadata.of(file, DocumentFormat.EXCEL);
    }

    @Override
    public ParsedDocument parse() throws IOException {
        final Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("sheet_names", getSheetNames());
        structure.put("sheet_count", sheets.size());

        // Row, column and cell counts describe the first sheet only
        final int rows = sheets.isEmpty() ? 0 : sheets.values().iterator().next().rowCount();
        final int columns = sheets.isEmpty() ? 0 : sheets.values().iterator().next().columnCount();
        final DocumentMetrics metrics = DocumentMetrics.builder()
                .put(DocumentMetrics.SHEET_COUNT, sheets.size())
                .put(DocumentMetrics.ROW_COUNT, rows)
                .put(DocumentMetrics.COLUMN_COUNT, columns)
                .put(DocumentMetrics.TOTAL_CELLS, rows * columns)
                .build();

        return new ParsedDocument(
                getMetadata(),
                new DocumentContent(extractText(), extractTables(), structure),
                metrics
        );
    }
}
