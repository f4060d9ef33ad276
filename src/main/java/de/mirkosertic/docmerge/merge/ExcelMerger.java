package de.mirkosertic.docmerge.merge;

import de.mirkosertic.docmerge.cleaning.CleaningConfig;
import de.mirkosertic.docmerge.cleaning.CleaningReport;
import de.mirkosertic.docmerge.cleaning.CleaningResult;
import de.mirkosertic.docmerge.cleaning.DataCleaner;
import de.mirkosertic.docmerge.parser.DocumentMetadata;
import de.mirkosertic.docmerge.parser.ParsedDocument;
import de.mirkosertic.docmerge.parser.ParserFactory;
import de.mirkosertic.docmerge.table.Table;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Merges the tables of several documents into one workbook.
 * <p>
 * Files are parsed when they are added. {@link #mergeToExcel(Path)} then writes one sheet per table,
 * optionally cleaned first, followed by a {@code Summary} sheet that lists every source file.
 */
public class ExcelMerger {

    private static final Logger logger = LoggerFactory.getLogger(ExcelMerger.class);

    static final String SUMMARY_SHEET = "Summary";
    static final List<String> SUMMARY_HEADER = List.of(
            "Source File", "Format", "Tables", "Total Rows", "File Size (MB)", "Status");
    static final String STATUS_MERGED = "✓ Merged";
    static final String MERGE_INFO = "--- MERGE INFO ---";
    static final String TOTAL_FILES = "Total Files Merged";
    static final String MERGE_TIMESTAMP = "Merge Timestamp";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String DATE_CELL_FORMAT = "yyyy-mm-dd hh:mm:ss";
    private static final int MAX_CELL_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    private final ParserFactory parserFactory;
    private final boolean autoClean;
    private final CleaningConfig cleaningConfig;
    private final Clock clock;

    private final List<MergeSource> sources = new ArrayList<>();
    private final List<CleaningReport> lastCleaningReports = new ArrayList<>();

    public ExcelMerger(final ParserFactory parserFactory) {
        this(parserFactory, false, new CleaningConfig());
    }

    public ExcelMerger(final ParserFactory parserFactory, final boolean autoClean, final CleaningConfig cleaningConfig) {
        this(parserFactory, autoClean, cleaningConfig, Clock.systemDefaultZone());
    }

    ExcelMerger(final ParserFactory parserFactory, final boolean autoClean, final CleaningConfig cleaningConfig,
                final Clock clock) {
        this.parserFactory = parserFactory;
        this.autoClean = autoClean;
        this.cleaningConfig = new CleaningConfig(cleaningConfig);
        this.clock = clock;
    }

    /**
     * Parse a file and queue it for merging.
     *
     * @return true if the file was parsed and queued, false if it could not be parsed
     */
    public boolean addFile(final Path file) {
        logger.info("Processing: {}", file.getFileName());
        try {
            final ParsedDocument document = parserFactory.parse(file);
            sources.add(new MergeSource(file, document));
            logger.info("Extracted {} table(s) from {}", document.content().tables().size(), file.getFileName());
            return true;
        } catch (final IOException | RuntimeException e) {
            logger.error("Error adding file: {}", file, e);
            return false;
        }
    }

    /**
     * @return number of files that were added successfully
     */
    public int addFiles(final List<Path> files) {
        int success = 0;
        for (final Path file : files) {
            if (addFile(file)) {
                success++;
            }
        }
        if (success < files.size()) {
            logger.warn("Only {}/{} files processed successfully", success, files.size());
        }
        return success;
    }

    public List<MergeSource> getSources() {
        return Collections.unmodifiableList(sources);
    }

    /**
     * Reports of the tables cleaned by the last merge, in sheet order. Empty if auto clean is off.
     */
    public List<CleaningReport> getLastCleaningReports() {
        return List.copyOf(lastCleaningReports);
    }

    public void clear() {
        sources.clear();
        lastCleaningReports.clear();
    }

    /**
     * Write all queued sources to one workbook. Parent directories are created as needed.
     *
     * @return true if the workbook was written, false if there was nothing to merge or writing failed
     */
    public boolean mergeToExcel(final Path output) {
        if (sources.isEmpty()) {
            logger.error("No files to merge");
            return false;
        }

        lastCleaningReports.clear();
        logger.info("Merging {} file(s) into {}", sources.size(), output);

        try (final Workbook workbook = new XSSFWorkbook()) {
            final CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat(DATE_CELL_FORMAT));

            final SheetNamer namer = new SheetNamer(SUMMARY_SHEET);
            final @Nullable DataCleaner cleaner = autoClean ? new DataCleaner(cleaningConfig) : null;
            int sheetCount = 0;

            for (final MergeSource source : sources) {
                final List<Table> tables = source.document().content().tables();
                for (int i = 0; i < tables.size(); i++) {
                    Table table = tables.get(i);
                    if (cleaner != null) {
                        logger.debug("Cleaning table {} of {}", i + 1, source.sourcePath().getFileName());
                        final CleaningResult result = cleaner.clean(table);
                        table = result.table();
                        lastCleaningReports.add(result.report());
                    }

                    final String sheetName = namer.next(source.stem(), i, tables.size());
                    writeTable(workbook.createSheet(sheetName), table, dateStyle);
                    sheetCount++;
                    logger.info("Sheet '{}': {} rows x {} cols", sheetName, table.rowCount(), table.columnCount());
                }
            }

            writeSummary(workbook.createSheet(SUMMARY_SHEET), sheetCount);

            final Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (final OutputStream out = Files.newOutputStream(output)) {
                workbook.write(out);
            }

            logger.info("Merge complete: {} ({} data sheets + 1 summary, {} KB)", output, sheetCount,
                    String.format(Locale.ROOT, "%.2f", Files.size(output) / 1024.0));
            return true;
        } catch (final IOException | RuntimeException e) {
            logger.error("Merge failed: {}", output, e);
            return false;
        }
    }

    private static void writeTable(final Sheet sheet, final Table table, final CellStyle dateStyle) {
        final Row header = sheet.createRow(0);
        for (int c = 0; c < table.columnCount(); c++) {
            header.createCell(c).setCellValue(table.getColumns().get(c));
        }
        for (int r = 0; r < table.rowCount(); r++) {
            final Row row = sheet.createRow(r + 1);
            for (int c = 0; c < table.columnCount(); c++) {
                writeCell(row, c, table.cell(r, c), dateStyle);
            }
        }
    }

    private static void writeCell(final Row row, final int column, final @Nullable Object value, final CellStyle dateStyle) {
        if (value == null) {
            return;
        }
        if (value instanceof Number) {
            final double number = ((Number) value).doubleValue();
            if (!Double.isNaN(number) && !Double.isInfinite(number)) {
                row.createCell(column).setCellValue(number);
            }
        } else if (value instanceof Boolean) {
            row.createCell(column).setCellValue((Boolean) value);
        } else if (value instanceof LocalDateTime) {
            final Cell cell = row.createCell(column);
            cell.setCellValue((LocalDateTime) value);
            cell.setCellStyle(dateStyle);
        } else {
            final String text = value.toString();
            row.createCell(column).setCellValue(text.length() > MAX_CELL_TEXT ? text.substring(0, MAX_CELL_TEXT) : text);
        }
    }

    private void writeSummary(final Sheet sheet, final int sheetCount) {
        final Row header = sheet.createRow(0);
        for (int c = 0; c < SUMMARY_HEADER.size(); c++) {
            header.createCell(c).setCellValue(SUMMARY_HEADER.get(c));
        }

        int rowIndex = 1;
        long totalRows = 0;
        for (final MergeSource source : sources) {
            final DocumentMetadata metadata = source.document().metadata();
            final List<Table> tables = source.document().content().tables();
            final long rows = tables.stream().mapToLong(Table::rowCount).sum();
            totalRows += rows;

            final Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(metadata.fileName());
            row.createCell(1).setCellValue(metadata.format().tag().toUpperCase(Locale.ROOT));
            row.createCell(2).setCellValue(tables.size());
            row.createCell(3).setCellValue(rows);
            row.createCell(4).setCellValue(metadata.fileSizeMb());
            row.createCell(5).setCellValue(STATUS_MERGED);
        }

        sheet.createRow(rowIndex++).createCell(0).setCellValue(MERGE_INFO);

        final Row totals = sheet.createRow(rowIndex++);
        totals.createCell(0).setCellValue(TOTAL_FILES);
        totals.createCell(1).setCellValue(sources.size());
        totals.createCell(2).setCellValue(sheetCount);
        totals.createCell(3).setCellValue(totalRows);

        final Row timestamp = sheet.createRow(rowIndex);
        timestamp.createCell(0).setCellValue(MERGE_TIMESTAMP);
        timestamp.createCell(1).setCellValue(TIMESTAMP_FORMAT.format(LocalDateTime.now(clock)));
    }
}
