package de.mirkosertic.docmerge.parser;

import de.mirkosertic.docmerge.table.MalformedTableException;
import de.mirkosertic.docmerge.table.Table;
import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.hwpf.model.StyleDescription;
import org.apache.poi.hwpf.usermodel.Paragraph;
import org.apache.poi.hwpf.usermodel.Range;
import org.apache.poi.hwpf.usermodel.TableIterator;
import org.apache.poi.hwpf.usermodel.TableRow;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.jspecify.annotations.Nullable;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts paragraphs, tables and headings from {@code .docx} (XWPF) and {@code .doc} (HWPF) files.
 */
public class WordDocumentExtractor implements DocumentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(WordDocumentExtractor.class);

    private static final Pattern HEADING_STYLE = Pattern.compile("(?i)heading\\s*(\\d+)");

    /**
     * Control characters HWPF leaves in paragraph and cell text (cell marks, field codes).
     */
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\u0000-\\u0008\\u000B-\\u001F\\u007F]");

    /**
     * Heading paragraph of a document.
     *
     * @param level heading level taken from the {@code Heading N} paragraph style
     */
    public record Heading(int level, String text) {
    }

    /**
     * Document content captured while the file is open.
     */
    private record WordContent(
            List<String> paragraphs,
            List<List<List<String>>> tables,
            List<Heading> headings,
            int sections
    ) {
    }

    private final Path file;
    private final WordContent content;

    public WordDocumentExtractor(final Path file) throws IOException {
        this.file = DocumentExtractor.requireExisting(file);
        final boolean legacy = DocumentFormat.extensionOf(file).equals(".doc");
        try (final InputStream is = Files.newInputStream(file)) {
            this.content = legacy ? loadDoc(is) : loadDocx(is);
        } catch (final IllegalArgumentException | IllegalStateException | POIXMLException e) {
            logger.error("Error opening Word document: {}", file, e);
            throw new IOException("Failed to parse document", e);
        }
        logger.debug("Loaded {} paragraphs and {} tables from {}",
                content.paragraphs().size(), content.tables().size(), file);
    }

    private static WordContent loadDocx(final InputStream is) throws IOException {
        try (final XWPFDocument document = new XWPFDocument(is)) {
            final XWPFStyles styles = document.getStyles();
            final List<String> paragraphs = new ArrayList<>();
            final List<Heading> headings = new ArrayList<>();
            int sections = document.getDocument().getBody().isSetSectPr() ? 1 : 0;

            for (final XWPFParagraph paragraph : document.getParagraphs()) {
                final String text = paragraph.getText();
                paragraphs.add(text);
                if (paragraph.getCTP().getPPr() != null && paragraph.getCTP().getPPr().isSetSectPr()) {
                    sections++;
                }
                final Integer level = headingLevel(styleName(styles, paragraph.getStyle()), paragraph.getStyle());
                if (level != null) {
                    headings.add(new Heading(level, text.strip()));
                }
            }

            final List<List<List<String>>> tables = new ArrayList<>();
            for (final XWPFTable table : document.getTables()) {
                final List<List<String>> rows = new ArrayList<>();
                for (final XWPFTableRow row : table.getRows()) {
                    final List<String> cells = new ArrayList<>();
                    for (final XWPFTableCell cell : row.getTableCells()) {
                        final String text = cell.getText().strip();
                        // A horizontally merged cell repeats its text once per grid column
                        for (int span = gridSpan(cell); span > 0; span--) {
                            cells.add(text);
                        }
                    }
                    rows.add(cells);
                }
                tables.add(rows);
            }

            // Every document has at least its implicit final section
            return new WordContent(paragraphs, tables, headings, Math.max(1, sections));
        }
    }

    static int gridSpan(final XWPFTableCell cell) {
        final CTTcPr properties = cell.getCTTc().getTcPr();
        if (properties == null || properties.getGridSpan() == null || properties.getGridSpan().getVal() == null) {
            return 1;
        }
        return Math.max(1, properties.getGridSpan().getVal().intValue());
    }

    private static WordContent loadDoc(final InputStream is) throws IOException {
        try (final HWPFDocument document = new HWPFDocument(is)) {
            final Range range = document.getRange();
            final List<String> paragraphs = new ArrayList<>();
            final List<Heading> headings = new ArrayList<>();

            for (int i = 0; i < range.numParagraphs(); i++) {
                final Paragraph paragraph = range.getParagraph(i);
                if (paragraph.isInTable()) {
                    continue;
                }
                final String text = stripControlChars(paragraph.text());
                paragraphs.add(text);
                final StyleDescription style = document.getStyleSheet().getStyleDescription(paragraph.getStyleIndex());
                final Integer level = headingLevel(style == null ? null : style.getName(), null);
                if (level != null) {
                    headings.add(new Heading(level, text.strip()));
                }
            }

            final List<List<List<String>>> tables = new ArrayList<>();
            final TableIterator iterator = new TableIterator(range);
            while (iterator.hasNext()) {
                final org.apache.poi.hwpf.usermodel.Table table = iterator.next();
                final List<List<String>> rows = new ArrayList<>();
                for (int r = 0; r < table.numRows(); r++) {
                    final TableRow row = table.getRow(r);
                    final List<String> cells = new ArrayList<>();
                    for (int c = 0; c < row.numCells(); c++) {
                        cells.add(stripControlChars(row.getCell(c).text()).strip());
                    }
                    rows.add(cells);
                }
                tables.add(rows);
            }

            return new WordContent(paragraphs, tables, headings, Math.max(1, range.numSections()));
        }
    }

    private static @Nullable String styleName(final @Nullable XWPFStyles styles, final @Nullable String styleId) {
        if (styles == null || styleId == null) {
            return null;
        }
        final XWPFStyle style = styles.getStyle(styleId);
        return style == null ? null : style.getName();
    }

    static @Nullable Integer headingLevel(final @Nullable String styleName, final @Nullable String styleId) {
        for (final String candidate : new String[]{styleName, styleId}) {
            if (candidate == null) {
                continue;
            }
            final Matcher matcher = HEADING_STYLE.matcher(candidate.strip());
            if (matcher.matches()) {
                return Integer.parseInt(matcher.group(1));
            }
        }
        return null;
    }

    private static String stripControlChars(final String text) {
        return CONTROL_CHARS.matcher(text).replaceAll("");
    }

    /**
     * Non-empty body paragraphs, trimmed and joined by newlines. Paragraphs inside tables are not included.
     */
    @Override
    public String extractText() {
        return content.paragraphs().stream()
                .map(String::strip)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    @Override
    public List<Table> extractTables() {
        final List<Table> result = new ArrayList<>();
        final List<List<List<String>>> tables = content.tables();
        for (int i = 0; i < tables.size(); i++) {
            final List<List<String>> rows = tables.get(i);
            if (rows.size() < 2) {
                continue;
            }
            try {
                result.add(new Table("table_" + (i + 1), rows.get(0), rows.subList(1, rows.size())));
            } catch (final MalformedTableException e) {
                logger.warn("Skipping table {} in {}: {}", i + 1, file, e.getMessage());
            }
        }
        return result;
    }

    public List<Heading> extractHeadings() {
        return content.headings();
    }

    @Override
    public DocumentMetadata getMetadata() throws IOException {
        return DocumentMetadata.of(file, DocumentFormat.WORD);
    }

    @Override
    public ParsedDocument parse() throws IOException {
        final String text = extractText();
        final List<Table> tables = extractTables();

        final Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("paragraphs", content.paragraphs().size());
        structure.put("tables", content.tables().size());
        structure.put("sections", content.sections());

        final DocumentMetrics metrics = DocumentMetrics.forText(text)
                .put(DocumentMetrics.PARAGRAPH_COUNT, content.paragraphs().size())
                .put(DocumentMetrics.TABLE_COUNT, content.tables().size())
                .build();

        return new ParsedDocument(
                getMetadata(),
                new DocumentContent(text, tables, structure),
                metrics
        );
    }
}
