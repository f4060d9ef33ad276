package de.mirkosertic.docmerge.parser;

import de.mirkosertic.docmerge.table.MalformedTableException;
import de.mirkosertic.docmerge.table.Table;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.ref.Cleaner;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts page text and column aligned tables from PDF files.
 *
 * <p>The document stays open until {@link #close()} is called. If an instance becomes unreachable
 * without being closed, the document is released by a {@link Cleaner}.</p>
 */
public class PdfDocumentExtractor implements DocumentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PdfDocumentExtractor.class);

    private static final Cleaner CLEANER = Cleaner.create();

    private final Path file;
    private final PDDocument document;
    private final Cleaner.Cleanable cleanable;
    private boolean closed;

    /**
     * Releases the document. Must not reference the extractor itself.
     */
    private static final class DocumentCloser implements Runnable {

        private final PDDocument document;
        private final Path file;

        DocumentCloser(final PDDocument document, final Path file) {
            this.document = document;
            this.file = file;
        }

        @Override
        public void run() {
            try {
                document.close();
            } catch (final IOException e) {
                logger.warn("Error closing PDF document: {}", file, e);
            }
        }
    }

    public PdfDocumentExtractor(final Path file) throws IOException {
        this.file = DocumentExtractor.requireExisting(file);
        this.document = Loader.loadPDF(file.toFile());
        this.cleanable = CLEANER.register(this, new DocumentCloser(document, file));
        logger.debug("Opened PDF with {} pages: {}", document.getNumberOfPages(), file);
    }

    private PDDocument document() {
        if (closed) {
            throw new IllegalStateException("Extractor already closed: " + file);
        }
        return document;
    }

    public int getPageCount() {
        return document().getNumberOfPages();
    }

    /**
     * Text of a single page.
     *
     * @param pageNumber 1-based page number
     * @return the page text, or an empty string if the page does not exist
     */
    public String extractPageText(final int pageNumber) throws IOException {
        if (pageNumber < 1 || pageNumber > getPageCount()) {
            return "";
        }
        final PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        return stripper.getText(document()).strip();
    }

    /**
     * Text of all pages as {@code === Page n ===} blocks. Pages without text are left out.
     */
    @Override
    public String extractText() throws IOException {
        final List<String> parts = new ArrayList<>();
        for (int page = 1; page <= getPageCount(); page++) {
            final String text = extractPageText(page);
            if (!text.isEmpty()) {
                parts.add("=== Page " + page + " ===\n" + text);
            }
        }
        return String.join("\n\n", parts);
    }

    @Override
    public List<Table> extractTables() throws IOException {
        final PdfTableDetector detector = new PdfTableDetector();
        final List<Table> tables = new ArrayList<>();
        for (int page = 1; page <= getPageCount(); page++) {
            final List<List<List<String>>> regions;
            try {
                regions = detector.detect(document(), page);
            } catch (final IOException e) {
                logger.warn("Table extraction failed on page {} of {}: {}", page, file, e.getMessage());
                continue;
            }
            for (int i = 0; i < regions.size(); i++) {
                final String name = "page" + page + "_table" + (i + 1);
                final @Nullable Table table = toTableOrSkip(name, regions.get(i));
                if (table != null) {
                    tables.add(table);
                }
            }
        }
        return tables;
    }

    @Nullable Table toTableOrSkip(final String name, final List<List<String>> region) {
        try {
            return toTable(name, region);
        } catch (final MalformedTableException e) {
            logger.warn("Skipping table {} in {}: {}", name, file, e.getMessage());
            return null;
        }
    }

    static @Nullable Table toTable(final String name, final List<List<String>> region) {
        if (region.size() < 2) {
            return null;
        }
        final List<String> header = trimmed(region.get(0));
        final List<List<String>> rows = new ArrayList<>();
        for (final List<String> row : region.subList(1, region.size())) {
            final List<String> cells = trimmed(row);
            if (cells.stream().anyMatch(cell -> !cell.isEmpty())) {
                rows.add(cells);
            }
        }
        if (rows.isEmpty()) {
            return null;
        }
        return new Table(name, header, rows);
    }

    private static List<String> trimmed(final List<String> cells) {
        final List<String> result = new ArrayList<>(cells.size());
        for (final String cell : cells) {
            result.add(cell == null ? "" : cell.strip());
        }
        return result;
    }

    @Override
    public DocumentMetadata getMetadata() throws IOException {
        final Map<String, String> extras = new LinkedHashMap<>();
        extras.put("page_count", String.valueOf(getPageCount()));
        final PDDocumentInformation info = document().getDocumentInformation();
        if (info != null) {
            putIfPresent(extras, "title", info.getTitle());
            putIfPresent(extras, "author", info.getAuthor());
            putIfPresent(extras, "producer", info.getProducer());
        }
        return DocumentMetadata.of(file, DocumentFormat.PDF, extras);
    }

    private static void putIfPresent(final Map<String, String> target, final String key, final @Nullable String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value);
        }
    }

    @Override
    public ParsedDocument parse() throws IOException {
        final String text = extractText();
        final List<Table> tables = extractTables();

        final Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("pages", getPageCount());

        final DocumentMetrics metrics = DocumentMetrics.builder()
                .put(DocumentMetrics.PAGE_COUNT, getPageCount())
                .putAll(DocumentMetrics.forText(text)
                        .put(DocumentMetrics.TABLE_COUNT, tables.size())
                        .build())
                .build();

        return new ParsedDocument(
                getMetadata(),
                new DocumentContent(text, tables, structure),
                metrics
        );
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            cleanable.clean();
        }
    }
}
