package de.mirkosertic.docmerge.parser;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import de.mirkosertic.docmerge.table.MalformedTableException;
import de.mirkosertic.docmerge.table.Table;
import org.apache.tika.parser.txt.CharsetDetector;
import org.apache.tika.parser.txt.CharsetMatch;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts a single table from a delimited text file.
 *
 * <p>The character encoding is sniffed from the beginning of the file. If the file cannot be
 * decoded strictly with the detected encoding, it is decoded as UTF-8 and undecodable bytes are
 * replaced with U+FFFD.</p>
 */
public class CsvDocumentExtractor implements DocumentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(CsvDocumentExtractor.class);

    static final int DETECTION_SAMPLE_SIZE = 10_000;
    private static final char BOM = '\uFEFF';

    private final Path file;
    private final String encoding;

    private @Nullable Table table;

    public CsvDocumentExtractor(final Path file) throws IOException {
        this.file = DocumentExtractor.requireExisting(file);
        this.encoding = detectEncoding(file);
    }

    CsvDocumentExtractor(final Path file, final String encoding) throws IOException {
        this.file = DocumentExtractor.requireExisting(file);
        this.encoding = encoding;
    }

    static String detectEncoding(final Path file) throws IOException {
        final byte[] sample;
        try (final InputStream is = Files.newInputStream(file)) {
            sample = is.readNBytes(DETECTION_SAMPLE_SIZE);
        }
        if (sample.length == 0) {
            return StandardCharsets.UTF_8.name();
        }

        final CharsetDetector detector = new CharsetDetector();
        detector.setText(sample);
        final CharsetMatch match = detector.detect();
        if (match == null || match.getName() == null) {
            logger.debug("No encoding detected for {}, using UTF-8", file);
            return StandardCharsets.UTF_8.name();
        }
        logger.debug("Detected encoding {} (confidence: {}%) for {}", match.getName(), match.getConfidence(), file);
        return match.getName();
    }

    public String getEncoding() {
        return encoding;
    }

    private Table loadTable() throws IOException {
        if (table == null) {
            table = readTable(decode(Files.readAllBytes(file)));
            logger.debug("Loaded {} rows and {} columns from {}", table.rowCount(), table.columnCount(), file);
        }
        return table;
    }

    private String decode(final byte[] bytes) {
        String text;
        try {
            text = Charset.forName(encoding).newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (final CharacterCodingException | UnsupportedCharsetException | IllegalCharsetNameException e) {
            logger.warn("Failed to decode {} as {}, falling back to UTF-8: {}", file, encoding, e.toString());
            text = new String(bytes, StandardCharsets.UTF_8);
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return text;
    }

    private Table readTable(final String text) throws IOException {
        final List<String[]> records;
        try (final CSVReader reader = new CSVReaderBuilder(new StringReader(text)).build()) {
            records = reader.readAll();
        } catch (final CsvException e) {
            throw new IOException("Failed to parse document", e);
        }

        final List<List<String>> rows = new ArrayList<>(records.size());
        for (final String[] record : records) {
            if (record.length == 1 && record[0].isBlank()) {
                // Blank line
                continue;
            }
            rows.add(Arrays.asList(record));
        }
        if (rows.isEmpty()) {
            throw new IOException("No columns to parse from file: " + file);
        }

        final int width = rows.get(0).size();
        final List<List<String>> rectangular = new ArrayList<>(rows.size());
        rectangular.add(rows.get(0));
        for (int i = 1; i < rows.size(); i++) {
            final List<String> row = rows.get(i);
            if (row.size() > width) {
                throw new MalformedTableException(String.format(
                        "Error tokenizing data. Expected %d fields in line %d, saw %d", width, i + 1, row.size()));
            }
            final List<String> padded = new ArrayList<>(row);
            while (padded.size() < width) {
                padded.add(null);
            }
            rectangular.add(padded);
        }
        return Table.fromRawRows(null, rectangular);
    }

    @Override
    public String extractText() throws IOException {
        return loadTable().toText();
    }

    @Override
    public List<Table> extractTables() throws IOException {
        return List.of(loadTable());
    }

    @Override
    public DocumentMetadata getMetadata() throws IOException {
        return DocumentMetadata.of(file, DocumentFormat.CSV, Map.of("encoding", encoding));
    }

    @Override
    public ParsedDocument parse() throws IOException {
        final Table data = loadTable();

        final Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("columns", data.getColumns());
        structure.put("rows", data.rowCount());
        structure.put("encoding", encoding);

        return new ParsedDocument(
                getMetadata(),
                new DocumentContent(data.toText(), List.of(data), structure),
                DocumentMetrics.forTable(data)
        );
    }
}
