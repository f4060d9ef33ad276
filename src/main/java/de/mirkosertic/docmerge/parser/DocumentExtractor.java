package de.mirkosertic.docmerge.parser;

import de.mirkosertic.docmerge.table.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Extracts text, tables and metrics from one document.
 *
 * <p>Implementations open or validate the file in their constructor and hold any native handle
 * until {@link #close()}.</p>
 */
public interface DocumentExtractor extends AutoCloseable {

    /**
     * Plain text representation of the whole document.
     */
    String extractText() throws IOException;

    /**
     * Tables found in the document, in document order. May be empty.
     */
    List<Table> extractTables() throws IOException;

    /**
     * Full envelope: metadata, text, tables, structure and metrics.
     */
    ParsedDocument parse() throws IOException;

    DocumentMetadata getMetadata() throws IOException;

    @Override
    default void close() {
        // Nothing to release by default
    }

    static Path requireExisting(final Path file) throws NoSuchFileException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "File not found");
        }
        return file;
    }
}
