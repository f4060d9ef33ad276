package de.mirkosertic.docmerge.parser;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks and creates the extractor for a file based on its extension.
 */
public class ParserFactory {

    private static final Logger logger = LoggerFactory.getLogger(ParserFactory.class);

    /**
     * @throws UnsupportedFormatException if the extension is not supported
     */
    public DocumentFormat resolve(final Path file) {
        final String extension = DocumentFormat.extensionOf(file);
        final @Nullable DocumentFormat format = extension.isEmpty() ? null : DocumentFormat.forExtension(extension);
        if (format == null) {
            throw new UnsupportedFormatException(extension, DocumentFormat.supportedExtensions());
        }
        return format;
    }

    /**
     * Create the extractor for a file. The caller owns the returned extractor and must close it.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws UnsupportedFormatException        if the extension is not supported
     * @throws IOException                       if the extractor cannot open the file
     */
    public DocumentExtractor create(final Path file) throws IOException {
        DocumentExtractor.requireExisting(file);
        final DocumentFormat format = resolve(file);
        logger.debug("Using {} extractor for {}", format.tag(), file);
        return switch (format) {
            case EXCEL -> new ExcelDocumentExtractor(file);
            case CSV -> new CsvDocumentExtractor(file);
            case WORD -> new WordDocumentExtractor(file);
            case PDF -> new PdfDocumentExtractor(file);
        };
    }

    /**
     * Create the matching extractor, parse the file and release the extractor again.
     */
    public ParsedDocument parse(final Path file) throws IOException {
        try (final DocumentExtractor extractor = create(file)) {
            final ParsedDocument document = extractor.parse();
            logger.info("Parsed {} ({}): {} tables", file.getFileName(), document.metadata().format().tag(),
                    document.content().tables().size());
            return document;
        }
    }

    public List<String> supportedExtensions() {
        return DocumentFormat.supportedExtensions();
    }

    public boolean isSupported(final Path file) {
        final String extension = DocumentFormat.extensionOf(file);
        return !extension.isEmpty() && DocumentFormat.forExtension(extension) != null;
    }
}
