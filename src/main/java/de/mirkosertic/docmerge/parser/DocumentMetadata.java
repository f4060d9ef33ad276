package de.mirkosertic.docmerge.parser;

import org.apache.tika.Tika;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * File level metadata shared by all formats.
 *
 * @param extras format specific entries such as {@code page_count} or {@code encoding}
 */
public record DocumentMetadata(
        String fileName,
        String filePath,
        DocumentFormat format,
        long fileSize,
        double fileSizeMb,
        LocalDateTime modifiedAt,
        LocalDateTime parsedAt,
        @Nullable String mimeType,
        Map<String, String> extras
) {

    private static final Logger logger = LoggerFactory.getLogger(DocumentMetadata.class);

    private static final Tika TIKA = new Tika();

    public DocumentMetadata {
        extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static DocumentMetadata of(final Path file, final DocumentFormat format) throws IOException {
        return of(file, format, Map.of());
    }

    public static DocumentMetadata of(final Path file, final DocumentFormat format,
                                      final Map<String, String> extras) throws IOException {
        final long fileSize = Files.size(file);
        final LocalDateTime modifiedAt = LocalDateTime.ofInstant(
                Files.getLastModifiedTime(file).toInstant(), ZoneId.systemDefault());

        String mimeType = null;
        try {
            mimeType = TIKA.detect(file);
        } catch (final IOException e) {
            logger.warn("MIME type detection failed for file: {}", file, e);
        }

        return new DocumentMetadata(
                file.getFileName().toString(),
                file.toAbsolutePath().toString(),
                format,
                fileSize,
                toMegabytes(fileSize),
                modifiedAt,
                LocalDateTime.now(),
                mimeType,
                extras
        );
    }

    static double toMegabytes(final long bytes) {
        return BigDecimal.valueOf(bytes)
                .divide(BigDecimal.valueOf(1024L * 1024L), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
