package de.mirkosertic.docmerge.parser;

/**
 * Common envelope returned by every extractor.
 */
public record ParsedDocument(
        DocumentMetadata metadata,
        DocumentContent content,
        DocumentMetrics metrics
) {
}
