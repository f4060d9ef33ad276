package de.mirkosertic.docmerge.merge;

import de.mirkosertic.docmerge.parser.ParsedDocument;

import java.nio.file.Path;

/**
 * A parsed input file queued for merging.
 */
public record MergeSource(Path sourcePath, ParsedDocument document) {

    /**
     * File name without its extension.
     */
    public String stem() {
        final String name = sourcePath.getFileName().toString();
        final int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }
}
