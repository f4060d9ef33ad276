package de.mirkosertic.docmerge.parser;

import de.mirkosertic.docmerge.table.Table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracted content of a document.
 *
 * @param text      plain text
 * @param tables    tables in document order, may be empty
 * @param structure format specific structure information, e.g. sheet names or page count
 */
public record DocumentContent(
        String text,
        List<Table> tables,
        Map<String, Object> structure
) {

    public DocumentContent {
        tables = List.copyOf(tables);
        structure = Collections.unmodifiableMap(new LinkedHashMap<>(structure));
    }
}
