package de.mirkosertic.docmerge.parser;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Document formats that can be parsed, keyed by file extension.
 */
public enum DocumentFormat {

    EXCEL("excel", ".xlsx", ".xls"),
    CSV("csv", ".csv"),
    WORD("word", ".docx", ".doc"),
    PDF("pdf", ".pdf");

    private static final Map<String, DocumentFormat> BY_EXTENSION;

    static {
        final Map<String, DocumentFormat> map = new LinkedHashMap<>();
        for (final DocumentFormat format : values()) {
            for (final String extension : format.extensions) {
                map.put(extension, format);
            }
        }
        BY_EXTENSION = Collections.unmodifiableMap(map);
    }

    private final String tag;
    private final List<String> extensions;

    DocumentFormat(final String tag, final String... extensions) {
        this.tag = tag;
        this.extensions = List.of(extensions);
    }

    /**
     * Lower-case tag as reported in document metadata, e.g. {@code excel}.
     */
    public String tag() {
        return tag;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * @param extension extension including the leading dot, case-insensitive
     * @return the format, or null if the extension is not supported
     */
    public static @Nullable DocumentFormat forExtension(final String extension) {
        return BY_EXTENSION.get(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * All supported extensions in a stable order.
     */
    public static List<String> supportedExtensions() {
        return List.copyOf(BY_EXTENSION.keySet());
    }

    /**
     * Lower-case extension of a file including the dot, or an empty string if the file name has none.
     */
    public static String extensionOf(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return "";
        }
        final String name = fileName.toString();
        final int lastDot = name.lastIndexOf('.');
        if (lastDot > 0 && lastDot < name.length() - 1) {
            return name.substring(lastDot).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
