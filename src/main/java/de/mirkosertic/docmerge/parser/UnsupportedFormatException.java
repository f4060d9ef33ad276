package de.mirkosertic.docmerge.parser;

import java.util.List;

/**
 * Thrown when a file extension does not map to any {@link DocumentFormat}.
 */
public class UnsupportedFormatException extends IllegalArgumentException {

    private final String extension;
    private final List<String> supportedExtensions;

    public UnsupportedFormatException(final String extension, final List<String> supportedExtensions) {
        super("Unsupported file format: " + (extension.isEmpty() ? "(none)" : extension)
                + ". Supported formats: " + String.join(", ", supportedExtensions));
        this.extension = extension;
        this.supportedExtensions = List.copyOf(supportedExtensions);
    }

    public String getExtension() {
        return extension;
    }

    public List<String> getSupportedExtensions() {
        return supportedExtensions;
    }
}
