package de.mirkosertic.docmerge.table;

/**
 * Thrown when raw cells cannot be shaped into a rectangular {@link Table}.
 */
public class MalformedTableException extends RuntimeException {

    public MalformedTableException(final String message) {
        super(message);
    }
}
