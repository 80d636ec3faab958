package org.kos.depresolve.util;

/**
 * Thrown when a repository index is not structurally valid.
 */
public class MetadataParseException extends IllegalArgumentException {

    public MetadataParseException(String message) {
        super(message);
    }

    public MetadataParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
