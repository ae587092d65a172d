package org.lpreader.util.compression;

/**
 * Exception thrown when a compression codec cannot be used in the current environment.
 */
public class CompressionException extends Exception {

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
