package org.lpreader.api;

/**
 * An exception that is thrown when an input cannot be turned into a {@link org.lpreader.model.Model}.
 * <p>
 * Reading is fail-fast: the first structural violation aborts the whole read, so there is
 * exactly one error code per failed read.
 */
public class LpReadException extends Exception {

    private final LpErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new read exception without position information.
     * @param errorCode The category of the failure.
     * @param message The detail message.
     */
    public LpReadException(LpErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * Constructs a new read exception with the specified detail message and cause.
     * @param errorCode The category of the failure.
     * @param message The detail message.
     * @param cause The cause.
     */
    public LpReadException(LpErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    /**
     * Constructs a new read exception pointing at a position in the input.
     * @param errorCode The category of the failure.
     * @param message The detail message.
     * @param sourceInfo The position of the offending token.
     */
    public LpReadException(LpErrorCode errorCode, String message, SourceInfo sourceInfo) {
        this(errorCode, message, sourceInfo, null);
    }

    /**
     * Constructs a new read exception pointing at a position in the input, with a cause.
     * @param errorCode The category of the failure.
     * @param message The detail message.
     * @param sourceInfo The position of the failure, or {@code null}.
     * @param cause The cause.
     */
    public LpReadException(LpErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo == null ? message : String.format("%s at %s", message, sourceInfo), cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The category of the failure.
     */
    public LpErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The position of the offending token, or {@code null} if the failure has no position.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
