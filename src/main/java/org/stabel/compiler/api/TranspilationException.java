package org.stabel.compiler.api;

/**
 * An exception that is thrown when an error occurs during the transpilation process.
 * <p>
 * It is part of the public API and carries a {@link TranspilerErrorCode} so callers and tests
 * can react to the kind of failure without parsing the message.
 */
public class TranspilationException extends Exception {

    private final TranspilerErrorCode errorCode;

    /**
     * Constructs a new transpilation exception with the specified error code and detail message.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     */
    public TranspilationException(TranspilerErrorCode errorCode, String message) {
        super(message, null);
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new transpilation exception with the specified error code, detail message and cause.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     * @param cause The cause.
     */
    public TranspilationException(TranspilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code identifying the kind of failure.
     * @return The error code.
     */
    public TranspilerErrorCode getErrorCode() {
        return errorCode;
    }
}
