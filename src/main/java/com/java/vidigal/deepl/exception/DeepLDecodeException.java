package com.java.vidigal.deepl.exception;

/**
 * Exception for successful responses whose body does not have the expected JSON or TSV shape.
 */
public class DeepLDecodeException extends DeepLException {

    /**
     * Constructs a new DeepLDecodeException with the specified message.
     *
     * @param message The detail message.
     */
    public DeepLDecodeException(String message) {
        super(message);
    }

    /**
     * Constructs a new DeepLDecodeException with the specified message and cause.
     *
     * @param message The detail message.
     * @param cause   The parser failure.
     */
    public DeepLDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
