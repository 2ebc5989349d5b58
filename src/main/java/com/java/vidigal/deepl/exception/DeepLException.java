package com.java.vidigal.deepl.exception;

/**
 * Base exception for errors in the DeepL client, such as network issues, API rejections or
 * unreadable responses.
 * <p>
 * Subclasses identify the failure kind: {@link DeepLApiException} for rejected requests,
 * {@link DeepLTransportException} for failed round trips, {@link DeepLDecodeException} for
 * responses that cannot be read and {@link NoTranslationException} for empty translation results.
 * </p>
 */
public class DeepLException extends Exception {

    /**
     * Constructs a new DeepLException with the specified message.
     *
     * @param message The detail message.
     */
    public DeepLException(String message) {
        super(message);
    }

    /**
     * Constructs a new DeepLException with the specified message and cause.
     *
     * @param message The detail message.
     * @param cause   The cause of the exception.
     */
    public DeepLException(String message, Throwable cause) {
        super(message, cause);
    }
}
