package com.java.vidigal.deepl.exception;

import java.io.IOException;

/**
 * Exception for round trips the transport could not complete, such as refused connections, timeouts
 * or a response body that broke off while being read.
 */
public class DeepLTransportException extends DeepLException {

    /**
     * Constructs a new DeepLTransportException.
     *
     * @param message The detail message.
     * @param cause   The I/O failure reported by the transport.
     */
    public DeepLTransportException(String message, IOException cause) {
        super(message, cause);
    }
}
