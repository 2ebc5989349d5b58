package com.java.vidigal.deepl.transport;

import java.io.IOException;

/**
 * Capability for sending one HTTP request and receiving its response.
 * <p>
 * The client formats every request and decodes every response; the transport only performs the round
 * trip. Timeouts, connection pooling and proxies are the transport's business. Implementations used
 * from several threads must be safe for concurrent use.
 * </p>
 *
 * @author Vidigal
 * @see JdkHttpTransport
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Sends a request and returns the response.
     *
     * @param request the request to send
     * @return the response; the caller closes it
     * @throws IOException          if the round trip fails
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    TransportResponse send(TransportRequest request) throws IOException, InterruptedException;
}
