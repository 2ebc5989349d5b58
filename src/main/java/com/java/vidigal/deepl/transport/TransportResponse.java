package com.java.vidigal.deepl.transport;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * An HTTP response as delivered by a {@link HttpTransport}. The body is a stream that must be closed,
 * which {@link #close()} does.
 *
 * @param statusCode the HTTP status code
 * @param headers    the response headers
 * @param body       the response body stream, never null
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, InputStream body)
        implements Closeable {

    public TransportResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? InputStream.nullInputStream() : body;
    }

    /**
     * Creates a response with a UTF-8 string body and no headers.
     *
     * @param statusCode the HTTP status code
     * @param body       the body text
     * @return the response
     */
    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, Map.of(),
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Reads the whole body as UTF-8 text.
     *
     * @return the body text
     * @throws IOException if reading the stream fails
     */
    public String bodyAsString() throws IOException {
        return new String(body.readAllBytes(), StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
