package com.java.vidigal.deepl.transport;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An outbound HTTP request as formatted by the client.
 *
 * @param method  the HTTP method
 * @param uri     the target URI
 * @param headers the request headers, in insertion order
 * @param body    the request body, or null for requests without one
 */
public record TransportRequest(String method, URI uri, Map<String, String> headers, String body) {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    public TransportRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(uri, "uri must not be null");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Creates a GET request without headers.
     *
     * @param uri the target URI
     * @return the request
     */
    public static TransportRequest get(URI uri) {
        return new TransportRequest("GET", uri, Map.of(), null);
    }

    /**
     * Creates a DELETE request without headers.
     *
     * @param uri the target URI
     * @return the request
     */
    public static TransportRequest delete(URI uri) {
        return new TransportRequest("DELETE", uri, Map.of(), null);
    }

    /**
     * Creates a POST request carrying an {@value #FORM_URLENCODED} body.
     *
     * @param uri      the target URI
     * @param formBody the encoded form
     * @return the request
     */
    public static TransportRequest postForm(URI uri, String formBody) {
        return new TransportRequest("POST", uri, Map.of(CONTENT_TYPE, FORM_URLENCODED), formBody);
    }

    /**
     * Returns a copy of this request with one more header, replacing any header of the same name.
     *
     * @param name  the header name
     * @param value the header value
     * @return the new request
     */
    public TransportRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new TransportRequest(method, uri, copy, body);
    }

    /**
     * Returns the value of a header.
     *
     * @param name the header name
     * @return the value, or empty if the header is not set
     */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }
}
