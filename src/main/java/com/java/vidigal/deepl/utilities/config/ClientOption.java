package com.java.vidigal.deepl.utilities.config;

import com.java.vidigal.deepl.transport.HttpTransport;

/**
 * A client configuration option, applied to a {@link DeepLConfigBuilder} in the order given to
 * {@link DeepLConfig#of(String, ClientOption...)}.
 *
 * @author Vidigal
 */
@FunctionalInterface
public interface ClientOption {

    /**
     * Applies this option.
     *
     * @param builder the builder to configure
     */
    void applyTo(DeepLConfigBuilder builder);

    /**
     * Sets the API base URL; the translate and glossary endpoints follow it.
     *
     * @param baseUrl the base URL
     * @return the option
     */
    static ClientOption baseUrl(String baseUrl) {
        return builder -> builder.baseUrl(baseUrl);
    }

    /**
     * Replaces the transport used to send requests.
     *
     * @param transport the transport
     * @return the option
     */
    static ClientOption transport(HttpTransport transport) {
        return builder -> builder.transport(transport);
    }

    static ClientOption connectionTimeout(int connectionTimeoutMillis) {
        return builder -> builder.connectionTimeout(connectionTimeoutMillis);
    }

    static ClientOption requestTimeout(int requestTimeoutMillis) {
        return builder -> builder.requestTimeout(requestTimeoutMillis);
    }
}
