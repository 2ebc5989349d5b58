package com.java.vidigal.deepl.utilities.config;

import com.java.vidigal.deepl.transport.HttpTransport;
import com.java.vidigal.deepl.transport.JdkHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Builder for {@link DeepLConfig}. Every setter validates its argument immediately.
 * <p>
 * Unset values fall back to defaults: the Pro API base URL, a 5 second connect timeout, a 10 second
 * request timeout and a {@link JdkHttpTransport} created from those timeouts.
 * </p>
 *
 * @author Vidigal
 */
public class DeepLConfigBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DeepLConfigBuilder.class);
    private static final int MIN_TIMEOUT_MILLIS = 100;
    private static final int MAX_TIMEOUT_MILLIS = 300_000;

    String authKey;
    String baseUrl = DeepLConfig.DEFAULT_BASE_URL;
    HttpTransport transport;
    int connectionTimeout = 5000;
    int requestTimeout = 10000;

    DeepLConfigBuilder() {
    }

    /**
     * Sets the DeepL authentication key.
     *
     * @param authKey the key
     * @return this builder
     * @throws IllegalArgumentException if {@code authKey} is null or blank
     */
    public DeepLConfigBuilder authKey(String authKey) {
        if (authKey == null || authKey.isBlank()) {
            logger.error("Authentication key cannot be null or blank");
            throw new IllegalArgumentException("Authentication key cannot be null or blank");
        }
        this.authKey = authKey;
        return this;
    }

    /**
     * Sets the API base URL. The translate and glossary endpoints are derived from it.
     *
     * @param baseUrl the base URL, e.g. {@value DeepLConfig#FREE_BASE_URL}
     * @return this builder
     * @throws IllegalArgumentException if {@code baseUrl} is blank or not an absolute http(s) URL
     */
    public DeepLConfigBuilder baseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            logger.error("Base URL cannot be null or blank");
            throw new IllegalArgumentException("Base URL cannot be null or blank");
        }
        String trimmed = baseUrl.trim();
        if (!isHttpUrl(trimmed)) {
            logger.error("Base URL must be an absolute http or https URL: {}", trimmed);
            throw new IllegalArgumentException("Base URL must be an absolute http or https URL: " + trimmed);
        }
        this.baseUrl = trimmed;
        return this;
    }

    private static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url);
            return uri.isAbsolute() && uri.getHost() != null
                    && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Sets the transport used for every request, replacing the default {@link JdkHttpTransport}.
     *
     * @param transport the transport
     * @return this builder
     * @throws IllegalArgumentException if {@code transport} is null
     */
    public DeepLConfigBuilder transport(HttpTransport transport) {
        if (transport == null) {
            logger.error("Transport cannot be null");
            throw new IllegalArgumentException("Transport cannot be null");
        }
        this.transport = transport;
        return this;
    }

    /**
     * Sets the connect timeout of the default transport.
     *
     * @param connectionTimeout the timeout in milliseconds
     * @return this builder
     * @throws IllegalArgumentException if the value is out of range
     */
    public DeepLConfigBuilder connectionTimeout(int connectionTimeout) {
        if (connectionTimeout < MIN_TIMEOUT_MILLIS || connectionTimeout > MAX_TIMEOUT_MILLIS) {
            logger.error("Invalid connection timeout: {}", connectionTimeout);
            throw new IllegalArgumentException("Connection timeout must be between "
                    + MIN_TIMEOUT_MILLIS + " and " + MAX_TIMEOUT_MILLIS + " ms");
        }
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets the per-request timeout of the default transport.
     *
     * @param requestTimeout the timeout in milliseconds
     * @return this builder
     * @throws IllegalArgumentException if the value is out of range
     */
    public DeepLConfigBuilder requestTimeout(int requestTimeout) {
        if (requestTimeout < MIN_TIMEOUT_MILLIS || requestTimeout > MAX_TIMEOUT_MILLIS) {
            logger.error("Invalid request timeout: {}", requestTimeout);
            throw new IllegalArgumentException("Request timeout must be between "
                    + MIN_TIMEOUT_MILLIS + " and " + MAX_TIMEOUT_MILLIS + " ms");
        }
        this.requestTimeout = requestTimeout;
        return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the immutable configuration
     * @throws IllegalStateException if no auth key was set
     */
    public DeepLConfig build() {
        if (authKey == null) {
            logger.error("Authentication key must be set");
            throw new IllegalStateException("Authentication key must be set");
        }
        String normalizedBaseUrl = baseUrl;
        while (normalizedBaseUrl.endsWith("/")) {
            normalizedBaseUrl = normalizedBaseUrl.substring(0, normalizedBaseUrl.length() - 1);
        }
        HttpTransport effectiveTransport = transport != null ? transport : new JdkHttpTransport(
                Duration.ofMillis(connectionTimeout),
                Duration.ofMillis(requestTimeout));
        DeepLConfig config = new DeepLConfig(this, normalizedBaseUrl, effectiveTransport);
        logger.debug("Built {}", config);
        return config;
    }
}
