package com.java.vidigal.deepl.utilities.config;

import com.java.vidigal.deepl.transport.HttpTransport;

/**
 * Immutable configuration of a DeepL client.
 * <p>
 * Built once through {@link DeepLConfigBuilder} or {@link #of(String, ClientOption...)} and read-only
 * afterwards, so a single instance can be shared by concurrent calls.
 * </p>
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * DeepLConfig config = DeepLConfig.of("your-auth-key:fx",
 *         ClientOption.baseUrl(DeepLConfig.FREE_BASE_URL));
 * }</pre>
 *
 * @author Vidigal
 */
public final class DeepLConfig {

    /**
     * Base URL of the DeepL Pro API, version 2.
     */
    public static final String DEFAULT_BASE_URL = "https://api.deepl.com/v2";

    /**
     * Base URL of the DeepL API Free plan, version 2.
     */
    public static final String FREE_BASE_URL = "https://api-free.deepl.com/v2";

    private final String authKey;
    private final String baseUrl;
    private final String translateUrl;
    private final String glossaryUrl;
    private final HttpTransport transport;
    private final int connectionTimeout;
    private final int requestTimeout;

    DeepLConfig(DeepLConfigBuilder builder, String baseUrl, HttpTransport transport) {
        this.authKey = builder.authKey;
        this.baseUrl = baseUrl;
        this.translateUrl = baseUrl + "/translate";
        this.glossaryUrl = baseUrl + "/glossaries";
        this.transport = transport;
        this.connectionTimeout = builder.connectionTimeout;
        this.requestTimeout = builder.requestTimeout;
    }

    /**
     * Creates a new builder seeded with the default settings.
     *
     * @return the builder
     */
    public static DeepLConfigBuilder builder() {
        return new DeepLConfigBuilder();
    }

    /**
     * Creates a configuration from an auth key and client options applied in order.
     *
     * @param authKey the DeepL authentication key
     * @param options the options, later ones overriding earlier ones for the same setting
     * @return the configuration
     * @throws IllegalArgumentException if the auth key or an option value is invalid
     */
    public static DeepLConfig of(String authKey, ClientOption... options) {
        DeepLConfigBuilder builder = builder().authKey(authKey);
        if (options != null) {
            for (ClientOption option : options) {
                if (option != null) {
                    option.applyTo(builder);
                }
            }
        }
        return builder.build();
    }

    public String getAuthKey() {
        return authKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Returns the translate endpoint, {@code {baseUrl}/translate}.
     *
     * @return the endpoint URL
     */
    public String getTranslateUrl() {
        return translateUrl;
    }

    /**
     * Returns the glossary collection endpoint, {@code {baseUrl}/glossaries}.
     *
     * @return the endpoint URL
     */
    public String getGlossaryUrl() {
        return glossaryUrl;
    }

    public HttpTransport getTransport() {
        return transport;
    }

    /**
     * Returns the connect timeout given to the default transport.
     *
     * @return the timeout in milliseconds
     */
    public int getConnectionTimeout() {
        return connectionTimeout;
    }

    /**
     * Returns the per-request timeout given to the default transport.
     *
     * @return the timeout in milliseconds
     */
    public int getRequestTimeout() {
        return requestTimeout;
    }

    @Override
    public String toString() {
        return "DeepLConfig{baseUrl='" + baseUrl + "', transport=" + transport.getClass().getSimpleName() + "}";
    }
}
