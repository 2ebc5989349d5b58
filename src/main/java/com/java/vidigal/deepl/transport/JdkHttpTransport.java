package com.java.vidigal.deepl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 * <p>
 * The connect timeout is a property of the wrapped client; every request additionally gets the
 * configured request timeout. Response bodies are streamed, not buffered.
 * </p>
 *
 * @author Vidigal
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * Constructs a transport with a new HTTP/2 client.
     *
     * @param connectionTimeout the connect timeout
     * @param requestTimeout    the timeout applied to each request
     */
    public JdkHttpTransport(Duration connectionTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(connectionTimeout)
                .build(), requestTimeout);
    }

    /**
     * Constructs a transport over an existing client, e.g. one with a proxy or custom SSL context.
     *
     * @param httpClient     the HTTP client for API communication
     * @param requestTimeout the timeout applied to each request, or null for none
     * @throws IllegalArgumentException if {@code httpClient} is null
     */
    public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
        if (httpClient == null) {
            logger.error("HTTP client cannot be null");
            throw new IllegalArgumentException("HTTP client cannot be null");
        }
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
        HttpRequest.BodyPublisher publisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .method(request.method(), publisher);
        request.headers().forEach(builder::header);
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        HttpResponse<InputStream> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        logger.debug("{} {} answered with status {}", request.method(), request.uri(), response.statusCode());
        return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
    }

    /**
     * Returns the wrapped HTTP client.
     *
     * @return the client
     */
    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }
}
