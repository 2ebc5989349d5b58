package com.java.vidigal.deepl.test.transport;

import com.java.vidigal.deepl.transport.JdkHttpTransport;
import com.java.vidigal.deepl.transport.TransportRequest;
import com.java.vidigal.deepl.transport.TransportResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link JdkHttpTransport}, against a mocked {@link HttpClient}.
 */
class JdkHttpTransportTest {

    private static final URI TRANSLATE_URI = URI.create("https://deepl.test/v2/translate");

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<InputStream> httpResponse;

    private JdkHttpTransport transport;
    private AutoCloseable mocks;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        transport = new JdkHttpTransport(httpClient, Duration.ofSeconds(7));
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.headers()).thenReturn(
                HttpHeaders.of(Map.of("content-type", List.of("application/json")), (name, value) -> true));
        when(httpResponse.body()).thenReturn(
                new ByteArrayInputStream("{\"translations\":[]}".getBytes(StandardCharsets.UTF_8)));
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendPostWithHeadersBodyAndTimeout() throws Exception {
        TransportRequest request = TransportRequest.postForm(TRANSLATE_URI, "text=Hello&target_lang=DE")
                .withHeader("Authorization", "DeepL-Auth-Key key");

        transport.send(request);

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(1)).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        HttpRequest sent = captor.getValue();
        assertEquals("POST", sent.method());
        assertEquals(TRANSLATE_URI, sent.uri());
        assertEquals(Duration.ofSeconds(7), sent.timeout().orElseThrow());
        assertEquals("DeepL-Auth-Key key", sent.headers().firstValue("Authorization").orElseThrow());
        assertEquals("application/x-www-form-urlencoded", sent.headers().firstValue("Content-Type").orElseThrow());
        assertEquals("text=Hello&target_lang=DE".length(), sent.bodyPublisher().orElseThrow().contentLength());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendDeleteWithoutBody() throws Exception {
        transport.send(TransportRequest.delete(URI.create("https://deepl.test/v2/glossaries/abc")));

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        assertEquals("DELETE", captor.getValue().method());
        assertEquals(0, captor.getValue().bodyPublisher().orElseThrow().contentLength());
    }

    @Test
    void shouldMapResponse() throws Exception {
        try (TransportResponse response = transport.send(TransportRequest.get(TRANSLATE_URI))) {
            assertEquals(200, response.statusCode());
            assertEquals(List.of("application/json"), response.headers().get("content-type"));
            assertEquals("{\"translations\":[]}", response.bodyAsString());
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPropagateIOException() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("Connection reset"));

        IOException exception = assertThrows(IOException.class,
                () -> transport.send(TransportRequest.get(TRANSLATE_URI)));
        assertEquals("Connection reset", exception.getMessage());
    }

    @Test
    void shouldRejectNullClient() {
        assertThrows(IllegalArgumentException.class, () -> new JdkHttpTransport((HttpClient) null, Duration.ofSeconds(1)));
    }

    @Test
    void shouldApplyConnectTimeoutToNewClient() {
        JdkHttpTransport created = new JdkHttpTransport(Duration.ofMillis(1500), Duration.ofMillis(3000));

        assertEquals(Duration.ofMillis(1500), created.getHttpClient().connectTimeout().orElseThrow());
        assertEquals(Duration.ofMillis(3000), created.getRequestTimeout());
    }
}
