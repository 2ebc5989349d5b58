package com.java.vidigal.deepl.test.transport;

import com.java.vidigal.deepl.transport.TransportRequest;
import com.java.vidigal.deepl.transport.TransportResponse;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransportRequestTest {

    private static final URI URI_UNDER_TEST = URI.create("https://deepl.test/v2/translate");

    @Test
    void postFormShouldCarryContentType() {
        TransportRequest request = TransportRequest.postForm(URI_UNDER_TEST, "a=1");

        assertEquals("POST", request.method());
        assertEquals("a=1", request.body());
        assertEquals("application/x-www-form-urlencoded", request.header("Content-Type").orElseThrow());
    }

    @Test
    void getAndDeleteShouldHaveNoBody() {
        assertNull(TransportRequest.get(URI_UNDER_TEST).body());
        assertEquals("GET", TransportRequest.get(URI_UNDER_TEST).method());
        assertNull(TransportRequest.delete(URI_UNDER_TEST).body());
        assertEquals("DELETE", TransportRequest.delete(URI_UNDER_TEST).method());
    }

    @Test
    void withHeaderShouldCopyAndReplace() {
        TransportRequest original = TransportRequest.get(URI_UNDER_TEST);
        TransportRequest first = original.withHeader("Accept", "text/plain");
        TransportRequest second = first.withHeader("Accept", "application/json");

        assertTrue(original.header("Accept").isEmpty());
        assertEquals("text/plain", first.header("Accept").orElseThrow());
        assertEquals("application/json", second.header("Accept").orElseThrow());
        assertEquals(1, second.headers().size());
        assertThrows(UnsupportedOperationException.class, () -> second.headers().put("X", "y"));
    }

    @Test
    void responseShouldReadBodyAsUtf8() throws IOException {
        TransportResponse response = new TransportResponse(200, Map.of("Content-Type", List.of("text/plain")),
                new ByteArrayInputStream("Grüße".getBytes(StandardCharsets.UTF_8)));

        assertEquals("Grüße", response.bodyAsString());
        assertEquals(List.of("text/plain"), response.headers().get("Content-Type"));
    }

    @Test
    void responseShouldTolerateMissingBody() throws IOException {
        try (TransportResponse response = new TransportResponse(204, null, null)) {
            assertEquals("", response.bodyAsString());
            assertTrue(response.headers().isEmpty());
        }
    }
}
