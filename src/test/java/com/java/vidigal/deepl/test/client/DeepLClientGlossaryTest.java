package com.java.vidigal.deepl.test.client;

import com.java.vidigal.deepl.client.DeepLClientImpl;
import com.java.vidigal.deepl.exception.DeepLApiException;
import com.java.vidigal.deepl.exception.DeepLException;
import com.java.vidigal.deepl.exception.MalformedGlossaryEntryException;
import com.java.vidigal.deepl.glossary.Glossary;
import com.java.vidigal.deepl.glossary.GlossaryEntry;
import com.java.vidigal.deepl.language.Language;
import com.java.vidigal.deepl.test.support.FormBodies;
import com.java.vidigal.deepl.transport.HttpTransport;
import com.java.vidigal.deepl.transport.TransportRequest;
import com.java.vidigal.deepl.transport.TransportResponse;
import com.java.vidigal.deepl.utilities.config.ClientOption;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the glossary calls of {@link DeepLClientImpl}, against a mocked {@link HttpTransport}.
 */
class DeepLClientGlossaryTest {

    private static final String BASE_URL = "https://deepl.test/v2";
    private static final String GLOSSARY_ID = "def3a26b-3e84-45b3-84ae-0c0aaf3525f7";
    private static final String GLOSSARY_JSON = """
            {
              "glossary_id": "def3a26b-3e84-45b3-84ae-0c0aaf3525f7",
              "name": "My Glossary",
              "ready": true,
              "source_lang": "en",
              "target_lang": "de",
              "creation_time": "2021-08-03T14:16:18.329Z",
              "entry_count": 2
            }
            """;

    @Mock
    private HttpTransport transport;

    private DeepLClientImpl client;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        client = new DeepLClientImpl("an-auth-key",
                ClientOption.baseUrl(BASE_URL),
                ClientOption.transport(transport));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    @DisplayName("createGlossary posts the entries as TSV and decodes the created glossary")
    void shouldCreateGlossary() throws Exception {
        respond(201, GLOSSARY_JSON);

        Glossary glossary = client.createGlossary("My Glossary", Language.ENGLISH, Language.GERMAN, List.of(
                new GlossaryEntry("artist", "Maler"),
                new GlossaryEntry("prize", "Gewinn")));

        assertEquals(GLOSSARY_ID, glossary.getGlossaryId());
        assertEquals("My Glossary", glossary.getName());
        assertTrue(glossary.isReady());
        assertEquals("en", glossary.getSourceLang());
        assertEquals("de", glossary.getTargetLang());
        assertEquals(Instant.parse("2021-08-03T14:16:18.329Z"), glossary.getCreationTime());
        assertEquals(2, glossary.getEntryCount());

        TransportRequest sent = capturedRequest();
        assertEquals("POST", sent.method());
        assertEquals(URI.create(BASE_URL + "/glossaries"), sent.uri());
        assertEquals("DeepL-Auth-Key an-auth-key", sent.header("Authorization").orElseThrow());
        Map<String, List<String>> form = FormBodies.parse(sent.body());
        assertEquals(List.of("My Glossary"), form.get("name"));
        assertEquals(List.of("EN"), form.get("source_lang"));
        assertEquals(List.of("DE"), form.get("target_lang"));
        assertEquals(List.of("tsv"), form.get("entries_format"));
        assertEquals(List.of("artist\tMaler\nprize\tGewinn"), form.get("entries"));
    }

    @Test
    @DisplayName("createGlossary treats 200 as a rejection because only 201 means created")
    void shouldRejectCreateWithoutCreatedStatus() throws Exception {
        respond(200, GLOSSARY_JSON);

        DeepLApiException exception = assertThrows(
                DeepLApiException.class,
                () -> client.createGlossary("My Glossary", Language.ENGLISH, Language.GERMAN, List.of())
        );
        assertEquals(200, exception.getStatusCode());
    }

    @Test
    @DisplayName("glossary rejections carry the trimmed response body in the message")
    void shouldCaptureBodyOfRejectedGlossaryCall() throws Exception {
        respond(400, "  {\"message\": \"Invalid glossary entries provided\"}\n");

        DeepLApiException exception = assertThrows(
                DeepLApiException.class,
                () -> client.createGlossary("My Glossary", Language.ENGLISH, Language.GERMAN,
                        List.of(new GlossaryEntry("a", "b")))
        );
        assertEquals(400, exception.getStatusCode());
        assertEquals("  {\"message\": \"Invalid glossary entries provided\"}\n", exception.getBody().orElseThrow());
        assertEquals("unexpected HTTP status Bad Request ({\"message\": \"Invalid glossary entries provided\"})",
                exception.getMessage());
    }

    @Test
    @DisplayName("quota rejections render the fixed message whatever the body says")
    void shouldRenderQuotaMessageForGlossaryCall() throws Exception {
        respond(456, "{\"message\": \"Quota exceeded\"}");

        DeepLApiException exception = assertThrows(DeepLApiException.class, () -> client.listGlossaries());

        assertTrue(exception.isQuotaExceeded());
        assertEquals("Quota exceeded. The character limit has been reached.", exception.getMessage());
        assertTrue(exception.getBody().isPresent());
    }

    @Test
    void shouldListGlossaries() throws Exception {
        respond(200, "{\"glossaries\": [" + GLOSSARY_JSON + ", " + GLOSSARY_JSON.replace("My Glossary", "Other") + "]}");

        List<Glossary> glossaries = client.listGlossaries();

        assertEquals(List.of("My Glossary", "Other"), glossaries.stream().map(Glossary::getName).toList());
        TransportRequest sent = capturedRequest();
        assertEquals("GET", sent.method());
        assertEquals(URI.create(BASE_URL + "/glossaries"), sent.uri());
        assertNull(sent.body());
    }

    @Test
    void shouldGetGlossaryById() throws Exception {
        respond(200, GLOSSARY_JSON);

        Glossary glossary = client.getGlossary(GLOSSARY_ID);

        assertEquals(GLOSSARY_ID, glossary.getGlossaryId());
        TransportRequest sent = capturedRequest();
        assertEquals("GET", sent.method());
        assertEquals(URI.create(BASE_URL + "/glossaries/" + GLOSSARY_ID), sent.uri());
        assertEquals("DeepL-Auth-Key an-auth-key", sent.header("Authorization").orElseThrow());
    }

    @Test
    void shouldRaiseApiExceptionForUnknownGlossary() throws Exception {
        respond(404, "{\"message\": \"Not found\"}");

        DeepLApiException exception = assertThrows(DeepLApiException.class, () -> client.getGlossary("missing"));

        assertEquals(404, exception.getStatusCode());
        assertEquals("unexpected HTTP status Not Found ({\"message\": \"Not found\"})", exception.getMessage());
    }

    @Test
    void shouldListGlossaryEntriesAsTsv() throws Exception {
        respond(200, "artist\tMaler\nprize\tGewinn\n");

        List<GlossaryEntry> entries = client.listGlossaryEntries(GLOSSARY_ID);

        assertEquals(List.of(new GlossaryEntry("artist", "Maler"), new GlossaryEntry("prize", "Gewinn")), entries);
        TransportRequest sent = capturedRequest();
        assertEquals("GET", sent.method());
        assertEquals(URI.create(BASE_URL + "/glossaries/" + GLOSSARY_ID + "/entries"), sent.uri());
        assertEquals("text/tab-separated-values", sent.header("Accept").orElseThrow());
        assertEquals("DeepL-Auth-Key an-auth-key", sent.header("Authorization").orElseThrow());
    }

    @Test
    void shouldFailWholeEntryListingOnMalformedLine() throws Exception {
        respond(200, "artist\tMaler\nprize Gewinn\nmuseum\tMuseum\n");

        MalformedGlossaryEntryException exception = assertThrows(
                MalformedGlossaryEntryException.class,
                () -> client.listGlossaryEntries(GLOSSARY_ID)
        );
        assertEquals(2, exception.getLineNumber());
    }

    @Test
    void shouldDeleteGlossary() throws Exception {
        respond(204, "");

        client.deleteGlossary(GLOSSARY_ID);

        TransportRequest sent = capturedRequest();
        assertEquals("DELETE", sent.method());
        assertEquals(URI.create(BASE_URL + "/glossaries/" + GLOSSARY_ID), sent.uri());
        assertEquals("DeepL-Auth-Key an-auth-key", sent.header("Authorization").orElseThrow());
    }

    @Test
    void shouldRejectDeleteAnsweredWithoutNoContent() throws Exception {
        respond(200, "");

        DeepLApiException exception = assertThrows(DeepLApiException.class, () -> client.deleteGlossary(GLOSSARY_ID));

        assertEquals(200, exception.getStatusCode());
        assertTrue(exception.getBody().isEmpty(), "An empty body is not captured");
        assertEquals("unexpected HTTP status OK", exception.getMessage());
    }

    @Test
    void shouldRejectBlankGlossaryIdBeforeSending() {
        assertThrows(IllegalArgumentException.class, () -> client.getGlossary(" "));
        assertThrows(IllegalArgumentException.class, () -> client.listGlossaryEntries(null));
        assertThrows(IllegalArgumentException.class, () -> client.deleteGlossary(""));
        assertThrows(IllegalArgumentException.class,
                () -> client.createGlossary(" ", Language.ENGLISH, Language.GERMAN, List.of()));
        verifyNoInteractions(transport);
    }

    @Test
    void shouldRaiseDeepLExceptionForIdThatCannotFormUri() {
        DeepLException exception = assertThrows(DeepLException.class, () -> client.getGlossary("not a uuid"));

        assertTrue(exception.getMessage().startsWith("Invalid request URL: "));
        verifyNoInteractions(transport);
    }

    private void respond(int status, String body) throws Exception {
        when(transport.send(any(TransportRequest.class))).thenReturn(TransportResponse.of(status, body));
    }

    private TransportRequest capturedRequest() throws Exception {
        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(captor.capture());
        return captor.getValue();
    }
}
