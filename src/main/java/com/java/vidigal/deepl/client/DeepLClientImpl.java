package com.java.vidigal.deepl.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.java.vidigal.deepl.builder.TranslationRequestBuilder;
import com.java.vidigal.deepl.exception.DeepLApiException;
import com.java.vidigal.deepl.exception.DeepLDecodeException;
import com.java.vidigal.deepl.exception.DeepLException;
import com.java.vidigal.deepl.exception.DeepLTransportException;
import com.java.vidigal.deepl.exception.NoTranslationException;
import com.java.vidigal.deepl.glossary.Glossary;
import com.java.vidigal.deepl.glossary.GlossaryEntry;
import com.java.vidigal.deepl.glossary.GlossaryEntryCodec;
import com.java.vidigal.deepl.glossary.GlossaryListResponse;
import com.java.vidigal.deepl.language.Language;
import com.java.vidigal.deepl.request.FormParameters;
import com.java.vidigal.deepl.request.TranslateOption;
import com.java.vidigal.deepl.request.Translation;
import com.java.vidigal.deepl.request.TranslationRequest;
import com.java.vidigal.deepl.request.TranslationResponse;
import com.java.vidigal.deepl.transport.HttpTransport;
import com.java.vidigal.deepl.transport.TransportRequest;
import com.java.vidigal.deepl.transport.TransportResponse;
import com.java.vidigal.deepl.utilities.config.ClientOption;
import com.java.vidigal.deepl.utilities.config.DeepLConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/**
 * Implementation of {@link DeepLClient} on top of an injectable {@link HttpTransport}.
 * <p>
 * The client holds nothing but its immutable {@link DeepLConfig} and a Jackson {@link ObjectMapper},
 * so it is safe to share between threads as long as the transport is. Each call formats one request,
 * sends it once and decodes the response:
 * <ul>
 *     <li>translate calls POST a form to {@code {baseUrl}/translate} and expect 200 with JSON;</li>
 *     <li>glossary calls go to {@code {baseUrl}/glossaries[/{id}[/entries]]} and expect 201 (create),
 *     200 (reads, entries as TSV) or 204 (delete).</li>
 * </ul>
 * Any other status becomes a {@link DeepLApiException}. Translate rejections carry no body; glossary
 * rejections carry the raw body DeepL sent.
 * </p>
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * DeepLClient client = new DeepLClientImpl("your-auth-key:fx",
 *         ClientOption.baseUrl(DeepLConfig.FREE_BASE_URL));
 * Translation result = client.translate("Hello, world.", Language.GERMAN);
 * }</pre>
 *
 * @author Vidigal
 */
public class DeepLClientImpl implements DeepLClient {

    private static final Logger logger = LoggerFactory.getLogger(DeepLClientImpl.class);
    private static final int HTTP_OK = 200;
    private static final int HTTP_CREATED = 201;
    private static final int HTTP_NO_CONTENT = 204;
    private static final String AUTHORIZATION = "Authorization";
    private static final String AUTH_SCHEME = "DeepL-Auth-Key ";
    private static final String ACCEPT = "Accept";
    private final DeepLConfig config;
    private final ObjectMapper objectMapper;

    /**
     * Constructs a client from an auth key and client options applied in order.
     *
     * @param authKey the DeepL authentication key
     * @param options the client options, e.g. {@link ClientOption#baseUrl(String)}
     * @throws IllegalArgumentException if the auth key or an option value is invalid
     */
    public DeepLClientImpl(String authKey, ClientOption... options) {
        this(DeepLConfig.of(authKey, options));
    }

    /**
     * Constructs a client with the specified configuration.
     *
     * @param config the client configuration, must not be null
     * @throws IllegalArgumentException if config is null
     */
    public DeepLClientImpl(DeepLConfig config) {
        this(config, defaultObjectMapper());
    }

    /**
     * Constructs a client with an injected JSON mapper.
     *
     * @param config       the client configuration, must not be null
     * @param objectMapper the JSON mapper for response decoding
     * @throws IllegalArgumentException if config or objectMapper is null
     */
    public DeepLClientImpl(DeepLConfig config, ObjectMapper objectMapper) {
        if (config == null) {
            logger.error("Configuration cannot be null");
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        if (objectMapper == null) {
            logger.error("Object mapper cannot be null");
            throw new IllegalArgumentException("Object mapper cannot be null");
        }
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the mapper used when none is injected: ISO-8601 timestamps, unknown fields ignored.
     *
     * @return a new mapper
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public TranslationResponse translate(TranslationRequest request) throws DeepLException {
        if (request == null) {
            logger.error("Translation request cannot be null");
            throw new IllegalArgumentException("Translation request cannot be null");
        }
        logger.debug("Translating {} text(s) to {}", request.getTextSegments().size(), request.getTargetLang());
        TransportRequest httpRequest = authorized(
                TransportRequest.postForm(toUri(config.getTranslateUrl()), request.toFormBody()));
        TranslationResponse response = exchange(httpRequest, HTTP_OK, false,
                body -> readJson(body, TranslationResponse.class));
        logger.debug("Received {} translation(s)", response.getTranslations().size());
        return response;
    }

    @Override
    public Translation translate(String text, Language targetLang, TranslateOption... options) throws DeepLException {
        List<Translation> translations = translateMany(Collections.singletonList(text), targetLang, options);
        if (translations.isEmpty()) {
            logger.debug("No translations returned for a single text");
            throw new NoTranslationException();
        }
        return translations.get(0);
    }

    @Override
    public List<Translation> translateMany(List<String> texts, Language targetLang, TranslateOption... options)
            throws DeepLException {
        TranslationRequest request = new TranslationRequestBuilder()
                .setTargetLang(targetLang)
                .addTexts(texts)
                .addOptions(options)
                .build();
        return translate(request).getTranslations();
    }

    @Override
    public Glossary createGlossary(String name, Language sourceLang, Language targetLang, List<GlossaryEntry> entries)
            throws DeepLException {
        requireText(name, "Glossary name");
        if (sourceLang == null || targetLang == null) {
            logger.error("Glossary languages cannot be null");
            throw new IllegalArgumentException("Glossary languages cannot be null");
        }
        if (entries == null) {
            logger.error("Glossary entries cannot be null");
            throw new IllegalArgumentException("Glossary entries cannot be null");
        }
        FormParameters form = new FormParameters()
                .set("name", name)
                .set("source_lang", sourceLang.getCode())
                .set("target_lang", targetLang.getCode())
                .set("entries_format", GlossaryEntryCodec.FORMAT)
                .set("entries", GlossaryEntryCodec.encode(entries));
        logger.debug("Creating glossary '{}' ({} -> {}) with {} entries", name, sourceLang, targetLang, entries.size());
        TransportRequest httpRequest = authorized(
                TransportRequest.postForm(toUri(config.getGlossaryUrl()), form.encode()));
        return exchange(httpRequest, HTTP_CREATED, true, body -> readJson(body, Glossary.class));
    }

    @Override
    public List<Glossary> listGlossaries() throws DeepLException {
        TransportRequest httpRequest = authorized(TransportRequest.get(toUri(config.getGlossaryUrl())));
        return exchange(httpRequest, HTTP_OK, true,
                body -> readJson(body, GlossaryListResponse.class)).getGlossaries();
    }

    @Override
    public Glossary getGlossary(String glossaryId) throws DeepLException {
        TransportRequest httpRequest = authorized(TransportRequest.get(glossaryUri(glossaryId, "")));
        return exchange(httpRequest, HTTP_OK, true, body -> readJson(body, Glossary.class));
    }

    @Override
    public List<GlossaryEntry> listGlossaryEntries(String glossaryId) throws DeepLException {
        TransportRequest httpRequest = authorized(TransportRequest.get(glossaryUri(glossaryId, "/entries")))
                .withHeader(ACCEPT, GlossaryEntryCodec.MEDIA_TYPE);
        return exchange(httpRequest, HTTP_OK, true, body -> {
            Reader reader = new InputStreamReader(body.body(), StandardCharsets.UTF_8);
            return GlossaryEntryCodec.decode(reader);
        });
    }

    @Override
    public void deleteGlossary(String glossaryId) throws DeepLException {
        TransportRequest httpRequest = authorized(TransportRequest.delete(glossaryUri(glossaryId, "")));
        exchange(httpRequest, HTTP_NO_CONTENT, true, body -> null);
        logger.debug("Deleted glossary {}", glossaryId);
    }

    @Override
    public DeepLConfig getConfig() {
        return config;
    }

    /**
     * Sends a request once and reads the response if it has the expected status.
     *
     * @param request          the request
     * @param expectedStatus   the only status that counts as success
     * @param captureErrorBody whether a rejection should carry the response body
     * @param reader           decodes a successful response
     * @param <T>              the decoded type
     * @return the decoded response
     * @throws DeepLException if sending, the status check or decoding fails
     */
    private <T> T exchange(TransportRequest request, int expectedStatus, boolean captureErrorBody,
                           ResponseReader<T> reader) throws DeepLException {
        TransportResponse response = send(request);
        try (response) {
            if (response.statusCode() != expectedStatus) {
                throw rejection(request, response, captureErrorBody);
            }
            return reader.read(response);
        } catch (IOException e) {
            throw new DeepLTransportException("Failed to read response of " + request.method() + " " + request.uri(), e);
        }
    }

    private TransportResponse send(TransportRequest request) throws DeepLException {
        try {
            TransportResponse response = config.getTransport().send(request);
            if (response == null) {
                throw new DeepLException("Transport returned no response for " + request.method() + " " + request.uri());
            }
            return response;
        } catch (IOException e) {
            throw new DeepLTransportException("Failed to send " + request.method() + " " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeepLException("Request interrupted", e);
        }
    }

    private DeepLApiException rejection(TransportRequest request, TransportResponse response, boolean captureBody)
            throws IOException {
        String body = null;
        if (captureBody) {
            String raw = response.bodyAsString();
            body = raw.isEmpty() ? null : raw;
        }
        logger.debug("DeepL rejected {} {} with status {}", request.method(), request.uri(), response.statusCode());
        return new DeepLApiException(response.statusCode(), body);
    }

    private <T> T readJson(TransportResponse response, Class<T> type) throws IOException, DeepLDecodeException {
        T value;
        try {
            value = objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new DeepLDecodeException("Failed to decode DeepL response as " + type.getSimpleName(), e);
        }
        if (value == null) {
            throw new DeepLDecodeException("DeepL response is an empty JSON document");
        }
        return value;
    }

    private TransportRequest authorized(TransportRequest request) {
        return request.withHeader(AUTHORIZATION, AUTH_SCHEME + config.getAuthKey());
    }

    private URI glossaryUri(String glossaryId, String suffix) throws DeepLException {
        requireText(glossaryId, "Glossary id");
        return toUri(config.getGlossaryUrl() + "/" + glossaryId + suffix);
    }

    private static URI toUri(String url) throws DeepLException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new DeepLException("Invalid request URL: " + url, e);
        }
        if (!uri.isAbsolute()) {
            throw new DeepLException("Request URL is not absolute: " + url);
        }
        return uri;
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            logger.error("{} cannot be null or blank", what);
            throw new IllegalArgumentException(what + " cannot be null or blank");
        }
    }

    /**
     * Decodes the body of a successful response.
     *
     * @param <T> the decoded type
     */
    @FunctionalInterface
    private interface ResponseReader<T> {
        T read(TransportResponse response) throws IOException, DeepLException;
    }
}
