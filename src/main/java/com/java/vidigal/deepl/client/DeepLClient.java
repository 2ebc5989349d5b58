package com.java.vidigal.deepl.client;

import com.java.vidigal.deepl.exception.DeepLApiException;
import com.java.vidigal.deepl.exception.DeepLException;
import com.java.vidigal.deepl.exception.NoTranslationException;
import com.java.vidigal.deepl.glossary.Glossary;
import com.java.vidigal.deepl.glossary.GlossaryEntry;
import com.java.vidigal.deepl.language.Language;
import com.java.vidigal.deepl.request.TranslateOption;
import com.java.vidigal.deepl.request.Translation;
import com.java.vidigal.deepl.request.TranslationRequest;
import com.java.vidigal.deepl.request.TranslationResponse;
import com.java.vidigal.deepl.utilities.config.DeepLConfig;

import java.util.List;

/**
 * Interface for interacting with the DeepL translation API.
 * <p>
 * Every call is a single blocking round trip; nothing is retried or cached. A rejected request
 * surfaces as {@link DeepLApiException}, which callers can catch on its own, e.g. to react to
 * {@link DeepLApiException#isQuotaExceeded() an exhausted quota}.
 * </p>
 *
 * @author Vidigal
 */
public interface DeepLClient {

    /**
     * Sends a prepared translation request.
     *
     * @param request the translation request containing texts, target language and options
     * @return the translation response from the API
     * @throws DeepLException if the translation fails due to API or network issues
     */
    TranslationResponse translate(TranslationRequest request) throws DeepLException;

    /**
     * Translates a single text.
     *
     * @param text       the text to translate
     * @param targetLang the language to translate into
     * @param options    optional parameters, applied in order
     * @return the translated text and the detected source language
     * @throws NoTranslationException if DeepL answers with no translation
     * @throws DeepLException         if the translation fails due to API or network issues
     */
    Translation translate(String text, Language targetLang, TranslateOption... options) throws DeepLException;

    /**
     * Translates several texts in one request.
     *
     * @param texts      the texts to translate
     * @param targetLang the language to translate into
     * @param options    optional parameters, applied in order
     * @return the translations in the order DeepL returned them, normally one per input text
     * @throws DeepLException if the translation fails due to API or network issues
     */
    List<Translation> translateMany(List<String> texts, Language targetLang, TranslateOption... options)
            throws DeepLException;

    /**
     * Creates a glossary.
     *
     * @param name       the display name
     * @param sourceLang the language of the source phrases
     * @param targetLang the language of the target phrases
     * @param entries    the entries
     * @return the created glossary
     * @throws DeepLException if the request is rejected or fails
     */
    Glossary createGlossary(String name, Language sourceLang, Language targetLang, List<GlossaryEntry> entries)
            throws DeepLException;

    /**
     * Lists all glossaries of the account.
     *
     * @return the glossaries
     * @throws DeepLException if the request is rejected or fails
     */
    List<Glossary> listGlossaries() throws DeepLException;

    /**
     * Retrieves the metadata of one glossary.
     *
     * @param glossaryId the glossary identifier
     * @return the glossary
     * @throws DeepLException if the request is rejected (e.g. unknown id) or fails
     */
    Glossary getGlossary(String glossaryId) throws DeepLException;

    /**
     * Retrieves the entries of one glossary.
     *
     * @param glossaryId the glossary identifier
     * @return the entries
     * @throws DeepLException if the request is rejected or fails, or a line of the response is malformed
     */
    List<GlossaryEntry> listGlossaryEntries(String glossaryId) throws DeepLException;

    /**
     * Deletes a glossary.
     *
     * @param glossaryId the glossary identifier
     * @throws DeepLException if the request is rejected or fails
     */
    void deleteGlossary(String glossaryId) throws DeepLException;

    /**
     * Returns the configuration this client was built with.
     *
     * @return the configuration
     */
    DeepLConfig getConfig();
}
