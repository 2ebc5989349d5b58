package com.java.vidigal.deepl.request;

import com.java.vidigal.deepl.language.Language;

import java.util.List;

/**
 * An immutable translate request: the target language, the texts and the resulting form parameters.
 * Build one with {@link com.java.vidigal.deepl.builder.TranslationRequestBuilder}.
 *
 * @author Vidigal
 */
public final class TranslationRequest {

    private final Language targetLang;
    private final List<String> textSegments;
    private final FormParameters parameters;

    /**
     * Constructs a request.
     *
     * @param targetLang   the target language
     * @param textSegments the texts, in order
     * @param parameters   the complete form parameters, including {@code target_lang} and {@code text}
     */
    public TranslationRequest(Language targetLang, List<String> textSegments, FormParameters parameters) {
        this.targetLang = targetLang;
        this.textSegments = List.copyOf(textSegments);
        this.parameters = parameters.copy();
    }

    public Language getTargetLang() {
        return targetLang;
    }

    public List<String> getTextSegments() {
        return textSegments;
    }

    /**
     * Returns a copy of the form parameters.
     *
     * @return the parameters
     */
    public FormParameters getParameters() {
        return parameters.copy();
    }

    /**
     * Returns a single parameter value.
     *
     * @param name the wire parameter name
     * @return the first value, or null if the parameter is absent
     */
    public String getParameter(String name) {
        return parameters.get(name);
    }

    /**
     * Encodes the request as a form body.
     *
     * @return the {@code application/x-www-form-urlencoded} body
     */
    public String toFormBody() {
        return parameters.encode();
    }

    @Override
    public String toString() {
        return "TranslationRequest{targetLang=" + targetLang + ", texts=" + textSegments.size()
                + ", parameters=" + parameters.names() + "}";
    }
}
