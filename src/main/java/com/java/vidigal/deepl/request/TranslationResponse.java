package com.java.vidigal.deepl.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The body of a successful translate call: the translations, in the order DeepL returned them.
 */
public final class TranslationResponse {

    private final List<Translation> translations;

    @JsonCreator
    public TranslationResponse(@JsonProperty("translations") List<Translation> translations) {
        this.translations = translations == null ? List.of() : List.copyOf(translations);
    }

    /**
     * Returns the translations. The list may be shorter than the list of input texts, even empty.
     *
     * @return an unmodifiable list, never null
     */
    public List<Translation> getTranslations() {
        return translations;
    }

    @Override
    public String toString() {
        return "TranslationResponse{translations=" + translations + "}";
    }
}
