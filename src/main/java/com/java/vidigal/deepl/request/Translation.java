package com.java.vidigal.deepl.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One translated text as returned by DeepL.
 *
 * @author Vidigal
 */
public final class Translation {

    private final String text;
    private final String detectedSourceLanguage;
    private final Integer billedCharacters;

    /**
     * Constructs a translation without billed characters.
     *
     * @param text                   the translated text
     * @param detectedSourceLanguage the source language DeepL detected or was told
     */
    public Translation(String text, String detectedSourceLanguage) {
        this(text, detectedSourceLanguage, null);
    }

    /**
     * Constructs a translation.
     *
     * @param text                   the translated text
     * @param detectedSourceLanguage the source language DeepL detected or was told
     * @param billedCharacters       the billed characters, or null when they were not requested
     */
    @JsonCreator
    public Translation(@JsonProperty("text") String text,
                       @JsonProperty("detected_source_language") String detectedSourceLanguage,
                       @JsonProperty("billed_characters") Integer billedCharacters) {
        this.text = text;
        this.detectedSourceLanguage = detectedSourceLanguage;
        this.billedCharacters = billedCharacters;
    }

    public String getText() {
        return text;
    }

    public String getDetectedSourceLanguage() {
        return detectedSourceLanguage;
    }

    /**
     * Returns the number of billed characters.
     *
     * @return the count, present only if the request asked for it with
     * {@link TranslateOption#showBilledCharacters(boolean)}
     */
    public OptionalInt getBilledCharacters() {
        return billedCharacters == null ? OptionalInt.empty() : OptionalInt.of(billedCharacters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Translation other)) {
            return false;
        }
        return Objects.equals(text, other.text)
                && Objects.equals(detectedSourceLanguage, other.detectedSourceLanguage)
                && Objects.equals(billedCharacters, other.billedCharacters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, detectedSourceLanguage, billedCharacters);
    }

    @Override
    public String toString() {
        return "Translation{text='" + text + "', detectedSourceLanguage='" + detectedSourceLanguage
                + "', billedCharacters=" + billedCharacters + "}";
    }
}
