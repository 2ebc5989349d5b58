package com.java.vidigal.deepl.language;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A DeepL language code.
 * <p>
 * The constants cover the languages DeepL documents, but any non-blank code is accepted through
 * {@link #of(String)}: the set of supported languages grows on the service side independently of
 * this client. Codes are sent exactly as given.
 * </p>
 *
 * @author Vidigal
 */
public final class Language {

    private static final Map<String, Language> KNOWN = new LinkedHashMap<>();

    public static final Language ARABIC = known("AR");
    public static final Language BULGARIAN = known("BG");
    public static final Language CHINESE_SIMPLIFIED = known("ZH-HANS");
    public static final Language CHINESE_TRADITIONAL = known("ZH-HANT");
    public static final Language CZECH = known("CS");
    public static final Language DANISH = known("DA");
    public static final Language DUTCH = known("NL");
    public static final Language ENGLISH_AMERICAN = known("EN-US");
    public static final Language ENGLISH_BRITISH = known("EN-GB");
    public static final Language ESTONIAN = known("ET");
    public static final Language FINNISH = known("FI");
    public static final Language FRENCH = known("FR");
    public static final Language GERMAN = known("DE");
    public static final Language GREEK = known("EL");
    public static final Language HUNGARIAN = known("HU");
    public static final Language INDONESIAN = known("ID");
    public static final Language ITALIAN = known("IT");
    public static final Language JAPANESE = known("JA");
    public static final Language KOREAN = known("KO");
    public static final Language LATVIAN = known("LV");
    public static final Language LITHUANIAN = known("LT");
    public static final Language NORWEGIAN_BOKMAL = known("NB");
    public static final Language POLISH = known("PL");
    public static final Language PORTUGUESE_BRAZIL = known("PT-BR");
    public static final Language PORTUGUESE_PORTUGAL = known("PT-PT");
    public static final Language ROMANIAN = known("RO");
    public static final Language RUSSIAN = known("RU");
    public static final Language SLOVAK = known("SK");
    public static final Language SLOVENIAN = known("SL");
    public static final Language SPANISH = known("ES");
    public static final Language SWEDISH = known("SV");
    public static final Language TURKISH = known("TR");
    public static final Language UKRAINIAN = known("UK");

    /**
     * English without variant. Valid as a source language; as a target use {@link #ENGLISH_AMERICAN}
     * or {@link #ENGLISH_BRITISH}.
     */
    public static final Language ENGLISH = known("EN");

    /**
     * Portuguese without variant. Valid as a source language; as a target use
     * {@link #PORTUGUESE_BRAZIL} or {@link #PORTUGUESE_PORTUGAL}.
     */
    public static final Language PORTUGUESE = known("PT");

    /**
     * Chinese without variant. Valid as a source language; as a target prefer
     * {@link #CHINESE_SIMPLIFIED} or {@link #CHINESE_TRADITIONAL}.
     */
    public static final Language CHINESE = known("ZH");

    private final String code;

    private Language(String code) {
        this.code = code;
    }

    private static Language known(String code) {
        Language language = new Language(code);
        KNOWN.put(code.toLowerCase(Locale.ROOT), language);
        return language;
    }

    /**
     * Returns the language for a code. Documented codes yield their constant; any other non-blank code
     * yields a new instance carrying it unchanged.
     *
     * @param code the language code (e.g., "DE", "EN-GB")
     * @return the language
     * @throws IllegalArgumentException if {@code code} is null or blank
     */
    public static Language of(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Language code cannot be null or blank");
        }
        Language documented = KNOWN.get(code.toLowerCase(Locale.ROOT));
        if (documented != null && documented.code.equals(code)) {
            return documented;
        }
        return new Language(code);
    }

    /**
     * Finds a documented language by its code, case-insensitively.
     *
     * @param code The language code (e.g., "EN", "fr").
     * @return An Optional containing the Language, or empty if the code is not documented.
     */
    public static Optional<Language> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(KNOWN.get(code.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns every documented language, in declaration order.
     *
     * @return an unmodifiable collection of languages
     */
    public static Collection<Language> documented() {
        return Collections.unmodifiableCollection(KNOWN.values());
    }

    /**
     * Returns the language code as sent to DeepL.
     *
     * @return The language code string.
     */
    public String getCode() {
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Language other && code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return this.code;
    }
}
