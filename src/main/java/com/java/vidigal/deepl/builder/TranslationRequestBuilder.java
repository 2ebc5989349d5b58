package com.java.vidigal.deepl.builder;

import com.java.vidigal.deepl.language.Language;
import com.java.vidigal.deepl.request.FormParameters;
import com.java.vidigal.deepl.request.TranslateOption;
import com.java.vidigal.deepl.request.TranslationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds a {@link TranslationRequest} from a target language, one or more texts and a sequence of
 * {@link TranslateOption}s.
 * <p>
 * Options are applied in the order they were added. Texts are kept apart from the options and
 * written last, so the request always carries every text in the order added, duplicates included.
 * </p>
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * TranslationRequest request = new TranslationRequestBuilder()
 *         .setTargetLang(Language.GERMAN)
 *         .addText("Hello")
 *         .addText("World")
 *         .addOption(TranslateOption.formality(Formality.MORE))
 *         .build();
 * }</pre>
 *
 * @author Vidigal
 */
public class TranslationRequestBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TranslationRequestBuilder.class);
    private static final String TEXT_NOT_NULL = "Text to translate must not be null";
    private static final String TEXTS_NOT_EMPTY = "Texts to translate must not be null or empty";
    private static final String TARGET_LANG_NOT_NULL = "Target language must not be null";
    private final List<String> texts = new ArrayList<>();
    private final List<TranslateOption> options = new ArrayList<>();
    private Language targetLang;

    /**
     * Sets the language to translate into.
     *
     * @param targetLang the target language
     * @return this builder
     */
    public TranslationRequestBuilder setTargetLang(Language targetLang) {
        this.targetLang = targetLang;
        return this;
    }

    /**
     * Adds a text to translate.
     *
     * @param text the text; may be empty but not null
     * @return this builder
     * @throws IllegalArgumentException if {@code text} is null
     */
    public TranslationRequestBuilder addText(String text) {
        if (text == null) {
            logger.error(TEXT_NOT_NULL);
            throw new IllegalArgumentException(TEXT_NOT_NULL);
        }
        texts.add(text);
        return this;
    }

    /**
     * Adds several texts to translate, in order.
     *
     * @param texts the texts
     * @return this builder
     */
    public TranslationRequestBuilder addTexts(List<String> texts) {
        if (texts == null) {
            logger.error(TEXTS_NOT_EMPTY);
            throw new IllegalArgumentException(TEXTS_NOT_EMPTY);
        }
        texts.forEach(this::addText);
        return this;
    }

    /**
     * Adds an option. Null options are skipped.
     *
     * @param option the option
     * @return this builder
     */
    public TranslationRequestBuilder addOption(TranslateOption option) {
        if (option != null) {
            options.add(option);
        }
        return this;
    }

    /**
     * Adds options, in order.
     *
     * @param options the options
     * @return this builder
     */
    public TranslationRequestBuilder addOptions(TranslateOption... options) {
        if (options != null) {
            Arrays.stream(options).forEach(this::addOption);
        }
        return this;
    }

    /**
     * Builds the request.
     *
     * @return the request
     * @throws IllegalArgumentException if no target language or no text was given
     */
    public TranslationRequest build() {
        if (targetLang == null) {
            logger.error(TARGET_LANG_NOT_NULL);
            throw new IllegalArgumentException(TARGET_LANG_NOT_NULL);
        }
        if (texts.isEmpty()) {
            logger.error(TEXTS_NOT_EMPTY);
            throw new IllegalArgumentException(TEXTS_NOT_EMPTY);
        }
        FormParameters parameters = new FormParameters().set("target_lang", targetLang.getCode());
        for (TranslateOption option : options) {
            option.apply(parameters);
        }
        parameters.setAll("text", texts);
        return new TranslationRequest(targetLang, texts, parameters);
    }
}
