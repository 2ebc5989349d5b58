package com.java.vidigal.deepl.request;

import com.java.vidigal.deepl.language.Language;

/**
 * An optional translation parameter.
 * <p>
 * Options are applied to the request's {@link FormParameters} one after another, in the order they
 * were passed. Each option sets exactly one parameter, so for any parameter the last option wins.
 * An option with an empty value removes its parameter instead.
 * </p>
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * client.translate("Hello, world.", Language.GERMAN,
 *         TranslateOption.sourceLang(Language.ENGLISH),
 *         TranslateOption.formality(Formality.LESS),
 *         TranslateOption.splitSentences(SplitSentences.NO_NEWLINES));
 * }</pre>
 *
 * @author Vidigal
 */
@FunctionalInterface
public interface TranslateOption {

    /**
     * Applies this option to the request parameters.
     *
     * @param parameters the parameters of the request being built
     */
    void apply(FormParameters parameters);

    /**
     * Sets the language of the input text. Without it DeepL detects the source language.
     *
     * @param language the source language
     * @return the option
     */
    static TranslateOption sourceLang(Language language) {
        return new ParameterOption("source_lang", require(language, "Source language").getCode());
    }

    /**
     * Asks DeepL to report the number of billed characters per translation.
     *
     * @param show whether to report them
     * @return the option
     */
    static TranslateOption showBilledCharacters(boolean show) {
        return new ParameterOption("show_billed_characters", flag(show));
    }

    static TranslateOption splitSentences(SplitSentences split) {
        return new ParameterOption("split_sentences", require(split, "Split sentences").value());
    }

    /**
     * Keeps the formatting of the input even where DeepL would correct it.
     *
     * @param preserve whether to preserve formatting
     * @return the option
     */
    static TranslateOption preserveFormatting(boolean preserve) {
        return new ParameterOption("preserve_formatting", flag(preserve));
    }

    static TranslateOption formality(Formality formality) {
        return new ParameterOption("formality", require(formality, "Formality").value());
    }

    /**
     * Sets the tag handling strategy. {@link TagHandling#DEFAULT} clears the parameter.
     *
     * @param tagHandling the strategy
     * @return the option
     */
    static TranslateOption tagHandling(TagHandling tagHandling) {
        return new ParameterOption("tag_handling", require(tagHandling, "Tag handling").value());
    }

    /**
     * Names tags whose content is never translated. The names are sent as one comma-separated value.
     *
     * @param tags the tag names
     * @return the option
     * @throws IllegalArgumentException if {@code tags} or any tag is null
     */
    static TranslateOption ignoreTags(String... tags) {
        require(tags, "Ignored tags");
        for (String tag : tags) {
            require(tag, "Ignored tag");
        }
        return new ParameterOption("ignore_tags", String.join(",", tags));
    }

    /**
     * Translates with the terms of a glossary. An empty id removes {@code glossary_id} from the request.
     *
     * @param glossaryId the glossary identifier
     * @return the option
     */
    static TranslateOption glossaryId(String glossaryId) {
        return new ParameterOption("glossary_id", require(glossaryId, "Glossary id"));
    }

    /**
     * Gives DeepL additional text that informs the translation without being translated itself. An
     * empty context removes {@code context} from the request.
     *
     * @param context the context text
     * @return the option
     */
    static TranslateOption context(String context) {
        return new ParameterOption("context", require(context, "Context"));
    }

    private static String flag(boolean value) {
        return value ? "1" : "0";
    }

    private static <T> T require(T value, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
        return value;
    }
}
