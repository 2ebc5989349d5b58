package com.java.vidigal.deepl.exception;

/**
 * Thrown when DeepL accepts a single-text request but answers with no translation at all.
 */
public class NoTranslationException extends DeepLException {

    public NoTranslationException() {
        super("DeepL responded with no translations");
    }
}
