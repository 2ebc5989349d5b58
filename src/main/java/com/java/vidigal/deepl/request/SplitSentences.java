package com.java.vidigal.deepl.request;

/**
 * A {@code split_sentences} setting: how DeepL splits the input into sentences before translating.
 */
public final class SplitSentences {

    /**
     * No splitting at all; the whole input is treated as one sentence.
     */
    public static final SplitSentences NONE = new SplitSentences("0");

    /**
     * Splits on punctuation and on newlines. This is DeepL's default.
     */
    public static final SplitSentences DEFAULT = new SplitSentences("1");

    /**
     * Splits on punctuation only, ignoring newlines.
     */
    public static final SplitSentences NO_NEWLINES = new SplitSentences("nonewlines");

    private final String token;

    private SplitSentences(String token) {
        this.token = token;
    }

    /**
     * Returns the setting for a token. Unrecognized tokens are kept, but send as {@link #DEFAULT}.
     *
     * @param token the token, e.g. "nonewlines"
     * @return the setting
     * @throws IllegalArgumentException if {@code token} is null
     */
    public static SplitSentences of(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Split sentences token cannot be null");
        }
        return switch (token) {
            case "0" -> NONE;
            case "1" -> DEFAULT;
            case "nonewlines" -> NO_NEWLINES;
            default -> new SplitSentences(token);
        };
    }

    /**
     * Returns the request value: "0", "1" or "nonewlines", with "1" for anything unrecognized.
     *
     * @return the request value
     */
    public String value() {
        return switch (token) {
            case "0", "nonewlines" -> token;
            default -> "1";
        };
    }

    /**
     * Returns the token this setting was created from.
     *
     * @return the raw token
     */
    public String token() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof SplitSentences other && token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return value();
    }
}
