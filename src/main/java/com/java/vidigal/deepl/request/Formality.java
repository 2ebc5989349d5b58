package com.java.vidigal.deepl.request;

/**
 * A {@code formality} setting: whether the translation should lean towards formal or informal
 * language. Tokens outside the named constants are passed through unchanged.
 */
public final class Formality {

    public static final Formality DEFAULT = new Formality("default");

    /**
     * Less formal, more informal language.
     */
    public static final Formality LESS = new Formality("less");

    /**
     * More formal language.
     */
    public static final Formality MORE = new Formality("more");

    private final String token;

    private Formality(String token) {
        this.token = token;
    }

    /**
     * Returns the formality for a token.
     *
     * @param token the token, e.g. "more"
     * @return the formality
     * @throws IllegalArgumentException if {@code token} is null or blank
     */
    public static Formality of(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Formality cannot be null or blank");
        }
        return switch (token) {
            case "default" -> DEFAULT;
            case "less" -> LESS;
            case "more" -> MORE;
            default -> new Formality(token);
        };
    }

    /**
     * Returns the request value.
     *
     * @return the token itself
     */
    public String value() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Formality other && token.equals(other.token);
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
