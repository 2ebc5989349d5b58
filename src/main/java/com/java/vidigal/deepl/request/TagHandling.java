package com.java.vidigal.deepl.request;

/**
 * A {@code tag_handling} strategy: whether and how DeepL treats markup in the input.
 */
public final class TagHandling {

    /**
     * The translation engine does not take tags into account. Sent as an empty value, which clears
     * {@code tag_handling}.
     */
    public static final TagHandling DEFAULT = new TagHandling("default");

    /**
     * Extracts text from the XML structure, translates it sentence by sentence and puts it back.
     */
    public static final TagHandling XML = new TagHandling("xml");

    /**
     * Like {@link #XML}, for HTML documents.
     */
    public static final TagHandling HTML = new TagHandling("html");

    private final String token;

    private TagHandling(String token) {
        this.token = token;
    }

    /**
     * Returns the strategy for a token.
     *
     * @param token the token, e.g. "xml"
     * @return the strategy
     * @throws IllegalArgumentException if {@code token} is null or blank
     */
    public static TagHandling of(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Tag handling cannot be null or blank");
        }
        return switch (token) {
            case "default" -> DEFAULT;
            case "xml" -> XML;
            case "html" -> HTML;
            default -> new TagHandling(token);
        };
    }

    /**
     * Returns the request value: empty for {@link #DEFAULT}, the token otherwise.
     *
     * @return the request value
     */
    public String value() {
        return DEFAULT.token.equals(token) ? "" : token;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof TagHandling other && token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return token;
    }
}
