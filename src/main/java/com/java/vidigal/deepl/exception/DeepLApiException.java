package com.java.vidigal.deepl.exception;

import com.java.vidigal.deepl.utilities.HttpStatusText;

import java.util.Optional;

/**
 * Exception for requests rejected by the DeepL API, carrying the HTTP status code and, where it was
 * captured, the raw response body.
 * <p>
 * Status {@value #QUOTA_EXCEEDED} always renders as a fixed quota message. Any other status renders
 * as its standard reason phrase, followed by the trimmed body in parentheses when a body is present.
 * </p>
 */
public class DeepLApiException extends DeepLException {

    /**
     * Status code DeepL answers with once the character quota is used up.
     */
    public static final int QUOTA_EXCEEDED = 456;

    static final String QUOTA_EXCEEDED_MESSAGE = "Quota exceeded. The character limit has been reached.";

    private final int statusCode;
    private final String body;

    /**
     * Constructs a new DeepLApiException without a response body.
     *
     * @param statusCode The HTTP status code of the failed request.
     */
    public DeepLApiException(int statusCode) {
        this(statusCode, null);
    }

    /**
     * Constructs a new DeepLApiException with the raw response body.
     *
     * @param statusCode The HTTP status code of the failed request.
     * @param body       The raw response body, or null if it was not captured.
     */
    public DeepLApiException(int statusCode, String body) {
        super(render(statusCode, body));
        this.statusCode = statusCode;
        this.body = body;
    }

    /**
     * Renders the message for a status code and optional body.
     *
     * @param statusCode the HTTP status code
     * @param body       the raw body, or null
     * @return the human-readable message
     */
    public static String render(int statusCode, String body) {
        if (statusCode == QUOTA_EXCEEDED) {
            return QUOTA_EXCEEDED_MESSAGE;
        }
        String statusText = HttpStatusText.of(statusCode);
        if (body != null && !body.isEmpty()) {
            return "unexpected HTTP status " + statusText + " (" + body.trim() + ")";
        }
        return "unexpected HTTP status " + statusText;
    }

    /**
     * Returns the HTTP status code associated with this exception.
     *
     * @return The HTTP status code.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the raw response body, if it was captured.
     *
     * @return The body, or empty for translation calls and empty responses.
     */
    public Optional<String> getBody() {
        return Optional.ofNullable(body);
    }

    /**
     * Tells whether the account ran out of characters.
     *
     * @return true for status {@value #QUOTA_EXCEEDED}
     */
    public boolean isQuotaExceeded() {
        return statusCode == QUOTA_EXCEEDED;
    }
}
