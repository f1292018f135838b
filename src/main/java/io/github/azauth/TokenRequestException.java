package io.github.azauth;

/**
 * Exception thrown when an access token cannot be obtained from the identity provider.
 *
 * <p>This exception captures the HTTP status code returned by the token endpoint when
 * there was one. Status code 0 indicates the request never produced a response
 * (connection failure, timeout, client library error).
 */
public class TokenRequestException extends AzureAuthException {

    private static final int MAX_BODY_LENGTH = 200;

    private final int httpStatusCode;

    public TokenRequestException(String message) {
        this(message, 0);
    }

    public TokenRequestException(String message, int httpStatusCode) {
        super(message);
        this.httpStatusCode = httpStatusCode;
    }

    public TokenRequestException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public TokenRequestException(String message, int httpStatusCode, Throwable cause) {
        super(message, cause);
        this.httpStatusCode = httpStatusCode;
    }

    /**
     * Gets the HTTP status code from the token endpoint.
     *
     * @return the status code, or 0 if the request failed before receiving a response
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    /**
     * Creates a TokenRequestException from an unsuccessful token endpoint response.
     *
     * <p>The body is only included when the endpoint declared it as JSON, and it is
     * truncated to keep log lines bounded.
     *
     * @param statusCode  the HTTP status code
     * @param contentType the media type of the response, or null
     * @param body        the response body, or null
     * @return a new TokenRequestException
     */
    public static TokenRequestException fromResponse(int statusCode, String contentType, String body) {
        StringBuilder message = new StringBuilder("request failed with status ").append(statusCode);
        if ("application/json".equals(contentType) && body != null && !body.isBlank()) {
            String truncated = body.length() > MAX_BODY_LENGTH
                    ? body.substring(0, MAX_BODY_LENGTH) + "..."
                    : body;
            message.append(", body ").append(truncated);
        }
        return new TokenRequestException(message.toString(), statusCode);
    }

    @Override
    public String toString() {
        return "TokenRequestException{" +
                "message='" + getMessage() + '\'' +
                ", httpStatusCode=" + httpStatusCode +
                '}';
    }
}
