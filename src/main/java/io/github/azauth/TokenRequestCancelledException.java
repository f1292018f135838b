package io.github.azauth;

/**
 * Thrown when a caller stops waiting for a token because it was interrupted or its
 * wait timeout elapsed. The token acquisition it was waiting on keeps running.
 */
public class TokenRequestCancelledException extends TokenRequestException {

    public TokenRequestCancelledException(String message) {
        super(message);
    }

    public TokenRequestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
