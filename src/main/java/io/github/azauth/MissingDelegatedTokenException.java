package io.github.azauth;

/**
 * Thrown when an on-behalf-of exchange is required but the user context carries no ID token.
 */
public class MissingDelegatedTokenException extends AzureAuthException {

    public MissingDelegatedTokenException(String message) {
        super(message);
    }
}
