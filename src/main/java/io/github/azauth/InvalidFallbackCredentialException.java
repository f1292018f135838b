package io.github.azauth;

/**
 * Thrown when the fallback credentials of a user-identity credential are themselves
 * user-bound (current user or on-behalf-of).
 */
public class InvalidFallbackCredentialException extends AzureAuthException {

    public InvalidFallbackCredentialException(String authType) {
        super("user identity authentication not valid for fallback credentials: '" + authType + "'");
    }
}
