package io.github.azauth;

/**
 * Thrown when a user-identity provider is called outside a user request and no
 * fallback service credentials may be used.
 */
public class FallbackNotEnabledException extends AzureAuthException {

    public FallbackNotEnabledException(String message) {
        super(message);
    }
}
