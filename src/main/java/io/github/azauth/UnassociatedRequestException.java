package io.github.azauth;

/**
 * Thrown when a request carries a user context whose user cannot be identified.
 */
public class UnassociatedRequestException extends AzureAuthException {

    public UnassociatedRequestException(String message) {
        super(message);
    }
}
