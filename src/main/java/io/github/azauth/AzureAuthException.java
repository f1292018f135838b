package io.github.azauth;

/**
 * Base class for all failures raised while resolving credentials, acquiring tokens
 * or validating outbound endpoints.
 *
 * <p>Subclasses identify the failure category so callers can decide whether the
 * condition is a misconfiguration (fatal), a per-request identity problem, or a
 * failure talking to the identity provider.
 */
public class AzureAuthException extends Exception {

    public AzureAuthException(String message) {
        super(message);
    }

    public AzureAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
