package io.github.azauth;

/**
 * Thrown when an authentication mechanism is disabled or a setting it requires is missing.
 */
public class ConfigurationException extends AzureAuthException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
