package io.github.azauth;

/**
 * Thrown when no token provider is available for a credential's authentication type.
 */
public class UnsupportedCredentialException extends AzureAuthException {

    private final String authType;

    public UnsupportedCredentialException(String authType) {
        super("credentials of type '" + authType + "' not supported by authentication provider");
        this.authType = authType;
    }

    public UnsupportedCredentialException(String authType, String message) {
        super(message);
        this.authType = authType;
    }

    /**
     * Returns the discriminant of the rejected credential.
     *
     * @return the auth type
     */
    public String getAuthType() {
        return authType;
    }
}
