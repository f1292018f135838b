package io.github.azauth.credentials;

/**
 * Authenticates with the managed identity assigned to the host.
 */
public final class ManagedIdentityCredentials extends AzureCredentials {

    private final String clientId;

    public ManagedIdentityCredentials() {
        this(null);
    }

    /**
     * @param clientId client ID of a user-assigned identity, or null for the host default
     */
    public ManagedIdentityCredentials(String clientId) {
        this.clientId = clientId;
    }

    @Override
    public String getAzureAuthType() {
        return AuthType.MANAGED_IDENTITY.getValue();
    }

    public String getClientId() {
        return clientId;
    }

    @Override
    public String toString() {
        return "ManagedIdentityCredentials{clientId=" + clientId + "}";
    }
}
