package io.github.azauth.credentials;

/**
 * Client secret credentials used for on-behalf-of exchanges.
 *
 * <p>No built-in token provider handles this type; hosts register a custom provider for it.
 */
public final class ClientSecretOboCredentials extends AzureCredentials {

    private final ClientSecretCredentials clientSecretCredentials;

    public ClientSecretOboCredentials(ClientSecretCredentials clientSecretCredentials) {
        this.clientSecretCredentials = clientSecretCredentials;
    }

    @Override
    public String getAzureAuthType() {
        return AuthType.CLIENT_SECRET_OBO.getValue();
    }

    public ClientSecretCredentials getClientSecretCredentials() {
        return clientSecretCredentials;
    }

    @Override
    public String toString() {
        return "ClientSecretOboCredentials{" + clientSecretCredentials + "}";
    }
}
