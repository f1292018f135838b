package io.github.azauth.credentials;

/**
 * Authenticates as a directory user with username and password.
 */
public final class ClientPasswordCredentials extends AzureCredentials {

    private final String tenantId;
    private final String clientId;
    private final String userId;
    private final String password;

    public ClientPasswordCredentials(String tenantId, String clientId, String userId, String password) {
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.userId = userId;
        this.password = password;
    }

    @Override
    public String getAzureAuthType() {
        return AuthType.CLIENT_PASSWORD.getValue();
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getUserId() {
        return userId;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return "ClientPasswordCredentials{tenantId=" + tenantId + ", clientId=" + clientId
                + ", userId=" + userId + ", password=****}";
    }
}
