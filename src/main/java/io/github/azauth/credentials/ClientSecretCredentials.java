package io.github.azauth.credentials;

/**
 * Authenticates as an app registration using a client secret.
 *
 * <p>The authority is taken from {@link #getAuthority()} when set, otherwise it is
 * resolved from the cloud name.
 */
public final class ClientSecretCredentials extends AzureCredentials {

    private final String azureCloud;
    private final String authority;
    private final String tenantId;
    private final String clientId;
    private final String clientSecret;

    public ClientSecretCredentials(String azureCloud, String tenantId, String clientId, String clientSecret) {
        this(azureCloud, null, tenantId, clientId, clientSecret);
    }

    /**
     * @param azureCloud   name of the cloud, or null for the host default
     * @param authority    explicit authority host overriding the cloud, or null
     * @param tenantId     directory (tenant) ID
     * @param clientId     application (client) ID
     * @param clientSecret client secret
     */
    public ClientSecretCredentials(String azureCloud, String authority, String tenantId,
                                   String clientId, String clientSecret) {
        this.azureCloud = azureCloud;
        this.authority = authority;
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    public String getAzureAuthType() {
        return AuthType.CLIENT_SECRET.getValue();
    }

    public String getAzureCloud() {
        return azureCloud;
    }

    public String getAuthority() {
        return authority;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    @Override
    public String toString() {
        return "ClientSecretCredentials{azureCloud=" + azureCloud + ", authority=" + authority
                + ", tenantId=" + tenantId + ", clientId=" + clientId + ", clientSecret=****}";
    }
}
