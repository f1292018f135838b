package io.github.azauth.credentials;

/**
 * Authenticates with a federated workload identity.
 */
public final class WorkloadIdentityCredentials extends AzureCredentials {

    private final String tenantId;
    private final String clientId;

    public WorkloadIdentityCredentials() {
        this(null, null);
    }

    /**
     * @param tenantId tenant of the identity, or null to use the host setting
     * @param clientId client ID of the identity, or null to use the host setting
     */
    public WorkloadIdentityCredentials(String tenantId, String clientId) {
        this.tenantId = tenantId;
        this.clientId = clientId;
    }

    @Override
    public String getAzureAuthType() {
        return AuthType.WORKLOAD_IDENTITY.getValue();
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    @Override
    public String toString() {
        return "WorkloadIdentityCredentials{tenantId=" + tenantId + ", clientId=" + clientId + "}";
    }
}
