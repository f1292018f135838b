package io.github.azauth.settings;

/**
 * Host-wide defaults for workload identity.
 */
public final class WorkloadIdentitySettings {

    private final String tenantId;
    private final String clientId;
    private final String tokenFile;

    public WorkloadIdentitySettings(String tenantId, String clientId, String tokenFile) {
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.tokenFile = tokenFile;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    /** Path of the projected service account token. */
    public String getTokenFile() {
        return tokenFile;
    }

    @Override
    public String toString() {
        return "WorkloadIdentitySettings{tenantId=" + tenantId + ", clientId=" + clientId
                + ", tokenFile=" + tokenFile + "}";
    }
}
