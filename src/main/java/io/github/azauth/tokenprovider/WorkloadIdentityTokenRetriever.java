package io.github.azauth.tokenprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.WorkloadIdentityCredentialBuilder;

/**
 * Obtains tokens through a federated workload identity (Kubernetes service account token).
 *
 * <p>Values left null are read by the Azure Identity library from the
 * {@code AZURE_TENANT_ID}, {@code AZURE_CLIENT_ID} and {@code AZURE_FEDERATED_TOKEN_FILE}
 * variables injected by the workload identity webhook.
 */
final class WorkloadIdentityTokenRetriever extends AzureIdentityTokenRetriever {

    private final String tenantId;
    private final String clientId;
    private final String tokenFile;

    WorkloadIdentityTokenRetriever(String tenantId, String clientId, String tokenFile) {
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.tokenFile = tokenFile;
    }

    String getTenantId() {
        return tenantId;
    }

    String getClientId() {
        return clientId;
    }

    @Override
    public String getCacheKey(String tenantScope) {
        return "azure|wi|" + (tenantId != null ? tenantId : "default") + "|"
                + (clientId != null ? clientId : "default");
    }

    @Override
    protected TokenCredential createCredential() {
        WorkloadIdentityCredentialBuilder builder = new WorkloadIdentityCredentialBuilder();
        if (tenantId != null) {
            builder.tenantId(tenantId);
        }
        if (clientId != null) {
            builder.clientId(clientId);
        }
        if (tokenFile != null) {
            builder.tokenFilePath(tokenFile);
        }
        return builder.build();
    }

    @Override
    protected String describe() {
        return "workload identity";
    }
}
