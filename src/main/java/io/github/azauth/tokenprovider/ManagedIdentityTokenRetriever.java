package io.github.azauth.tokenprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ManagedIdentityCredentialBuilder;

/**
 * Obtains tokens for the host's system-assigned or a user-assigned managed identity.
 */
final class ManagedIdentityTokenRetriever extends AzureIdentityTokenRetriever {

    private final String clientId;

    ManagedIdentityTokenRetriever(String clientId) {
        this.clientId = clientId;
    }

    String getClientId() {
        return clientId;
    }

    @Override
    public String getCacheKey(String tenantScope) {
        return "azure|msi|" + (clientId != null ? clientId : "system");
    }

    @Override
    protected TokenCredential createCredential() {
        ManagedIdentityCredentialBuilder builder = new ManagedIdentityCredentialBuilder();
        if (clientId != null) {
            builder.clientId(clientId);
        }
        return builder.build();
    }

    @Override
    protected String describe() {
        return "managed identity";
    }
}
