package io.github.azauth.tokenprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.UsernamePasswordCredentialBuilder;

/**
 * Obtains tokens with the resource owner password grant for a fixed directory user.
 */
final class PasswordTokenRetriever extends AzureIdentityTokenRetriever {

    private final String tenantId;
    private final String clientId;
    private final String userId;
    private final String password;

    PasswordTokenRetriever(String tenantId, String clientId, String userId, String password) {
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.userId = userId;
        this.password = password;
    }

    String getClientId() {
        return clientId;
    }

    @Override
    public String getCacheKey(String tenantScope) {
        return "azure|password|" + userId + "|" + clientId + "|" + SecretHash.sha256(password) + "|"
                + (tenantScope != null ? tenantScope : "");
    }

    @Override
    protected TokenCredential createCredential() {
        return new UsernamePasswordCredentialBuilder()
                .tenantId(tenantId)
                .clientId(clientId)
                .username(userId)
                .password(password)
                .build();
    }

    @Override
    protected String describe() {
        return "password (user " + userId + ")";
    }
}
