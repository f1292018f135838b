package io.github.azauth.tokenprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientSecretCredentialBuilder;

/**
 * Obtains tokens for a service principal authenticating with a client secret.
 */
final class ClientSecretTokenRetriever extends AzureIdentityTokenRetriever {

    private final String authority;
    private final String tenantId;
    private final String clientId;
    private final String clientSecret;

    ClientSecretTokenRetriever(String authority, String tenantId, String clientId, String clientSecret) {
        this.authority = authority;
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    String getAuthority() {
        return authority;
    }

    @Override
    public String getCacheKey(String tenantScope) {
        return "azure|clientsecret|" + authority + "|" + tenantId + "|" + clientId + "|"
                + SecretHash.sha256(clientSecret);
    }

    @Override
    protected TokenCredential createCredential() {
        return new ClientSecretCredentialBuilder()
                .authorityHost(authority)
                .tenantId(tenantId)
                .clientId(clientId)
                .clientSecret(clientSecret)
                .build();
    }

    @Override
    protected String describe() {
        return "client secret (tenant " + tenantId + ", client " + clientId + ")";
    }
}
