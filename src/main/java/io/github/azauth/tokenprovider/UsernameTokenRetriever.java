package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.usercontext.RequestContext;
import java.util.List;

/**
 * Obtains a token for the current user by asserting their login name.
 */
final class UsernameTokenRetriever implements TokenRetriever {

    private final TokenClient client;
    private final String username;

    UsernameTokenRetriever(TokenClient client, String username) {
        this.client = client;
        this.username = username;
    }

    @Override
    public String getCacheKey(String tenantScope) {
        return "currentuser|username|" + client.getCacheKey() + "|" + username + "|"
                + (tenantScope != null ? tenantScope : "");
    }

    @Override
    public void init() {
        // Nothing to initialize
    }

    @Override
    public AccessToken getAccessToken(RequestContext ctx, List<String> scopes) throws AzureAuthException {
        return client.fromUsername(username, scopes);
    }

    String getUsername() {
        return username;
    }
}
