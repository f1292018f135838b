package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.usercontext.RequestContext;
import java.time.Instant;
import java.util.List;

/**
 * Strategy that obtains access tokens for one credential identity.
 *
 * <p>Implementations are shared between threads and must be safe for concurrent use.
 */
public interface TokenRetriever {

    /**
     * Returns the identity this retriever's tokens are cached under.
     *
     * <p>Different tenants, clients, users or secrets must produce different keys.
     * Secrets may only appear as a one-way hash.
     *
     * @param tenantScope the tenant scope of the calling request, may be empty
     * @return the cache key
     */
    String getCacheKey(String tenantScope);

    /**
     * Prepares the retriever for use. Called before every acquisition, so implementations
     * must be idempotent and cheap once they have succeeded.
     *
     * @throws AzureAuthException if the underlying credential cannot be created
     */
    void init() throws AzureAuthException;

    /**
     * Obtains a new access token from the identity provider.
     *
     * @param ctx    the request context
     * @param scopes the requested scopes
     * @return the token
     * @throws AzureAuthException if the token cannot be obtained
     */
    AccessToken getAccessToken(RequestContext ctx, List<String> scopes) throws AzureAuthException;

    /**
     * Returns an upper bound on how long tokens from this retriever may be served,
     * independent of the tokens' own expiry.
     *
     * @return the ceiling, or null when there is none
     */
    default Instant getExpiry() {
        return null;
    }
}
