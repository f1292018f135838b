package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.usercontext.RequestContext;
import java.util.List;

/**
 * Shared store of access tokens keyed by credential identity.
 */
public interface TokenCache {

    /**
     * Returns a valid access token for the retriever, fetching one if none is cached.
     *
     * @param ctx       the request context
     * @param retriever the retriever used on a miss
     * @param scopes    the requested scopes
     * @return the bearer token value
     * @throws AzureAuthException if a token cannot be obtained
     */
    String getAccessToken(RequestContext ctx, TokenRetriever retriever, List<String> scopes)
            throws AzureAuthException;
}
