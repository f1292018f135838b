package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.usercontext.RequestContext;
import java.util.List;

/**
 * Source of bearer tokens for outbound calls made with one set of credentials.
 */
@FunctionalInterface
public interface AzureTokenProvider {

    /**
     * Returns a valid access token for the scopes.
     *
     * @param ctx    the request context
     * @param scopes the requested scopes
     * @return the bearer token value
     * @throws AzureAuthException if no token can be obtained for this request
     */
    String getAccessToken(RequestContext ctx, List<String> scopes) throws AzureAuthException;
}
