package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.usercontext.RequestContext;
import io.github.azauth.util.Preconditions;
import java.util.List;

/**
 * Provides tokens for a fixed service identity through the shared cache.
 */
final class ServiceTokenProvider implements AzureTokenProvider {

    private final TokenCache cache;
    private final TokenRetriever retriever;

    ServiceTokenProvider(TokenCache cache, TokenRetriever retriever) {
        this.cache = cache;
        this.retriever = retriever;
    }

    @Override
    public String getAccessToken(RequestContext ctx, List<String> scopes) throws AzureAuthException {
        Preconditions.requireNonNull(ctx, "ctx");
        Preconditions.requireNonNull(scopes, "scopes");
        return cache.getAccessToken(ctx, retriever, scopes);
    }

    TokenRetriever getRetriever() {
        return retriever;
    }
}
