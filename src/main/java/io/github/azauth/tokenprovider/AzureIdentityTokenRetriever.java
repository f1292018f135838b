package io.github.azauth.tokenprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import io.github.azauth.AzureAuthException;
import io.github.azauth.TokenRequestException;
import io.github.azauth.usercontext.RequestContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for retrievers backed by an Azure Identity {@link TokenCredential}.
 *
 * <p>The credential is built lazily on the first {@link #init()} and reused afterwards.
 * A failed build is retried on the next call.
 */
abstract class AzureIdentityTokenRetriever implements TokenRetriever {

    private final Object initLock = new Object();
    private volatile TokenCredential credential;

    /**
     * Builds the underlying credential. Called at most once per successful initialization.
     *
     * @return the credential
     */
    protected abstract TokenCredential createCredential();

    /**
     * Short description of the mechanism for error messages. Must not contain secrets.
     */
    protected abstract String describe();

    @Override
    public void init() throws AzureAuthException {
        if (credential != null) {
            return;
        }
        synchronized (initLock) {
            if (credential == null) {
                try {
                    credential = createCredential();
                } catch (RuntimeException e) {
                    throw new TokenRequestException(
                            "failed to create " + describe() + " credential: " + e.getMessage(), e);
                }
            }
        }
    }

    @Override
    public AccessToken getAccessToken(RequestContext ctx, List<String> scopes) throws AzureAuthException {
        init();
        TokenRequestContext request = new TokenRequestContext().setScopes(new ArrayList<>(scopes));
        com.azure.core.credential.AccessToken token;
        try {
            token = credential.getTokenSync(request);
        } catch (RuntimeException e) {
            throw new TokenRequestException(
                    describe() + " token request failed: " + e.getMessage(), e);
        }
        if (token == null || token.getToken() == null) {
            throw new TokenRequestException(describe() + " credential returned no access token");
        }
        Instant expiresOn = token.getExpiresAt() != null ? token.getExpiresAt().toInstant() : null;
        return new AccessToken(token.getToken(), expiresOn);
    }
}
