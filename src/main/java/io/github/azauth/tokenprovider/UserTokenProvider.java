package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.FallbackNotEnabledException;
import io.github.azauth.MissingDelegatedTokenException;
import io.github.azauth.UnassociatedRequestException;
import io.github.azauth.usercontext.CurrentUserContext;
import io.github.azauth.usercontext.RequestContext;
import io.github.azauth.util.Preconditions;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides tokens for the end user of each request.
 *
 * <p>The retriever is chosen per call from the request's {@link CurrentUserContext}:
 * <ul>
 *   <li>no user: the service credentials configured as fallback, if enabled</li>
 *   <li>username assertion mode: the user's login is exchanged directly</li>
 *   <li>otherwise: the user's ID token is exchanged on behalf of the user</li>
 * </ul>
 */
final class UserTokenProvider implements AzureTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(UserTokenProvider.class);

    private final TokenCache cache;
    private final TokenClient client;
    private final boolean usernameAssertion;
    private final boolean fallbackEnabled;
    private final TokenRetriever fallbackRetriever;

    /**
     * @param cache             the shared token cache
     * @param client            client for the user identity token endpoint
     * @param usernameAssertion whether to assert the username instead of the ID token
     * @param fallbackEnabled   whether backend calls may use the fallback retriever
     * @param fallbackRetriever retriever for backend calls, or null
     */
    UserTokenProvider(TokenCache cache, TokenClient client, boolean usernameAssertion,
                      boolean fallbackEnabled, TokenRetriever fallbackRetriever) {
        this.cache = cache;
        this.client = client;
        this.usernameAssertion = usernameAssertion;
        this.fallbackEnabled = fallbackEnabled;
        this.fallbackRetriever = fallbackRetriever;
    }

    @Override
    public String getAccessToken(RequestContext ctx, List<String> scopes) throws AzureAuthException {
        Preconditions.requireNonNull(ctx, "ctx");
        Preconditions.requireNonNull(scopes, "scopes");
        return cache.getAccessToken(ctx, selectRetriever(ctx), scopes);
    }

    TokenRetriever selectRetriever(RequestContext ctx) throws AzureAuthException {
        CurrentUserContext user = ctx.getCurrentUser();

        if (user == null || !user.hasUser()) {
            // Backend-initiated request
            if (!fallbackEnabled || usernameAssertion || fallbackRetriever == null) {
                throw new FallbackNotEnabledException("fallback credentials not enabled");
            }
            logger.debug("No user in request context, using fallback service credentials");
            return fallbackRetriever;
        }

        String login = user.getLogin();
        if (Preconditions.isBlank(login)) {
            throw new UnassociatedRequestException("user identity authentication not possible because "
                    + "the request is not associated with a user");
        }

        if (usernameAssertion) {
            logger.debug("Using username assertion for user {}", login);
            return new UsernameTokenRetriever(client, login);
        }

        String idToken = user.getIdToken();
        if (idToken == null || idToken.isEmpty()) {
            throw new MissingDelegatedTokenException("user identity authentication only possible with "
                    + "Azure AD sign-in; no ID token available for user '" + login + "'");
        }
        logger.debug("Using on-behalf-of flow for user {}", login);
        return new OnBehalfOfTokenRetriever(client, login, idToken);
    }
}
