package io.github.azauth.httpclient;

import io.github.azauth.AzureAuthException;
import io.github.azauth.ConfigurationException;
import io.github.azauth.EndpointNotAllowedException;
import io.github.azauth.credentials.AzureCredentials;
import io.github.azauth.tokenprovider.AzureTokenProvider;
import io.github.azauth.tokenprovider.AzureTokenProviderFactory;
import io.github.azauth.usercontext.RequestContext;
import io.github.azauth.util.Preconditions;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches Azure bearer tokens to outbound {@link HttpRequest}s.
 *
 * <p>Usage:
 * <pre>{@code
 * AzureAuthentication auth = AzureAuthentication.create(options, credentials, factory, true);
 * HttpResponse<String> response = httpClient.send(
 *         auth.authorize(ctx, request), HttpResponse.BodyHandlers.ofString());
 * }</pre>
 *
 * <p>Requests to endpoints outside the configured allowlist are rejected before a token
 * is fetched. A request is never returned without a token.
 */
public final class AzureAuthentication {

    private static final Logger logger = LoggerFactory.getLogger(AzureAuthentication.class);

    private static final String HEADER_AUTHORIZATION = "Authorization";

    private final AzureTokenProvider tokenProvider;
    private final List<String> scopes;
    private final EndpointAllowlist allowedEndpoints;

    AzureAuthentication(AzureTokenProvider tokenProvider, List<String> scopes, EndpointAllowlist allowedEndpoints) {
        this.tokenProvider = tokenProvider;
        this.scopes = List.copyOf(scopes);
        this.allowedEndpoints = allowedEndpoints;
    }

    /**
     * Creates the authenticator for a set of credentials.
     *
     * <p>A custom provider registered in the options for the credentials' auth type takes
     * precedence over the factory.
     *
     * @param options         the options
     * @param credentials     the credentials
     * @param factory         the built-in provider factory
     * @param isUserInitiated whether requests are made by signed-in users
     * @return the authenticator
     * @throws AzureAuthException if the credentials cannot be resolved or no scopes are configured
     */
    public static AzureAuthentication create(AuthOptions options, AzureCredentials credentials,
                                             AzureTokenProviderFactory factory, boolean isUserInitiated)
            throws AzureAuthException {
        Preconditions.requireNonNull(options, "options");
        Preconditions.requireNonNull(credentials, "credentials");
        Preconditions.requireNonNull(factory, "factory");

        AzureTokenProvider provider;
        TokenProviderFactory custom = options.getCustomProvider(credentials.getAzureAuthType());
        if (custom != null) {
            logger.debug("Using custom token provider for auth type '{}'", credentials.getAzureAuthType());
            provider = custom.create(options.getSettings(), credentials);
        } else {
            provider = factory.resolveProvider(options.getSettings(), credentials, isUserInitiated);
        }

        if (options.getScopes().isEmpty()) {
            throw new ConfigurationException("scopes not configured");
        }
        return new AzureAuthentication(provider, new ArrayList<>(options.getScopes()), options.getAllowedEndpoints());
    }

    /**
     * Returns a copy of the request carrying an {@code Authorization: Bearer} header.
     * An existing Authorization header is replaced.
     *
     * @param ctx     the request context
     * @param request the outbound request
     * @return the authorized request
     * @throws EndpointNotAllowedException if the destination is not on the allowlist
     * @throws AzureAuthException          if no token can be obtained
     */
    public HttpRequest authorize(RequestContext ctx, HttpRequest request) throws AzureAuthException {
        Preconditions.requireNonNull(ctx, "ctx");
        Preconditions.requireNonNull(request, "request");

        if (allowedEndpoints != null && !allowedEndpoints.isAllowed(request.uri())) {
            logger.debug("Rejected token for endpoint not on allowlist: {}", request.uri());
            throw new EndpointNotAllowedException(request.uri());
        }

        String token = tokenProvider.getAccessToken(ctx, scopes);
        return HttpRequest.newBuilder(request, (name, value) -> !HEADER_AUTHORIZATION.equalsIgnoreCase(name))
                .header(HEADER_AUTHORIZATION, "Bearer " + token)
                .build();
    }
}
