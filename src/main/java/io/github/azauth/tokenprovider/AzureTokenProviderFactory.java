package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.ConfigurationException;
import io.github.azauth.InvalidFallbackCredentialException;
import io.github.azauth.UnsupportedCredentialException;
import io.github.azauth.credentials.AuthType;
import io.github.azauth.credentials.AzureCredentials;
import io.github.azauth.credentials.ClientPasswordCredentials;
import io.github.azauth.credentials.ClientSecretCredentials;
import io.github.azauth.credentials.CurrentUserCredentials;
import io.github.azauth.credentials.ManagedIdentityCredentials;
import io.github.azauth.credentials.WorkloadIdentityCredentials;
import io.github.azauth.settings.AzureSettings;
import io.github.azauth.settings.TokenEndpointSettings;
import io.github.azauth.settings.WorkloadIdentitySettings;
import io.github.azauth.util.Preconditions;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves credentials into token providers.
 *
 * <p>Every provider created by a factory shares the factory's {@link TokenCache}. Host
 * settings gate which mechanisms are usable: a credential whose mechanism is disabled
 * is rejected with {@link ConfigurationException}.
 *
 * <p>Resolution by credential type:
 * <ul>
 *   <li>{@code msi} - requires managed identity enabled; client ID defaults to the host's</li>
 *   <li>{@code workloadidentity} - requires workload identity enabled; tenant and client ID
 *       default to the host's</li>
 *   <li>{@code clientsecret} - authority from the credential, else from its cloud</li>
 *   <li>{@code ad-password} - client ID defaults to the host's managed identity client ID</li>
 *   <li>{@code currentuser} - requires user identity enabled; the mechanism is chosen per
 *       request, see {@link UserTokenProvider}</li>
 * </ul>
 * Anything else is rejected with {@link UnsupportedCredentialException}.
 */
public class AzureTokenProviderFactory {

    private static final Logger logger = LoggerFactory.getLogger(AzureTokenProviderFactory.class);

    private final TokenCache cache;
    private final Function<TokenEndpointSettings, TokenClient> tokenClientFactory;

    /**
     * Creates a factory whose user providers talk to the token endpoint over HTTP.
     *
     * @param cache the token cache shared by all providers
     */
    public AzureTokenProviderFactory(TokenCache cache) {
        this(cache, endpoint -> new HttpTokenClient(
                endpoint.getTokenUrl(), endpoint.getClientId(), endpoint.getClientSecret()));
    }

    /**
     * Creates a factory with a custom token endpoint client (for testing).
     *
     * @param cache              the token cache shared by all providers
     * @param tokenClientFactory builds the client for the user identity token endpoint
     */
    public AzureTokenProviderFactory(TokenCache cache, Function<TokenEndpointSettings, TokenClient> tokenClientFactory) {
        this.cache = Preconditions.requireNonNull(cache, "cache");
        this.tokenClientFactory = Preconditions.requireNonNull(tokenClientFactory, "tokenClientFactory");
    }

    /**
     * Resolves a token provider for the credentials.
     *
     * @param settings        the host settings
     * @param credentials     the credentials
     * @param isUserInitiated whether the provider serves requests made by signed-in users;
     *                        backend-only use of user identity credentials requires fallback
     *                        service credentials
     * @return the provider
     * @throws AzureAuthException if the credentials cannot be used with these settings
     */
    public AzureTokenProvider resolveProvider(AzureSettings settings, AzureCredentials credentials,
                                              boolean isUserInitiated) throws AzureAuthException {
        Preconditions.requireNonNull(settings, "settings");
        Preconditions.requireNonNull(credentials, "credentials");

        AuthType type = credentials.getBuiltInType();
        if (type == AuthType.CURRENT_USER) {
            return resolveUserProvider(settings, as(credentials, CurrentUserCredentials.class), isUserInitiated);
        }
        return new ServiceTokenProvider(cache, resolveServiceRetriever(settings, credentials));
    }

    private AzureTokenProvider resolveUserProvider(AzureSettings settings, CurrentUserCredentials credentials,
                                                   boolean isUserInitiated) throws AzureAuthException {
        if (!settings.isUserIdentityEnabled()) {
            throw new ConfigurationException("user identity authentication is not enabled in configuration");
        }
        TokenEndpointSettings endpoint = settings.getUserIdentityTokenEndpoint();
        if (endpoint == null) {
            throw new ConfigurationException("user identity authentication is enabled but token endpoint not configured");
        }

        boolean fallbackEnabled = settings.isUserIdentityFallbackCredentialsEnabled()
                && credentials.isServiceCredentialsEnabled();
        TokenRetriever fallbackRetriever = null;
        if (fallbackEnabled && credentials.getServiceCredentials() != null) {
            AzureCredentials serviceCredentials = credentials.getServiceCredentials();
            AuthType serviceType = serviceCredentials.getBuiltInType();
            if (serviceType == AuthType.CURRENT_USER || serviceType == AuthType.CLIENT_SECRET_OBO) {
                throw new InvalidFallbackCredentialException(serviceCredentials.getAzureAuthType());
            }
            fallbackRetriever = resolveServiceRetriever(settings, serviceCredentials);
        }

        if (!isUserInitiated && fallbackRetriever == null) {
            throw new ConfigurationException("user identity authentication only supported for user-initiated "
                    + "requests unless fallback service credentials are configured");
        }

        logger.debug("Resolved user identity provider (usernameAssertion={}, fallback={})",
                settings.isUsernameAssertion(), fallbackRetriever != null);
        return new UserTokenProvider(cache, tokenClientFactory.apply(endpoint), settings.isUsernameAssertion(),
                fallbackEnabled, fallbackRetriever);
    }

    /**
     * Resolves credentials that identify a fixed service principal or managed identity.
     */
    TokenRetriever resolveServiceRetriever(AzureSettings settings, AzureCredentials credentials)
            throws AzureAuthException {
        AuthType type = credentials.getBuiltInType();
        if (type == null) {
            throw new UnsupportedCredentialException(credentials.getAzureAuthType());
        }

        switch (type) {
            case MANAGED_IDENTITY: {
                if (!settings.isManagedIdentityEnabled()) {
                    throw new ConfigurationException("managed identity authentication is not enabled in configuration");
                }
                ManagedIdentityCredentials c = as(credentials, ManagedIdentityCredentials.class);
                String clientId = Preconditions.firstNonBlank(c.getClientId(), settings.getManagedIdentityClientId());
                logger.debug("Resolved managed identity retriever (clientId={})", clientId);
                return new ManagedIdentityTokenRetriever(Preconditions.isBlank(clientId) ? null : clientId);
            }

            case WORKLOAD_IDENTITY: {
                if (!settings.isWorkloadIdentityEnabled()) {
                    throw new ConfigurationException("workload identity authentication is not enabled in configuration");
                }
                WorkloadIdentityCredentials c = as(credentials, WorkloadIdentityCredentials.class);
                WorkloadIdentitySettings wi = settings.getWorkloadIdentitySettings();
                String tenantId = Preconditions.firstNonBlank(c.getTenantId(), wi != null ? wi.getTenantId() : null);
                String clientId = Preconditions.firstNonBlank(c.getClientId(), wi != null ? wi.getClientId() : null);
                logger.debug("Resolved workload identity retriever (tenantId={}, clientId={})", tenantId, clientId);
                return new WorkloadIdentityTokenRetriever(
                        Preconditions.isBlank(tenantId) ? null : tenantId,
                        Preconditions.isBlank(clientId) ? null : clientId,
                        wi != null ? wi.getTokenFile() : null);
            }

            case CLIENT_SECRET: {
                ClientSecretCredentials c = as(credentials, ClientSecretCredentials.class);
                String authority = c.getAuthority();
                if (Preconditions.isBlank(authority)) {
                    String cloudName = Preconditions.firstNonBlank(c.getAzureCloud(), settings.getDefaultCloud());
                    authority = settings.getCloud(cloudName).getAadAuthority();
                }
                logger.debug("Resolved client secret retriever (authority={}, tenantId={}, clientId={})",
                        authority, c.getTenantId(), c.getClientId());
                return new ClientSecretTokenRetriever(authority, c.getTenantId(), c.getClientId(), c.getClientSecret());
            }

            case CLIENT_PASSWORD: {
                ClientPasswordCredentials c = as(credentials, ClientPasswordCredentials.class);
                String clientId = Preconditions.firstNonBlank(c.getClientId(), settings.getManagedIdentityClientId());
                logger.debug("Resolved password retriever (userId={}, clientId={})", c.getUserId(), clientId);
                return new PasswordTokenRetriever(c.getTenantId(), clientId, c.getUserId(), c.getPassword());
            }

            default:
                throw new UnsupportedCredentialException(credentials.getAzureAuthType());
        }
    }

    private static <T extends AzureCredentials> T as(AzureCredentials credentials, Class<T> type)
            throws UnsupportedCredentialException {
        if (!type.isInstance(credentials)) {
            throw new UnsupportedCredentialException(credentials.getAzureAuthType());
        }
        return type.cast(credentials);
    }
}
