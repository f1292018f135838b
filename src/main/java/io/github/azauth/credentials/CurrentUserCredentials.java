package io.github.azauth.credentials;

/**
 * Authenticates as the end user on whose behalf the request is served.
 *
 * <p>Requests that are not initiated by a user (alerting, background jobs) may use the
 * optional service credentials instead, provided the host enables the fallback.
 */
public final class CurrentUserCredentials extends AzureCredentials {

    private final boolean serviceCredentialsEnabled;
    private final AzureCredentials serviceCredentials;

    public CurrentUserCredentials() {
        this(false, null);
    }

    /**
     * @param serviceCredentialsEnabled whether the fallback service credentials are enabled
     * @param serviceCredentials        credentials for requests without a user, or null
     */
    public CurrentUserCredentials(boolean serviceCredentialsEnabled, AzureCredentials serviceCredentials) {
        this.serviceCredentialsEnabled = serviceCredentialsEnabled;
        this.serviceCredentials = serviceCredentials;
    }

    @Override
    public String getAzureAuthType() {
        return AuthType.CURRENT_USER.getValue();
    }

    public boolean isServiceCredentialsEnabled() {
        return serviceCredentialsEnabled;
    }

    public AzureCredentials getServiceCredentials() {
        return serviceCredentials;
    }

    @Override
    public String toString() {
        return "CurrentUserCredentials{serviceCredentialsEnabled=" + serviceCredentialsEnabled
                + ", serviceCredentials=" + serviceCredentials + "}";
    }
}
