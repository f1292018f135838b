package io.github.azauth.settings;

/**
 * OAuth token endpoint used for user identity exchanges (on-behalf-of and username assertion).
 */
public final class TokenEndpointSettings {

    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final boolean usernameAssertion;

    /**
     * @param tokenUrl          the token endpoint URL
     * @param clientId          client ID presented to the endpoint
     * @param clientSecret      client secret presented to the endpoint, may be empty
     * @param usernameAssertion exchange the user's login name directly instead of an ID token,
     *                          for hosts that authenticate users through a trusted proxy
     */
    public TokenEndpointSettings(String tokenUrl, String clientId, String clientSecret, boolean usernameAssertion) {
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.usernameAssertion = usernameAssertion;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public boolean isUsernameAssertion() {
        return usernameAssertion;
    }

    @Override
    public String toString() {
        return "TokenEndpointSettings{tokenUrl=" + tokenUrl + ", clientId=" + clientId
                + ", usernameAssertion=" + usernameAssertion + "}";
    }
}
