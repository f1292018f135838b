package io.github.azauth.tokenprovider;

import java.time.Instant;

/**
 * An issued bearer token and the instant it stops being accepted.
 */
public final class AccessToken {

    private final String token;
    private final Instant expiresOn;

    /**
     * Creates an access token.
     *
     * @param token     the bearer token value
     * @param expiresOn when the token expires, or null if the issuer did not say
     */
    public AccessToken(String token, Instant expiresOn) {
        this.token = token;
        this.expiresOn = expiresOn;
    }

    public String getToken() {
        return token;
    }

    /**
     * Returns the expiry instant, or null when it is unknown.
     */
    public Instant getExpiresOn() {
        return expiresOn;
    }

    @Override
    public String toString() {
        return "AccessToken{token=***, expiresOn=" + expiresOn + '}';
    }
}
