package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.usercontext.RequestContext;
import io.github.azauth.util.JsonUtil;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchanges the current user's ID token for an access token acting on the user's behalf.
 *
 * <p>Tokens obtained this way are not served past the ID token's own {@code exp}: once
 * the assertion has expired the user must sign in again.
 */
final class OnBehalfOfTokenRetriever implements TokenRetriever {

    private static final Logger logger = LoggerFactory.getLogger(OnBehalfOfTokenRetriever.class);

    private final TokenClient client;
    private final String userId;
    private final String idToken;

    OnBehalfOfTokenRetriever(TokenClient client, String userId, String idToken) {
        this.client = client;
        this.userId = userId;
        this.idToken = idToken;
    }

    @Override
    public String getCacheKey(String tenantScope) {
        return "currentuser|idtoken|" + client.getCacheKey() + "|" + userId + "|"
                + (tenantScope != null ? tenantScope : "");
    }

    @Override
    public void init() {
        // Nothing to initialize
    }

    @Override
    public AccessToken getAccessToken(RequestContext ctx, List<String> scopes) throws AzureAuthException {
        return client.onBehalfOf(idToken, scopes);
    }

    /**
     * Returns the {@code exp} claim of the ID token. The signature is not verified; the
     * identity provider does that during the exchange.
     *
     * @return the expiry, or null if the token cannot be decoded
     */
    @Override
    public Instant getExpiry() {
        return readExpiry(idToken);
    }

    static Instant readExpiry(String jwt) {
        if (jwt == null) {
            return null;
        }
        String[] parts = jwt.split("\\.");
        if (parts.length < 2) {
            logger.warn("Unable to read ID token expiry: not a JWT");
            return null;
        }
        try {
            String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            Map<String, Object> claims = JsonUtil.parseObject(payload);
            Long exp = JsonUtil.getLong(claims, "exp");
            if (exp == null) {
                logger.warn("Unable to read ID token expiry: no 'exp' claim");
                return null;
            }
            return Instant.ofEpochSecond(exp);
        } catch (IllegalArgumentException e) {
            logger.warn("Unable to read ID token expiry: {}", e.getMessage());
            return null;
        }
    }

    String getUserId() {
        return userId;
    }
}
