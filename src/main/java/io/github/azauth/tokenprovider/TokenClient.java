package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import java.util.List;

/**
 * Client for an OAuth 2.0 token endpoint acting as a confidential client.
 */
public interface TokenClient {

    /**
     * Identifies the endpoint and client credentials behind this client. Tokens issued to
     * different clients must not share a cache entry, so the key changes with the endpoint,
     * the client ID and the secret. The secret appears only as a one-way hash.
     */
    String getCacheKey();

    /**
     * Requests a token with the client credentials grant.
     */
    AccessToken fromClientSecret(List<String> scopes) throws AzureAuthException;

    /**
     * Redeems a refresh token.
     */
    AccessToken fromRefreshToken(String refreshToken, List<String> scopes) throws AzureAuthException;

    /**
     * Exchanges a user's ID token for a token acting on the user's behalf.
     */
    AccessToken onBehalfOf(String idToken, List<String> scopes) throws AzureAuthException;

    /**
     * Requests a token for a user vouched for by the host, identified by login name.
     */
    AccessToken fromUsername(String username, List<String> scopes) throws AzureAuthException;
}
