package io.github.azauth.httpclient;

import io.github.azauth.AzureAuthException;
import io.github.azauth.credentials.AzureCredentials;
import io.github.azauth.settings.AzureSettings;
import io.github.azauth.tokenprovider.AzureTokenProvider;

/**
 * Creates token providers for a custom credential type.
 */
@FunctionalInterface
public interface TokenProviderFactory {

    AzureTokenProvider create(AzureSettings settings, AzureCredentials credentials) throws AzureAuthException;
}
