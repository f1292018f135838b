package io.github.azauth.httpclient;

import io.github.azauth.settings.AzureSettings;
import io.github.azauth.util.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Options for authenticating outbound HTTP requests with Azure access tokens.
 */
public final class AuthOptions {

    private final AzureSettings settings;
    private final List<String> scopes = new ArrayList<>();
    private final Map<String, TokenProviderFactory> customProviders = new HashMap<>();
    private EndpointAllowlist allowedEndpoints;

    public AuthOptions(AzureSettings settings) {
        this.settings = Preconditions.requireNonNull(settings, "settings");
    }

    /**
     * Sets the scopes requested for every token, replacing any set before.
     */
    public AuthOptions scopes(List<String> scopes) {
        Preconditions.requireNonNull(scopes, "scopes");
        this.scopes.clear();
        this.scopes.addAll(scopes);
        return this;
    }

    /**
     * Registers a factory used instead of the built-in resolution for credentials of the
     * given auth type.
     *
     * @param authType the credential discriminant, e.g. {@code clientsecret-obo}
     * @param factory  the factory
     * @return this
     */
    public AuthOptions addTokenProvider(String authType, TokenProviderFactory factory) {
        Preconditions.requireNonBlank(authType, "authType");
        Preconditions.requireNonNull(factory, "factory");
        customProviders.put(authType, factory);
        return this;
    }

    /**
     * Restricts which endpoints may receive tokens. Without an allowlist every endpoint may.
     */
    public AuthOptions allowedEndpoints(EndpointAllowlist allowlist) {
        this.allowedEndpoints = allowlist;
        return this;
    }

    public AzureSettings getSettings() {
        return settings;
    }

    public List<String> getScopes() {
        return Collections.unmodifiableList(scopes);
    }

    public TokenProviderFactory getCustomProvider(String authType) {
        return customProviders.get(authType);
    }

    public EndpointAllowlist getAllowedEndpoints() {
        return allowedEndpoints;
    }
}
