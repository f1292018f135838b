package io.github.azauth.httpclient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.github.azauth.ConfigurationException;
import io.github.azauth.EndpointNotAllowedException;
import io.github.azauth.TokenRequestException;
import io.github.azauth.credentials.AzureCredentials;
import io.github.azauth.credentials.ClientSecretCredentials;
import io.github.azauth.credentials.ClientSecretOboCredentials;
import io.github.azauth.credentials.ManagedIdentityCredentials;
import io.github.azauth.settings.AzureSettings;
import io.github.azauth.tokenprovider.AzureTokenProvider;
import io.github.azauth.tokenprovider.AzureTokenProviderFactory;
import io.github.azauth.usercontext.RequestContext;
import java.net.URI;
import java.net.http.HttpRequest;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AzureAuthentication.
 */
class AzureAuthenticationTest {

    private static final List<String> SCOPES = List.of("https://management.azure.com/.default");

    private AzureSettings settings;
    private AzureTokenProviderFactory factory;
    private AzureTokenProvider provider;

    @BeforeEach
    void setUp() {
        settings = AzureSettings.builder().managedIdentity(true, null).build();
        factory = mock(AzureTokenProviderFactory.class);
        provider = mock(AzureTokenProvider.class);
    }

    private static HttpRequest request(String url) {
        return HttpRequest.newBuilder(URI.create(url)).GET().build();
    }

    // --- create ---

    @Test
    void create_resolvesProviderThroughFactory() throws Exception {
        AzureCredentials creds = new ManagedIdentityCredentials();
        when(factory.resolveProvider(settings, creds, true)).thenReturn(provider);

        AzureAuthentication.create(new AuthOptions(settings).scopes(SCOPES), creds, factory, true);

        verify(factory).resolveProvider(settings, creds, true);
    }

    @Test
    void create_withCustomProvider_bypassesFactory() throws Exception {
        AzureCredentials obo = new ClientSecretOboCredentials(
                new ClientSecretCredentials("AzureCloud", "tenant", "client", "secret"));
        AuthOptions options = new AuthOptions(settings)
                .scopes(SCOPES)
                .addTokenProvider("clientsecret-obo", (s, c) -> provider);
        when(provider.getAccessToken(any(RequestContext.class), anyList())).thenReturn("obo-token");

        AzureAuthentication auth = AzureAuthentication.create(options, obo, factory, true);
        HttpRequest authorized = auth.authorize(RequestContext.background(), request("https://example.com"));

        assertThat(authorized.headers().firstValue("Authorization")).hasValue("Bearer obo-token");
        verify(factory, never()).resolveProvider(any(), any(), anyBoolean());
    }

    @Test
    void create_withoutScopes_throwsConfigurationException() throws Exception {
        AzureCredentials creds = new ManagedIdentityCredentials();
        when(factory.resolveProvider(settings, creds, true)).thenReturn(provider);

        assertThatThrownBy(() -> AzureAuthentication.create(new AuthOptions(settings), creds, factory, true))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("scopes not configured");
    }

    // --- authorize ---

    @Test
    void authorize_addsBearerToken() throws Exception {
        when(provider.getAccessToken(any(RequestContext.class), eq(SCOPES))).thenReturn("abc");
        AzureAuthentication auth = new AzureAuthentication(provider, SCOPES, null);

        HttpRequest authorized = auth.authorize(RequestContext.background(),
                request("https://management.azure.com/subscriptions"));

        assertThat(authorized.headers().firstValue("Authorization")).hasValue("Bearer abc");
        assertThat(authorized.uri()).isEqualTo(URI.create("https://management.azure.com/subscriptions"));
        assertThat(authorized.method()).isEqualTo("GET");
    }

    @Test
    void authorize_replacesExistingAuthorizationHeader() throws Exception {
        when(provider.getAccessToken(any(RequestContext.class), anyList())).thenReturn("fresh");
        AzureAuthentication auth = new AzureAuthentication(provider, SCOPES, null);
        HttpRequest original = HttpRequest.newBuilder(URI.create("https://example.com"))
                .header("authorization", "Basic dXNlcjpwYXNz")
                .header("X-Custom", "kept")
                .build();

        HttpRequest authorized = auth.authorize(RequestContext.background(), original);

        assertThat(authorized.headers().allValues("Authorization")).containsExactly("Bearer fresh");
        assertThat(authorized.headers().firstValue("X-Custom")).hasValue("kept");
    }

    @Test
    void authorize_withAllowedEndpoint_addsToken() throws Exception {
        when(provider.getAccessToken(any(RequestContext.class), anyList())).thenReturn("abc");
        EndpointAllowlist allowlist = EndpointAllowlist.compile(List.of("https://*.azure.com"));
        AzureAuthentication auth = new AzureAuthentication(provider, SCOPES, allowlist);

        HttpRequest authorized = auth.authorize(RequestContext.background(),
                request("https://management.azure.com/"));

        assertThat(authorized.headers().firstValue("Authorization")).hasValue("Bearer abc");
    }

    @Test
    void authorize_withDisallowedEndpoint_throwsWithoutFetchingToken() throws Exception {
        EndpointAllowlist allowlist = EndpointAllowlist.compile(List.of("https://*.azure.com"));
        AzureAuthentication auth = new AzureAuthentication(provider, SCOPES, allowlist);

        assertThatThrownBy(() -> auth.authorize(RequestContext.background(), request("https://evil.example.com/")))
                .isInstanceOf(EndpointNotAllowedException.class)
                .hasMessageContaining("https://evil.example.com");
        verifyNoInteractions(provider);
    }

    @Test
    void authorize_whenTokenUnavailable_propagatesError() throws Exception {
        TokenRequestException failure = new TokenRequestException("request failed with status 401", 401);
        when(provider.getAccessToken(any(RequestContext.class), anyList())).thenThrow(failure);
        AzureAuthentication auth = new AzureAuthentication(provider, SCOPES, null);

        assertThatThrownBy(() -> auth.authorize(RequestContext.background(), request("https://example.com")))
                .isSameAs(failure);
    }

    @Test
    void authorize_passesContextToProvider() throws Exception {
        RequestContext ctx = RequestContext.background().withTenantScope("org-7");
        when(provider.getAccessToken(ctx, SCOPES)).thenReturn("scoped");
        AzureAuthentication auth = new AzureAuthentication(provider, SCOPES, null);

        HttpRequest authorized = auth.authorize(ctx, request("https://example.com"));

        assertThat(authorized.headers().firstValue("Authorization")).hasValue("Bearer scoped");
    }
}
