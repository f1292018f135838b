package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.TokenRequestCancelledException;
import io.github.azauth.TokenRequestException;
import io.github.azauth.util.JsonUtil;
import io.github.azauth.util.Preconditions;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TokenClient} over {@link HttpClient}.
 *
 * <p>Each grant is a form-encoded POST carrying {@code client_id}, {@code client_secret}
 * and a space-separated {@code scope}. The endpoint must answer 200 with a JSON body
 * containing {@code access_token}; {@code expires_in} is optional.
 *
 * <p>The client is designed to be injectable/mockable for unit testing.
 */
public class HttpTokenClient implements TokenClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpTokenClient.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String CONTENT_TYPE_FORM = "application/x-www-form-urlencoded; charset=utf-8";
    private static final String CONTENT_TYPE_JSON = "application/json";

    private static final String GRANT_CLIENT_CREDENTIALS = "client_credentials";
    private static final String GRANT_REFRESH_TOKEN = "refresh_token";
    private static final String GRANT_JWT_BEARER = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    private static final String GRANT_USERNAME = "username";

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String clientId;
    private final String clientSecret;
    private final Duration requestTimeout;
    private final Clock clock;

    /**
     * Creates a token client with default HTTP settings.
     *
     * @param endpointUrl  the token endpoint URL
     * @param clientId     the client ID
     * @param clientSecret the client secret, may be empty
     */
    public HttpTokenClient(String endpointUrl, String clientId, String clientSecret) {
        this(HttpClient.newBuilder()
                        .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                endpointUrl, clientId, clientSecret, DEFAULT_REQUEST_TIMEOUT, Clock.systemUTC());
    }

    /**
     * Creates a token client with an injected HttpClient (for testing).
     *
     * @param httpClient     the HTTP client to use
     * @param endpointUrl    the token endpoint URL
     * @param clientId       the client ID
     * @param clientSecret   the client secret, may be empty
     * @param requestTimeout timeout for individual requests
     * @param clock          clock used to turn {@code expires_in} into an instant
     */
    public HttpTokenClient(HttpClient httpClient, String endpointUrl, String clientId, String clientSecret,
                           Duration requestTimeout, Clock clock) {
        this.httpClient = Preconditions.requireNonNull(httpClient, "httpClient");
        this.endpoint = URI.create(Preconditions.requireNonBlank(endpointUrl, "endpointUrl"));
        this.clientId = Preconditions.requireNonBlank(clientId, "clientId");
        this.clientSecret = clientSecret != null ? clientSecret : "";
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public String getCacheKey() {
        return endpoint + "|" + clientId + "|" + SecretHash.sha256(clientSecret);
    }

    @Override
    public AccessToken fromClientSecret(List<String> scopes) throws AzureAuthException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", GRANT_CLIENT_CREDENTIALS);
        return requestToken(form, scopes);
    }

    @Override
    public AccessToken fromRefreshToken(String refreshToken, List<String> scopes) throws AzureAuthException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", GRANT_REFRESH_TOKEN);
        form.put("refresh_token", refreshToken);
        return requestToken(form, scopes);
    }

    @Override
    public AccessToken onBehalfOf(String idToken, List<String> scopes) throws AzureAuthException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", GRANT_JWT_BEARER);
        form.put("assertion", idToken);
        form.put("requested_token_use", "on_behalf_of");
        return requestToken(form, scopes);
    }

    @Override
    public AccessToken fromUsername(String username, List<String> scopes) throws AzureAuthException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", GRANT_USERNAME);
        form.put("username", username);
        return requestToken(form, scopes);
    }

    private AccessToken requestToken(Map<String, String> form, List<String> scopes) throws AzureAuthException {
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("scope", joinScopes(scopes));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", CONTENT_TYPE_FORM)
                .header("Accept", CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                .build();

        // The form carries secrets; only the grant type is logged
        logger.debug("Token request: grant_type={} to {}", form.get("grant_type"), endpoint);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TokenRequestException("failed to request token: " + e.getMessage(), 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenRequestCancelledException("token request interrupted", e);
        }

        int status = response.statusCode();
        String contentType = mediaType(response.headers().firstValue("Content-Type").orElse(null));
        logger.debug("Token response: {} ({})", status, contentType);

        if (status != 200) {
            throw TokenRequestException.fromResponse(status, contentType, response.body());
        }
        if (!CONTENT_TYPE_JSON.equals(contentType)) {
            throw new TokenRequestException(
                    "failed to request token: invalid response content-type '" + contentType + "'", status);
        }

        Map<String, Object> body;
        try {
            body = JsonUtil.parseObject(response.body());
        } catch (IllegalArgumentException e) {
            throw new TokenRequestException("failed to request token: unable to read response: " + e.getMessage(),
                    status, e);
        }
        return parseAccessToken(body, status);
    }

    private AccessToken parseAccessToken(Map<String, Object> body, int status) throws TokenRequestException {
        String accessToken = JsonUtil.getString(body, "access_token");
        if (accessToken == null || accessToken.isEmpty()) {
            throw new TokenRequestException(
                    "failed to request token: token response doesn't contain 'access_token' field", status);
        }
        Long expiresIn = JsonUtil.getLong(body, "expires_in");
        Instant expiresOn = expiresIn != null && expiresIn > 0
                ? clock.instant().plusSeconds(expiresIn)
                : null;
        return new AccessToken(accessToken, expiresOn);
    }

    static String joinScopes(List<String> scopes) {
        List<String> sanitized = new ArrayList<>();
        if (scopes != null) {
            for (String scope : scopes) {
                if (scope != null && !scope.isBlank()) {
                    sanitized.add(scope.trim());
                }
            }
        }
        return String.join(" ", sanitized);
    }

    static String encodeForm(Map<String, String> form) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : form.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(e.getValue() != null ? e.getValue() : "", StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * Strips parameters from a Content-Type header value.
     */
    static String mediaType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semi = contentType.indexOf(';');
        String type = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
