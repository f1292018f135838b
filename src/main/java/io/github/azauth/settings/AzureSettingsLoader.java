package io.github.azauth.settings;

import io.github.azauth.ConfigurationException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link AzureSettings} from host configuration.
 *
 * <p>Each value is resolved in order: explicit parameter, environment variable, legacy
 * environment variable (where one exists), default value.
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@code azure-cloud} / {@code GFAZPL_AZURE_CLOUD} - default cloud name</li>
 *   <li>{@code managed-identity-enabled} / {@code GFAZPL_MANAGED_IDENTITY_ENABLED}</li>
 *   <li>{@code managed-identity-client-id} / {@code GFAZPL_MANAGED_IDENTITY_CLIENT_ID}</li>
 *   <li>{@code workload-identity-enabled} / {@code GFAZPL_WORKLOAD_IDENTITY_ENABLED}</li>
 *   <li>{@code workload-identity-tenant-id}, {@code workload-identity-client-id},
 *       {@code workload-identity-token-file}</li>
 *   <li>{@code user-identity-enabled} / {@code GFAZPL_USER_IDENTITY_ENABLED}</li>
 *   <li>{@code user-identity-token-url}, {@code user-identity-client-id} - required with user identity</li>
 *   <li>{@code user-identity-client-secret}, {@code user-identity-assertion} ({@code username})</li>
 *   <li>{@code user-identity-fallback-credentials-enabled}</li>
 *   <li>{@code custom-clouds} / {@code GFAZPL_AZURE_CLOUDS_CONFIG} - JSON list of custom clouds</li>
 * </ul>
 */
public final class AzureSettingsLoader {

    private static final Logger logger = LoggerFactory.getLogger(AzureSettingsLoader.class);

    // Environment variable names
    static final String ENV_AZURE_CLOUD = "GFAZPL_AZURE_CLOUD";
    static final String ENV_MANAGED_IDENTITY_ENABLED = "GFAZPL_MANAGED_IDENTITY_ENABLED";
    static final String ENV_MANAGED_IDENTITY_CLIENT_ID = "GFAZPL_MANAGED_IDENTITY_CLIENT_ID";
    static final String ENV_WORKLOAD_IDENTITY_ENABLED = "GFAZPL_WORKLOAD_IDENTITY_ENABLED";
    static final String ENV_WORKLOAD_IDENTITY_TENANT_ID = "GFAZPL_WORKLOAD_IDENTITY_TENANT_ID";
    static final String ENV_WORKLOAD_IDENTITY_CLIENT_ID = "GFAZPL_WORKLOAD_IDENTITY_CLIENT_ID";
    static final String ENV_WORKLOAD_IDENTITY_TOKEN_FILE = "GFAZPL_WORKLOAD_IDENTITY_TOKEN_FILE";
    static final String ENV_USER_IDENTITY_ENABLED = "GFAZPL_USER_IDENTITY_ENABLED";
    static final String ENV_USER_IDENTITY_TOKEN_URL = "GFAZPL_USER_IDENTITY_TOKEN_URL";
    static final String ENV_USER_IDENTITY_CLIENT_ID = "GFAZPL_USER_IDENTITY_CLIENT_ID";
    static final String ENV_USER_IDENTITY_CLIENT_SECRET = "GFAZPL_USER_IDENTITY_CLIENT_SECRET";
    static final String ENV_USER_IDENTITY_ASSERTION = "GFAZPL_USER_IDENTITY_ASSERTION";
    static final String ENV_USER_IDENTITY_FALLBACK_ENABLED =
            "GFAZPL_USER_IDENTITY_FALLBACK_SERVICE_CREDENTIALS_ENABLED";
    static final String ENV_CUSTOM_CLOUDS = "GFAZPL_AZURE_CLOUDS_CONFIG";

    // Pre-9.x variable names
    private static final String LEGACY_AZURE_CLOUD = "AZURE_CLOUD";
    private static final String LEGACY_MANAGED_IDENTITY_ENABLED = "AZURE_MANAGED_IDENTITY_ENABLED";
    private static final String LEGACY_MANAGED_IDENTITY_CLIENT_ID = "AZURE_MANAGED_IDENTITY_CLIENT_ID";

    // Parameter names
    public static final String PARAM_AZURE_CLOUD = "azure-cloud";
    public static final String PARAM_MANAGED_IDENTITY_ENABLED = "managed-identity-enabled";
    public static final String PARAM_MANAGED_IDENTITY_CLIENT_ID = "managed-identity-client-id";
    public static final String PARAM_WORKLOAD_IDENTITY_ENABLED = "workload-identity-enabled";
    public static final String PARAM_WORKLOAD_IDENTITY_TENANT_ID = "workload-identity-tenant-id";
    public static final String PARAM_WORKLOAD_IDENTITY_CLIENT_ID = "workload-identity-client-id";
    public static final String PARAM_WORKLOAD_IDENTITY_TOKEN_FILE = "workload-identity-token-file";
    public static final String PARAM_USER_IDENTITY_ENABLED = "user-identity-enabled";
    public static final String PARAM_USER_IDENTITY_TOKEN_URL = "user-identity-token-url";
    public static final String PARAM_USER_IDENTITY_CLIENT_ID = "user-identity-client-id";
    public static final String PARAM_USER_IDENTITY_CLIENT_SECRET = "user-identity-client-secret";
    public static final String PARAM_USER_IDENTITY_ASSERTION = "user-identity-assertion";
    public static final String PARAM_USER_IDENTITY_FALLBACK_ENABLED = "user-identity-fallback-credentials-enabled";
    public static final String PARAM_CUSTOM_CLOUDS = "custom-clouds";

    private static final String USERNAME_ASSERTION = "username";

    private final Function<String, String> environment;

    /**
     * Creates a loader reading the process environment.
     */
    public AzureSettingsLoader() {
        this(System::getenv);
    }

    /**
     * Creates a loader with a custom environment lookup (for testing).
     *
     * @param environment maps variable names to values, returning null when unset
     */
    public AzureSettingsLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings from the environment only.
     *
     * @return the settings
     * @throws ConfigurationException if a value is malformed or a required value is missing
     */
    public AzureSettings load() throws ConfigurationException {
        return load(Map.of());
    }

    /**
     * Loads settings, letting explicit parameters override the environment.
     *
     * @param params configuration parameters
     * @return the settings
     * @throws ConfigurationException if a value is malformed or a required value is missing
     */
    public AzureSettings load(Map<String, String> params) throws ConfigurationException {
        AzureSettings.Builder builder = AzureSettings.builder();

        String cloud = getConfig(params, PARAM_AZURE_CLOUD, ENV_AZURE_CLOUD, LEGACY_AZURE_CLOUD, AzureClouds.AZURE_PUBLIC);
        builder.cloud(cloud);

        // Managed identity
        if (getBool(params, PARAM_MANAGED_IDENTITY_ENABLED, ENV_MANAGED_IDENTITY_ENABLED,
                LEGACY_MANAGED_IDENTITY_ENABLED)) {
            builder.managedIdentity(true, getConfig(params, PARAM_MANAGED_IDENTITY_CLIENT_ID,
                    ENV_MANAGED_IDENTITY_CLIENT_ID, LEGACY_MANAGED_IDENTITY_CLIENT_ID, null));
        }

        // Workload identity
        if (getBool(params, PARAM_WORKLOAD_IDENTITY_ENABLED, ENV_WORKLOAD_IDENTITY_ENABLED, null)) {
            builder.workloadIdentity(true, new WorkloadIdentitySettings(
                    getConfig(params, PARAM_WORKLOAD_IDENTITY_TENANT_ID, ENV_WORKLOAD_IDENTITY_TENANT_ID, null, null),
                    getConfig(params, PARAM_WORKLOAD_IDENTITY_CLIENT_ID, ENV_WORKLOAD_IDENTITY_CLIENT_ID, null, null),
                    getConfig(params, PARAM_WORKLOAD_IDENTITY_TOKEN_FILE, ENV_WORKLOAD_IDENTITY_TOKEN_FILE, null, null)));
        }

        // User identity
        if (getBool(params, PARAM_USER_IDENTITY_ENABLED, ENV_USER_IDENTITY_ENABLED, null)) {
            String tokenUrl = getConfig(params, PARAM_USER_IDENTITY_TOKEN_URL, ENV_USER_IDENTITY_TOKEN_URL, null, null);
            if (tokenUrl == null) {
                throw new ConfigurationException(
                        "token URL must be set when user identity authentication enabled. Set "
                                + ENV_USER_IDENTITY_TOKEN_URL + " environment variable or "
                                + PARAM_USER_IDENTITY_TOKEN_URL + " parameter.");
            }
            String clientId = getConfig(params, PARAM_USER_IDENTITY_CLIENT_ID, ENV_USER_IDENTITY_CLIENT_ID, null, null);
            if (clientId == null) {
                throw new ConfigurationException(
                        "client ID must be set when user identity authentication enabled. Set "
                                + ENV_USER_IDENTITY_CLIENT_ID + " environment variable or "
                                + PARAM_USER_IDENTITY_CLIENT_ID + " parameter.");
            }
            String clientSecret = getConfig(params, PARAM_USER_IDENTITY_CLIENT_SECRET,
                    ENV_USER_IDENTITY_CLIENT_SECRET, null, "");
            String assertion = getConfig(params, PARAM_USER_IDENTITY_ASSERTION, ENV_USER_IDENTITY_ASSERTION, null, "");

            builder.userIdentity(true, new TokenEndpointSettings(tokenUrl, clientId, clientSecret,
                    USERNAME_ASSERTION.equals(assertion)));
            builder.userIdentityFallbackCredentialsEnabled(getBool(params, PARAM_USER_IDENTITY_FALLBACK_ENABLED,
                    ENV_USER_IDENTITY_FALLBACK_ENABLED, null));
        }

        // Custom clouds
        String customClouds = getConfig(params, PARAM_CUSTOM_CLOUDS, ENV_CUSTOM_CLOUDS, null, null);
        if (customClouds != null) {
            try {
                List<AzureCloudSettings> clouds = AzureClouds.parseCustomClouds(customClouds);
                builder.customClouds(clouds);
                logger.debug("Loaded {} custom Azure clouds", clouds.size());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("invalid Azure configuration: " + e.getMessage(), e);
            }
        }

        AzureSettings settings = builder.build();
        logger.info("Azure settings loaded: {}", settings);
        return settings;
    }

    private boolean getBool(Map<String, String> params, String paramName, String envName, String legacyEnvName)
            throws ConfigurationException {
        String value = getConfig(params, paramName, envName, legacyEnvName, "false");
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
                return true;
            case "false":
            case "0":
                return false;
            default:
                throw new ConfigurationException(
                        "invalid Azure configuration: '" + value + "' is not a valid boolean for " + paramName);
        }
    }

    /**
     * Get configuration value with resolution order: param, env, legacy env, default.
     */
    private String getConfig(Map<String, String> params, String paramName, String envName,
                             String legacyEnvName, String defaultValue) {
        String value = params.get(paramName);
        if (value != null && !value.isBlank()) {
            return value;
        }

        if (envName != null) {
            value = environment.apply(envName);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }

        if (legacyEnvName != null) {
            value = environment.apply(legacyEnvName);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }

        return defaultValue;
    }
}
