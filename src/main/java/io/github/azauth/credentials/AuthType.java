package io.github.azauth.credentials;

/**
 * Discriminants of the built-in Azure credential types.
 *
 * <p>The string values are the {@code authType} names used in datasource configuration
 * and as keys for custom token provider registration.
 *
 * @see AzureCredentials#getAzureAuthType()
 */
public enum AuthType {

    /**
     * Delegates to the signed-in end user (on-behalf-of or username assertion).
     */
    CURRENT_USER("currentuser"),

    /**
     * Platform managed identity of the host.
     */
    MANAGED_IDENTITY("msi"),

    /**
     * Federated workload identity (service account token exchanged for an AAD token).
     */
    WORKLOAD_IDENTITY("workloadidentity"),

    /**
     * App registration with a client secret.
     */
    CLIENT_SECRET("clientsecret"),

    /**
     * App registration with a client secret, exchanging user assertions on-behalf-of the user.
     */
    CLIENT_SECRET_OBO("clientsecret-obo"),

    /**
     * Resource owner password credentials of a directory user.
     */
    CLIENT_PASSWORD("ad-password");

    private final String value;

    AuthType(String value) {
        this.value = value;
    }

    /**
     * Returns the string value used in configuration.
     *
     * @return the configuration value (e.g., "msi", "clientsecret")
     */
    public String getValue() {
        return value;
    }

    /**
     * Finds the built-in type for a configuration value.
     *
     * @param value the configuration value (case-sensitive)
     * @return the matching type, or null if the value names no built-in type
     */
    public static AuthType lookup(String value) {
        if (value == null) {
            return null;
        }
        for (AuthType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
