package io.github.azauth.credentials;

import io.github.azauth.ConfigurationException;
import io.github.azauth.UnsupportedCredentialException;
import java.util.Map;

/**
 * Builds {@link AzureCredentials} from datasource configuration.
 *
 * <p>The non-secret part lives in the datasource JSON data under {@code azureCredentials}:
 * <pre>{@code
 * {
 *   "azureCredentials": {
 *     "authType": "clientsecret",
 *     "azureCloud": "AzureCloud",
 *     "tenantId": "...",
 *     "clientId": "..."
 *   }
 * }
 * }</pre>
 * Secrets come from the separate secure data map ({@code azureClientSecret},
 * {@code password}).
 */
public final class AzureCredentialsParser {

    private static final String KEY_CREDENTIALS = "azureCredentials";
    private static final String KEY_SECRET = "azureClientSecret";
    private static final String KEY_PASSWORD = "password";

    private AzureCredentialsParser() {
        // Utility class
    }

    /**
     * Reads credentials from datasource data.
     *
     * @param data       the datasource JSON data
     * @param secureData the decrypted secure data
     * @return the credentials, or null if the datasource has no {@code azureCredentials}
     * @throws ConfigurationException          if a field has the wrong type or is missing
     * @throws UnsupportedCredentialException if the auth type is unknown
     */
    public static AzureCredentials fromDatasourceData(Map<String, Object> data, Map<String, String> secureData)
            throws ConfigurationException, UnsupportedCredentialException {
        Map<String, Object> credentialsObj = getMapOptional(data, KEY_CREDENTIALS);
        if (credentialsObj == null) {
            return null;
        }
        return fromCredentialsObject(credentialsObj, secureData != null ? secureData : Map.of(), false);
    }

    private static AzureCredentials fromCredentialsObject(Map<String, Object> obj, Map<String, String> secureData,
                                                          boolean nested)
            throws ConfigurationException, UnsupportedCredentialException {
        String authType = getString(obj, "authType");
        AuthType type = AuthType.lookup(authType);
        if (type == null) {
            throw new UnsupportedCredentialException(authType,
                    "the authentication type '" + authType + "' not supported");
        }

        switch (type) {
            case CURRENT_USER:
                if (nested) {
                    // No further nesting; rejected later as fallback credentials
                    return new CurrentUserCredentials();
                }
                boolean serviceEnabled = getBoolOptional(obj, "serviceCredentialsEnabled");
                Map<String, Object> serviceObj = getMapOptional(obj, "serviceCredentials");
                AzureCredentials serviceCredentials = serviceObj != null
                        ? fromCredentialsObject(serviceObj, secureData, true)
                        : null;
                return new CurrentUserCredentials(serviceEnabled, serviceCredentials);

            case MANAGED_IDENTITY:
                return new ManagedIdentityCredentials(getStringOptional(obj, "clientId"));

            case WORKLOAD_IDENTITY:
                return new WorkloadIdentityCredentials(
                        getStringOptional(obj, "tenantId"), getStringOptional(obj, "clientId"));

            case CLIENT_SECRET:
                return clientSecret(obj, secureData);

            case CLIENT_SECRET_OBO:
                return new ClientSecretOboCredentials(clientSecret(obj, secureData));

            case CLIENT_PASSWORD:
                return new ClientPasswordCredentials(
                        getString(obj, "tenantId"),
                        getString(obj, "clientId"),
                        getString(obj, "userId"),
                        secureData.get(KEY_PASSWORD));

            default:
                throw new UnsupportedCredentialException(authType);
        }
    }

    private static ClientSecretCredentials clientSecret(Map<String, Object> obj, Map<String, String> secureData)
            throws ConfigurationException {
        return new ClientSecretCredentials(
                getString(obj, "azureCloud"),
                getStringOptional(obj, "authority"),
                getString(obj, "tenantId"),
                getString(obj, "clientId"),
                secureData.get(KEY_SECRET));
    }

    private static String getString(Map<String, Object> obj, String key) throws ConfigurationException {
        Object value = obj.get(key);
        if (!(value instanceof String)) {
            throw new ConfigurationException("the field '" + key + "' should be a string");
        }
        return (String) value;
    }

    private static String getStringOptional(Map<String, Object> obj, String key) throws ConfigurationException {
        Object value = obj.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new ConfigurationException("the field '" + key + "' should be a string");
        }
        String s = (String) value;
        return s.isEmpty() ? null : s;
    }

    private static boolean getBoolOptional(Map<String, Object> obj, String key) throws ConfigurationException {
        Object value = obj.get(key);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            throw new ConfigurationException("the field '" + key + "' should be a boolean");
        }
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMapOptional(Map<String, Object> obj, String key)
            throws ConfigurationException {
        if (obj == null) {
            return null;
        }
        Object value = obj.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("the field '" + key + "' should be an object");
        }
        return (Map<String, Object>) value;
    }
}
