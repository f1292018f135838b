package io.github.azauth.settings;

import io.github.azauth.util.JsonUtil;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in Azure clouds and helpers for cloud names.
 */
public final class AzureClouds {

    public static final String AZURE_PUBLIC = "AzureCloud";
    public static final String AZURE_CHINA = "AzureChinaCloud";
    public static final String AZURE_US_GOVERNMENT = "AzureUSGovernment";

    private static final List<AzureCloudSettings> PREDEFINED = List.of(
            new AzureCloudSettings(AZURE_PUBLIC, "Azure", "https://login.microsoftonline.com/", Map.of(
                    "azureDataExplorerSuffix", ".kusto.windows.net",
                    "logAnalytics", "https://api.loganalytics.io",
                    "portal", "https://portal.azure.com",
                    "prometheusResourceId", "https://prometheus.monitor.azure.com",
                    "resourceManager", "https://management.azure.com")),
            new AzureCloudSettings(AZURE_CHINA, "Azure China", "https://login.chinacloudapi.cn/", Map.of(
                    "azureDataExplorerSuffix", ".kusto.chinacloudapi.cn",
                    "logAnalytics", "https://api.loganalytics.azure.cn",
                    "portal", "https://portal.azure.cn",
                    "prometheusResourceId", "https://prometheus.monitor.azure.cn",
                    "resourceManager", "https://management.chinacloudapi.cn")),
            new AzureCloudSettings(AZURE_US_GOVERNMENT, "Azure US Government", "https://login.microsoftonline.us/",
                    Map.of(
                            "azureDataExplorerSuffix", ".kusto.usgovcloudapi.net",
                            "logAnalytics", "https://api.loganalytics.us",
                            "portal", "https://portal.azure.us",
                            "prometheusResourceId", "https://prometheus.monitor.azure.us",
                            "resourceManager", "https://management.usgovcloudapi.net")));

    private AzureClouds() {
        // Utility class
    }

    /**
     * Returns the clouds known without any custom configuration.
     */
    public static List<AzureCloudSettings> predefined() {
        return PREDEFINED;
    }

    /**
     * Maps common aliases to the canonical cloud name. Unknown names are returned unchanged.
     *
     * @param cloudName the name to normalize, may be null
     * @return the canonical name
     */
    public static String normalize(String cloudName) {
        if (cloudName == null) {
            return null;
        }
        switch (cloudName.toLowerCase(Locale.ROOT)) {
            case "azurecloud":
            case "azurepublic":
            case "azurepubliccloud":
            case "public":
                return AZURE_PUBLIC;
            case "azurechina":
            case "azurechinacloud":
            case "china":
                return AZURE_CHINA;
            case "azureusgovernment":
            case "azureusgovernmentcloud":
            case "usgov":
            case "usgovernment":
                return AZURE_US_GOVERNMENT;
            default:
                return cloudName;
        }
    }

    /**
     * Parses a JSON list of custom clouds.
     *
     * <pre>{@code
     * [{"name": "MyCloud", "displayName": "My Cloud",
     *   "aadAuthority": "https://login.mycloud.example/",
     *   "properties": {"resourceManager": "https://management.mycloud.example"}}]
     * }</pre>
     *
     * @param json the JSON text
     * @return the parsed clouds
     * @throws IllegalArgumentException if the JSON is malformed or an entry has no name or authority
     */
    @SuppressWarnings("unchecked")
    public static List<AzureCloudSettings> parseCustomClouds(String json) {
        List<AzureCloudSettings> clouds = new ArrayList<>();
        for (Object item : JsonUtil.parseArray(json)) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("custom cloud entries must be JSON objects");
            }
            Map<String, Object> obj = (Map<String, Object>) item;
            String name = JsonUtil.getString(obj, "name");
            String authority = JsonUtil.getString(obj, "aadAuthority");
            if (name == null || name.isBlank() || authority == null || authority.isBlank()) {
                throw new IllegalArgumentException("custom cloud entries require 'name' and 'aadAuthority'");
            }

            Map<String, String> properties = new LinkedHashMap<>();
            Object props = obj.get("properties");
            if (props instanceof Map) {
                for (Map.Entry<String, Object> e : ((Map<String, Object>) props).entrySet()) {
                    if (e.getValue() != null) {
                        properties.put(e.getKey(), e.getValue().toString());
                    }
                }
            }
            clouds.add(new AzureCloudSettings(name, JsonUtil.getString(obj, "displayName"), authority, properties));
        }
        return clouds;
    }
}
