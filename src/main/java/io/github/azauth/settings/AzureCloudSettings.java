package io.github.azauth.settings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata of an Azure cloud: the AAD authority and the resource endpoints of its services.
 */
public final class AzureCloudSettings {

    private final String name;
    private final String displayName;
    private final String aadAuthority;
    private final Map<String, String> properties;

    public AzureCloudSettings(String name, String displayName, String aadAuthority, Map<String, String> properties) {
        this.name = name;
        this.displayName = displayName;
        this.aadAuthority = aadAuthority;
        this.properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Authority host used for token requests, e.g. {@code https://login.microsoftonline.com/}. */
    public String getAadAuthority() {
        return aadAuthority;
    }

    /** Resource endpoints keyed by service, e.g. {@code resourceManager}. */
    public Map<String, String> getProperties() {
        return properties;
    }

    @Override
    public String toString() {
        return "AzureCloudSettings{name=" + name + ", aadAuthority=" + aadAuthority + "}";
    }
}
