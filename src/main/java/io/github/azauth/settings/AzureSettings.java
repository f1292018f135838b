package io.github.azauth.settings;

import io.github.azauth.UnsupportedCloudException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host-level Azure authentication settings.
 *
 * <p>Settings gate which authentication mechanisms credentials may use. A mechanism's
 * values ({@link #getManagedIdentityClientId()}, {@link #getWorkloadIdentitySettings()},
 * {@link #getUserIdentityTokenEndpoint()}) are only meaningful when its enable flag is set.
 *
 * <p>Instances are immutable; create them with {@link #builder()} or
 * {@link AzureSettingsLoader}.
 */
public final class AzureSettings {

    private static final Logger logger = LoggerFactory.getLogger(AzureSettings.class);

    private final String cloud;
    private final boolean managedIdentityEnabled;
    private final String managedIdentityClientId;
    private final boolean workloadIdentityEnabled;
    private final WorkloadIdentitySettings workloadIdentitySettings;
    private final boolean userIdentityEnabled;
    private final TokenEndpointSettings userIdentityTokenEndpoint;
    private final boolean userIdentityFallbackCredentialsEnabled;
    private final List<AzureCloudSettings> customClouds;

    private AzureSettings(Builder builder) {
        this.cloud = builder.cloud;
        this.managedIdentityEnabled = builder.managedIdentityEnabled;
        this.managedIdentityClientId = builder.managedIdentityClientId;
        this.workloadIdentityEnabled = builder.workloadIdentityEnabled;
        this.workloadIdentitySettings = builder.workloadIdentitySettings;
        this.userIdentityEnabled = builder.userIdentityEnabled;
        this.userIdentityTokenEndpoint = builder.userIdentityTokenEndpoint;
        this.userIdentityFallbackCredentialsEnabled = builder.userIdentityFallbackCredentialsEnabled;
        this.customClouds = Collections.unmodifiableList(new ArrayList<>(builder.customClouds));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCloud() {
        return cloud;
    }

    /**
     * Returns the configured cloud, or the public cloud when none is configured.
     */
    public String getDefaultCloud() {
        return cloud == null || cloud.isBlank() ? AzureClouds.AZURE_PUBLIC : cloud;
    }

    public boolean isManagedIdentityEnabled() {
        return managedIdentityEnabled;
    }

    public String getManagedIdentityClientId() {
        return managedIdentityClientId;
    }

    public boolean isWorkloadIdentityEnabled() {
        return workloadIdentityEnabled;
    }

    public WorkloadIdentitySettings getWorkloadIdentitySettings() {
        return workloadIdentitySettings;
    }

    public boolean isUserIdentityEnabled() {
        return userIdentityEnabled;
    }

    public TokenEndpointSettings getUserIdentityTokenEndpoint() {
        return userIdentityTokenEndpoint;
    }

    public boolean isUserIdentityFallbackCredentialsEnabled() {
        return userIdentityFallbackCredentialsEnabled;
    }

    /**
     * Returns whether user identity requests assert the username instead of an ID token.
     */
    public boolean isUsernameAssertion() {
        return userIdentityTokenEndpoint != null && userIdentityTokenEndpoint.isUsernameAssertion();
    }

    public List<AzureCloudSettings> getCustomClouds() {
        return customClouds;
    }

    /**
     * Returns all clouds available on this host: the built-in clouds followed by custom ones.
     */
    public List<AzureCloudSettings> getClouds() {
        if (customClouds.isEmpty()) {
            return AzureClouds.predefined();
        }
        List<AzureCloudSettings> all = new ArrayList<>(AzureClouds.predefined());
        all.addAll(customClouds);
        return all;
    }

    /**
     * Looks up a cloud by name. Aliases of built-in clouds are accepted.
     *
     * @param cloudName the cloud name
     * @return the cloud
     * @throws UnsupportedCloudException if no cloud with this name is known
     */
    public AzureCloudSettings getCloud(String cloudName) throws UnsupportedCloudException {
        List<AzureCloudSettings> clouds = getClouds();
        for (AzureCloudSettings c : clouds) {
            if (c.getName().equals(cloudName)) {
                return c;
            }
        }
        String normalized = AzureClouds.normalize(cloudName);
        for (AzureCloudSettings c : clouds) {
            if (c.getName().equals(normalized)) {
                logger.warn("Azure cloud name '{}' is not canonical, using '{}'", cloudName, normalized);
                return c;
            }
        }
        throw new UnsupportedCloudException(cloudName);
    }

    @Override
    public String toString() {
        return "AzureSettings{" +
                "cloud=" + cloud +
                ", managedIdentityEnabled=" + managedIdentityEnabled +
                ", workloadIdentityEnabled=" + workloadIdentityEnabled +
                ", userIdentityEnabled=" + userIdentityEnabled +
                ", userIdentityFallbackCredentialsEnabled=" + userIdentityFallbackCredentialsEnabled +
                ", customClouds=" + customClouds.size() +
                '}';
    }

    /**
     * Builder for {@link AzureSettings}.
     */
    public static final class Builder {

        private String cloud;
        private boolean managedIdentityEnabled;
        private String managedIdentityClientId;
        private boolean workloadIdentityEnabled;
        private WorkloadIdentitySettings workloadIdentitySettings;
        private boolean userIdentityEnabled;
        private TokenEndpointSettings userIdentityTokenEndpoint;
        private boolean userIdentityFallbackCredentialsEnabled;
        private final List<AzureCloudSettings> customClouds = new ArrayList<>();

        private Builder() {
        }

        public Builder cloud(String cloud) {
            this.cloud = cloud;
            return this;
        }

        public Builder managedIdentity(boolean enabled, String clientId) {
            this.managedIdentityEnabled = enabled;
            this.managedIdentityClientId = clientId;
            return this;
        }

        public Builder workloadIdentity(boolean enabled, WorkloadIdentitySettings settings) {
            this.workloadIdentityEnabled = enabled;
            this.workloadIdentitySettings = settings;
            return this;
        }

        public Builder userIdentity(boolean enabled, TokenEndpointSettings tokenEndpoint) {
            this.userIdentityEnabled = enabled;
            this.userIdentityTokenEndpoint = tokenEndpoint;
            return this;
        }

        public Builder userIdentityFallbackCredentialsEnabled(boolean enabled) {
            this.userIdentityFallbackCredentialsEnabled = enabled;
            return this;
        }

        public Builder customClouds(List<AzureCloudSettings> clouds) {
            this.customClouds.clear();
            if (clouds != null) {
                this.customClouds.addAll(clouds);
            }
            return this;
        }

        public AzureSettings build() {
            return new AzureSettings(this);
        }
    }
}
