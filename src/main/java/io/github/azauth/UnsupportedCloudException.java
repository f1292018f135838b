package io.github.azauth;

/**
 * Thrown when a cloud name matches neither a built-in nor a custom cloud.
 */
public class UnsupportedCloudException extends AzureAuthException {

    private final String cloudName;

    public UnsupportedCloudException(String cloudName) {
        super("the Azure cloud '" + cloudName + "' is not supported");
        this.cloudName = cloudName;
    }

    public String getCloudName() {
        return cloudName;
    }
}
