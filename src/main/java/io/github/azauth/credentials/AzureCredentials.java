package io.github.azauth.credentials;

/**
 * Describes how outbound calls authenticate against Azure AD.
 *
 * <p>Instances are immutable value objects. The built-in subclasses cover the
 * {@link AuthType} variants; hosts may subclass this type for custom credentials
 * and register a matching token provider factory under the same auth type name.
 */
public abstract class AzureCredentials {

    /**
     * Returns the discriminant of this credential.
     *
     * @return the auth type name, never null
     */
    public abstract String getAzureAuthType();

    /**
     * Returns the built-in type of this credential.
     *
     * @return the type, or null for custom credentials
     */
    public AuthType getBuiltInType() {
        return AuthType.lookup(getAzureAuthType());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{authType=" + getAzureAuthType() + "}";
    }
}
