package io.github.azauth;

/**
 * Thrown when an endpoint allowlist pattern cannot be compiled.
 */
public class AllowlistCompileException extends AzureAuthException {

    private final String pattern;

    public AllowlistCompileException(String pattern, String reason) {
        super("invalid allow endpoint '" + pattern + "': " + reason);
        this.pattern = pattern;
    }

    public AllowlistCompileException(String pattern, String reason, Throwable cause) {
        super("invalid allow endpoint '" + pattern + "': " + reason, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
