package io.github.azauth.usercontext;

import io.github.azauth.util.Preconditions;
import java.time.Duration;

/**
 * Per-call context passed down to token providers.
 *
 * <p>Carries the optional end user of the inbound request, the tenant scope the request
 * belongs to, and an optional upper bound on how long a caller waits for a token that
 * another caller is already fetching. Instances are immutable; the {@code with*}
 * methods return copies.
 */
public final class RequestContext {

    private static final RequestContext BACKGROUND = new RequestContext(null, "", null);

    private final CurrentUserContext currentUser;
    private final String tenantScope;
    private final Duration timeout;

    private RequestContext(CurrentUserContext currentUser, String tenantScope, Duration timeout) {
        this.currentUser = currentUser;
        this.tenantScope = tenantScope;
        this.timeout = timeout;
    }

    /**
     * Returns a context with no user, an empty tenant scope and no wait timeout.
     */
    public static RequestContext background() {
        return BACKGROUND;
    }

    public RequestContext withCurrentUser(CurrentUserContext user) {
        return new RequestContext(user, tenantScope, timeout);
    }

    public RequestContext withTenantScope(String scope) {
        return new RequestContext(currentUser, scope != null ? scope : "", timeout);
    }

    /**
     * Returns a copy that gives up waiting for a token after the given duration.
     *
     * @param waitTimeout a positive duration
     * @return the new context
     */
    public RequestContext withTimeout(Duration waitTimeout) {
        Preconditions.requireNonNull(waitTimeout, "timeout");
        if (waitTimeout.isNegative() || waitTimeout.isZero()) {
            throw new IllegalArgumentException("parameter 'timeout' must be positive");
        }
        return new RequestContext(currentUser, tenantScope, waitTimeout);
    }

    /**
     * Returns the end user of the request, or null for backend-initiated calls.
     */
    public CurrentUserContext getCurrentUser() {
        return currentUser;
    }

    public String getTenantScope() {
        return tenantScope;
    }

    /**
     * Returns the wait timeout, or null to wait until the token arrives or the thread is interrupted.
     */
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "RequestContext{" +
                "currentUser=" + currentUser +
                ", tenantScope='" + tenantScope + '\'' +
                ", timeout=" + timeout +
                '}';
    }
}
