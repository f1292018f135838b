package io.github.azauth.usercontext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RequestContext and CurrentUserContext.
 */
class RequestContextTest {

    @Test
    void background_hasNoUserScopeOrTimeout() {
        RequestContext ctx = RequestContext.background();

        assertThat(ctx.getCurrentUser()).isNull();
        assertThat(ctx.getTenantScope()).isEmpty();
        assertThat(ctx.getTimeout()).isNull();
    }

    @Test
    void withMethods_returnCopiesLeavingOriginalUnchanged() {
        RequestContext base = RequestContext.background();
        CurrentUserContext user = CurrentUserContext.of("alice", "id-token");

        RequestContext ctx = base.withCurrentUser(user).withTenantScope("tenant-a").withTimeout(Duration.ofSeconds(5));

        assertThat(ctx.getCurrentUser()).isSameAs(user);
        assertThat(ctx.getTenantScope()).isEqualTo("tenant-a");
        assertThat(ctx.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(base.getCurrentUser()).isNull();
    }

    @Test
    void withTimeout_withZero_throwsIllegalArgument() {
        assertThatThrownBy(() -> RequestContext.background().withTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void currentUser_withNullLogin_hasNoUser() {
        assertThat(new CurrentUserContext(null, null, null).hasUser()).isFalse();
        assertThat(CurrentUserContext.of("", null).hasUser()).isTrue();
    }

    @Test
    void currentUser_toString_masksTokens() {
        CurrentUserContext user = new CurrentUserContext("alice", "secret-id-token", "secret-access-token");

        assertThat(user.toString())
                .contains("alice")
                .doesNotContain("secret-id-token")
                .doesNotContain("secret-access-token");
    }
}
