package io.github.azauth.tokenprovider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.azauth.AzureAuthException;
import io.github.azauth.TokenRequestCancelledException;
import io.github.azauth.TokenRequestException;
import io.github.azauth.usercontext.RequestContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ConcurrentTokenCache.
 */
class ConcurrentTokenCacheTest {

    private static final List<String> SCOPES = List.of("https://management.azure.com/.default");

    private MutableClock clock;
    private ConcurrentTokenCache cache;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        callers = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        if (cache != null) {
            cache.close();
        }
    }

    private ConcurrentTokenCache directCache() {
        return ConcurrentTokenCache.builder().clock(clock).executor(Runnable::run).build();
    }

    // --- Freshness ---

    @Test
    void getAccessToken_withValidCachedToken_doesNotCallRetrieverAgain() throws Exception {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T1", Duration.ofHours(1)));

        String first = cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        String second = cache.getAccessToken(RequestContext.background(), retriever, SCOPES);

        assertThat(first).isEqualTo("T1");
        assertThat(second).isEqualTo("T1");
        assertThat(retriever.calls.get()).isEqualTo(1);
    }

    @Test
    void getAccessToken_withinSafetyMargin_refreshesOnce() throws Exception {
        cache = directCache();
        AtomicInteger n = new AtomicInteger();
        FakeRetriever retriever = new FakeRetriever("key",
                () -> token("T" + n.incrementAndGet(), Duration.ofMinutes(10)));

        assertThat(cache.getAccessToken(RequestContext.background(), retriever, SCOPES)).isEqualTo("T1");

        // Default margin is 2 minutes: still valid at 7:59
        clock.advance(Duration.ofMinutes(7).plusSeconds(59));
        assertThat(cache.getAccessToken(RequestContext.background(), retriever, SCOPES)).isEqualTo("T1");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.getAccessToken(RequestContext.background(), retriever, SCOPES)).isEqualTo("T2");
        assertThat(cache.getAccessToken(RequestContext.background(), retriever, SCOPES)).isEqualTo("T2");
        assertThat(retriever.calls.get()).isEqualTo(2);
    }

    @Test
    void getAccessToken_withCustomSafetyMargin_usesMargin() throws Exception {
        cache = ConcurrentTokenCache.builder()
                .clock(clock)
                .executor(Runnable::run)
                .safetyMargin(Duration.ofSeconds(30))
                .build();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofMinutes(10)));

        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        clock.advance(Duration.ofMinutes(9));
        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);

        assertThat(retriever.calls.get()).isEqualTo(1);
    }

    @Test
    void getAccessToken_withUnknownExpiry_cachesForMinimumLifetime() throws Exception {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> new AccessToken("T", null));

        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        clock.advance(Duration.ofSeconds(59));
        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        assertThat(retriever.calls.get()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(2));
        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        assertThat(retriever.calls.get()).isEqualTo(2);
    }

    @Test
    void getAccessToken_withRetrieverExpiryCeiling_refreshesAtCeiling() throws Exception {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofHours(1)));
        retriever.expiry = clock.instant().plusSeconds(30);

        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        clock.advance(Duration.ofSeconds(29));
        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        assertThat(retriever.calls.get()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(2));
        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        assertThat(retriever.calls.get()).isEqualTo(2);
    }

    @Test
    void getAccessToken_callsInitBeforeEachAcquisition() throws Exception {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofMinutes(3)));

        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
        clock.advance(Duration.ofMinutes(2));
        cache.getAccessToken(RequestContext.background(), retriever, SCOPES);

        assertThat(retriever.inits.get()).isEqualTo(2);
        assertThat(retriever.calls.get()).isEqualTo(2);
    }

    // --- Keys ---

    @Test
    void getAccessToken_withDifferentScopes_usesSeparateEntries() throws Exception {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofHours(1)));

        cache.getAccessToken(RequestContext.background(), retriever, List.of("scope-a"));
        cache.getAccessToken(RequestContext.background(), retriever, List.of("scope-b"));

        assertThat(retriever.calls.get()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void getAccessToken_withEquivalentScopeSets_sharesEntry() throws Exception {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofHours(1)));

        cache.getAccessToken(RequestContext.background(), retriever, List.of("b", "a"));
        cache.getAccessToken(RequestContext.background(), retriever, List.of(" a", "b", "a", ""));

        assertThat(retriever.calls.get()).isEqualTo(1);
        assertThat(retriever.lastScopes).containsExactly("a", "b");
    }

    @Test
    void getAccessToken_withDifferentTenantScopes_usesSeparateEntries() throws Exception {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofHours(1)));

        cache.getAccessToken(RequestContext.background().withTenantScope("t1"), retriever, SCOPES);
        cache.getAccessToken(RequestContext.background().withTenantScope("t2"), retriever, SCOPES);
        cache.getAccessToken(RequestContext.background().withTenantScope("t1"), retriever, SCOPES);

        assertThat(retriever.calls.get()).isEqualTo(2);
    }

    @Test
    void normalizeScopes_trimsDeduplicatesAndSorts() {
        assertThat(ConcurrentTokenCache.normalizeScopes(List.of("z ", "a", " ", "z")))
                .containsExactly("a", "z");
    }

    // --- Errors ---

    @Test
    void getAccessToken_withRetrieverFailure_propagatesAndRetriesNextCall() throws Exception {
        cache = directCache();
        AtomicInteger n = new AtomicInteger();
        FakeRetriever retriever = new FakeRetriever("key", () -> {
            if (n.incrementAndGet() == 1) {
                throw new TokenRequestException("request failed with status 401", 401);
            }
            return token("T", Duration.ofHours(1));
        });

        assertThatThrownBy(() -> cache.getAccessToken(RequestContext.background(), retriever, SCOPES))
                .isInstanceOf(TokenRequestException.class)
                .hasMessageContaining("401");

        assertThat(cache.getAccessToken(RequestContext.background(), retriever, SCOPES)).isEqualTo("T");
        assertThat(retriever.calls.get()).isEqualTo(2);
    }

    @Test
    void getAccessToken_withInitFailure_propagatesWithoutCallingRetriever() {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofHours(1)));
        retriever.initFailure = new TokenRequestException("failed to create credential");

        assertThatThrownBy(() -> cache.getAccessToken(RequestContext.background(), retriever, SCOPES))
                .isSameAs(retriever.initFailure);
        assertThat(retriever.calls.get()).isZero();
    }

    @Test
    void getAccessToken_withRuntimeFailure_wrapsInTokenRequestException() {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> cache.getAccessToken(RequestContext.background(), retriever, SCOPES))
                .isInstanceOf(TokenRequestException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("boom");
    }

    @Test
    void getAccessToken_withNullScopes_throwsIllegalArgument() {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofHours(1)));

        assertThatThrownBy(() -> cache.getAccessToken(RequestContext.background(), retriever, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scopes");
    }

    // --- Concurrency ---

    @Test
    void getAccessToken_concurrentCallers_shareSingleRefresh() throws Exception {
        cache = ConcurrentTokenCache.builder().clock(clock).build();
        CountDownLatch release = new CountDownLatch(1);
        FakeRetriever retriever = new FakeRetriever("key", () -> {
            await(release);
            return token("shared", Duration.ofHours(1));
        });

        List<Future<String>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            results.add(callers.submit(() -> cache.getAccessToken(RequestContext.background(), retriever, SCOPES)));
        }
        assertThat(retriever.started.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();

        for (Future<String> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("shared");
        }
        assertThat(retriever.calls.get()).isEqualTo(1);
    }

    @Test
    void getAccessToken_concurrentCallersDuringFailure_allReceiveError() throws Exception {
        cache = ConcurrentTokenCache.builder().clock(clock).build();
        CountDownLatch release = new CountDownLatch(1);
        FakeRetriever retriever = new FakeRetriever("key", () -> {
            await(release);
            throw new TokenRequestException("request failed with status 500", 500);
        });
        AtomicReference<Throwable> secondFailure = new AtomicReference<>();

        Future<String> first = callers.submit(
                () -> cache.getAccessToken(RequestContext.background(), retriever, SCOPES));
        assertThat(retriever.started.await(5, TimeUnit.SECONDS)).isTrue();
        Thread second = new Thread(() -> {
            try {
                cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
            } catch (AzureAuthException e) {
                secondFailure.set(e);
            }
        });
        second.start();
        awaitWaiting(second);
        release.countDown();

        assertThatThrownBy(() -> first.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TokenRequestException.class);
        second.join(5000);
        assertThat(secondFailure.get())
                .isInstanceOf(TokenRequestException.class)
                .hasMessageContaining("status 500");
        assertThat(retriever.calls.get()).isEqualTo(1);
    }

    @Test
    void getAccessToken_withRetrieverError_failsCallerAndAllowsRetry() throws Exception {
        cache = ConcurrentTokenCache.builder().clock(clock).build();
        AtomicInteger attempts = new AtomicInteger();
        FakeRetriever retriever = new FakeRetriever("key", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new NoClassDefFoundError("com/azure/identity/ManagedIdentityCredential");
            }
            return token("T", Duration.ofHours(1));
        });
        RequestContext ctx = RequestContext.background().withTimeout(Duration.ofSeconds(5));

        assertThatThrownBy(() -> cache.getAccessToken(ctx, retriever, SCOPES))
                .isInstanceOf(TokenRequestException.class)
                .isNotInstanceOf(TokenRequestCancelledException.class)
                .hasCauseInstanceOf(NoClassDefFoundError.class);

        assertThat(cache.getAccessToken(ctx, retriever, SCOPES)).isEqualTo("T");
        assertThat(retriever.calls.get()).isEqualTo(2);
    }

    @Test
    void getAccessToken_withRetrieverErrorOnDirectExecutor_failsCaller() {
        cache = directCache();
        FakeRetriever retriever = new FakeRetriever("key", () -> {
            throw new StackOverflowError();
        });

        assertThatThrownBy(() -> cache.getAccessToken(RequestContext.background(), retriever, SCOPES))
                .isInstanceOf(TokenRequestException.class)
                .hasCauseInstanceOf(StackOverflowError.class);
    }

    @Test
    void getAccessToken_waiterTimeout_doesNotAbortRefresh() throws Exception {
        cache = ConcurrentTokenCache.builder().clock(clock).build();
        CountDownLatch release = new CountDownLatch(1);
        FakeRetriever retriever = new FakeRetriever("key", () -> {
            await(release);
            return token("late", Duration.ofHours(1));
        });
        RequestContext impatient = RequestContext.background().withTimeout(Duration.ofMillis(100));

        assertThatThrownBy(() -> cache.getAccessToken(impatient, retriever, SCOPES))
                .isInstanceOf(TokenRequestCancelledException.class)
                .hasMessageContaining("timed out");

        release.countDown();
        assertThat(cache.getAccessToken(RequestContext.background(), retriever, SCOPES)).isEqualTo("late");
        assertThat(retriever.calls.get()).isEqualTo(1);
    }

    @Test
    void getAccessToken_interruptedWaiter_restoresInterruptFlag() throws Exception {
        cache = ConcurrentTokenCache.builder().clock(clock).build();
        CountDownLatch release = new CountDownLatch(1);
        FakeRetriever retriever = new FakeRetriever("key", () -> {
            await(release);
            return token("T", Duration.ofHours(1));
        });
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicReference<Boolean> interrupted = new AtomicReference<>();

        Thread waiter = new Thread(() -> {
            try {
                cache.getAccessToken(RequestContext.background(), retriever, SCOPES);
            } catch (AzureAuthException e) {
                failure.set(e);
                interrupted.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        assertThat(retriever.started.await(5, TimeUnit.SECONDS)).isTrue();
        waiter.interrupt();
        waiter.join(5000);

        assertThat(failure.get()).isInstanceOf(TokenRequestCancelledException.class);
        assertThat(interrupted.get()).isTrue();

        release.countDown();
        assertThat(cache.getAccessToken(RequestContext.background(), retriever, SCOPES)).isEqualTo("T");
        assertThat(retriever.calls.get()).isEqualTo(1);
    }

    @Test
    void getAccessToken_afterClose_failsWithTokenRequestException() {
        cache = ConcurrentTokenCache.builder().clock(clock).build();
        cache.close();
        FakeRetriever retriever = new FakeRetriever("key", () -> token("T", Duration.ofHours(1)));

        assertThatThrownBy(() -> cache.getAccessToken(RequestContext.background(), retriever, SCOPES))
                .isInstanceOf(TokenRequestException.class)
                .hasMessageContaining("closed");
    }

    // --- Helpers ---

    private AccessToken token(String value, Duration lifetime) {
        return new AccessToken(value, clock.instant().plus(lifetime));
    }

    private static void awaitWaiting(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.WAITING) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("thread " + thread.getName() + " never started waiting");
            }
            Thread.sleep(5);
        }
    }

    private static void await(CountDownLatch latch) throws TokenRequestException {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new TokenRequestException("test latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenRequestException("interrupted", e);
        }
    }

    @FunctionalInterface
    interface TokenSupplier {
        AccessToken get() throws AzureAuthException;
    }

    static final class FakeRetriever implements TokenRetriever {
        final String key;
        final TokenSupplier supplier;
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger inits = new AtomicInteger();
        final CountDownLatch started = new CountDownLatch(1);
        volatile Instant expiry;
        volatile AzureAuthException initFailure;
        volatile List<String> lastScopes;

        FakeRetriever(String key, TokenSupplier supplier) {
            this.key = key;
            this.supplier = supplier;
        }

        @Override
        public String getCacheKey(String tenantScope) {
            return key + "|" + tenantScope;
        }

        @Override
        public void init() throws AzureAuthException {
            inits.incrementAndGet();
            if (initFailure != null) {
                throw initFailure;
            }
        }

        @Override
        public AccessToken getAccessToken(RequestContext ctx, List<String> scopes) throws AzureAuthException {
            calls.incrementAndGet();
            lastScopes = scopes;
            started.countDown();
            return supplier.get();
        }

        @Override
        public Instant getExpiry() {
            return expiry;
        }
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
