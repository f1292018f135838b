package io.github.azauth.tokenprovider;

import io.github.azauth.AzureAuthException;
import io.github.azauth.TokenRequestCancelledException;
import io.github.azauth.TokenRequestException;
import io.github.azauth.usercontext.RequestContext;
import io.github.azauth.util.Preconditions;
import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe token cache with single-flight refresh.
 *
 * <p>Entries are keyed by the retriever's cache key for the request's tenant scope plus the
 * normalized scope set. For each key:
 * <ul>
 *   <li>a valid token is served with a single volatile read, no locking</li>
 *   <li>at most one refresh is in flight; concurrent callers wait for its outcome and
 *       share its result or its error</li>
 *   <li>a token is valid until its expiry minus the safety margin, or until the retriever's
 *       {@link TokenRetriever#getExpiry() ceiling}, whichever comes first</li>
 *   <li>tokens without a known expiry are kept for the minimum lifetime</li>
 * </ul>
 *
 * <p>Refreshes run on the cache's executor so that a waiter giving up (interrupt or
 * {@link RequestContext#getTimeout() timeout}) never aborts the refresh other callers
 * depend on. Failed refreshes are not retried; the next call after a failure starts a
 * new one.
 *
 * <p>The cache is unbounded. Its key space is bounded by the configured credentials.
 */
public final class ConcurrentTokenCache implements TokenCache, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrentTokenCache.class);

    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofMinutes(2);
    public static final Duration DEFAULT_UNKNOWN_EXPIRY_LIFETIME = Duration.ofMinutes(1);

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration safetyMargin;
    private final Duration unknownExpiryLifetime;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Clock clock;

    /**
     * Creates a cache with default settings.
     */
    public ConcurrentTokenCache() {
        this(builder());
    }

    private ConcurrentTokenCache(Builder builder) {
        this.safetyMargin = builder.safetyMargin;
        this.unknownExpiryLifetime = builder.unknownExpiryLifetime;
        this.clock = builder.clock;
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(new RefreshThreadFactory());
            this.executor = ownedExecutor;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getAccessToken(RequestContext ctx, TokenRetriever retriever, List<String> scopes)
            throws AzureAuthException {
        Preconditions.requireNonNull(ctx, "ctx");
        Preconditions.requireNonNull(retriever, "retriever");
        Preconditions.requireNonNull(scopes, "scopes");

        List<String> normalizedScopes = normalizeScopes(scopes);
        String key = retriever.getCacheKey(ctx.getTenantScope()) + "|" + String.join(",", normalizedScopes);

        // computeIfAbsent locks only the bin for this key while creating the entry
        CacheEntry entry = entries.computeIfAbsent(key, CacheEntry::new);
        return entry.getToken(ctx, retriever, normalizedScopes).getToken();
    }

    /**
     * Stops the refresh threads owned by this cache. An executor passed to the builder is
     * left running.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    /**
     * Returns the number of cache entries (for testing).
     */
    int size() {
        return entries.size();
    }

    /**
     * Trims, de-duplicates and sorts scopes so that equivalent scope sets share an entry.
     */
    static List<String> normalizeScopes(List<String> scopes) {
        TreeSet<String> normalized = new TreeSet<>();
        for (String scope : scopes) {
            if (scope != null && !scope.isBlank()) {
                normalized.add(scope.trim());
            }
        }
        return new ArrayList<>(normalized);
    }

    private Instant computeValidUntil(AccessToken token, Instant ceiling, Instant now) {
        Instant validUntil = token.getExpiresOn() != null
                ? token.getExpiresOn().minus(safetyMargin)
                : now.plus(unknownExpiryLifetime);
        if (ceiling != null && ceiling.isBefore(validUntil)) {
            validUntil = ceiling;
        }
        return validUntil;
    }

    /**
     * Immutable snapshot of a cached token, swapped atomically on refresh.
     */
    private static final class CachedToken {
        final AccessToken token;
        final Instant validUntil;

        CachedToken(AccessToken token, Instant validUntil) {
            this.token = token;
            this.validUntil = validUntil;
        }

        boolean isValid(Instant now) {
            return now.isBefore(validUntil);
        }
    }

    private final class CacheEntry {
        private final String key;
        private volatile CachedToken current;
        // Guarded by this
        private CompletableFuture<AccessToken> inFlight;

        CacheEntry(String key) {
            this.key = key;
        }

        AccessToken getToken(RequestContext ctx, TokenRetriever retriever, List<String> scopes)
                throws AzureAuthException {
            CachedToken cached = current;
            if (cached != null && cached.isValid(clock.instant())) {
                logger.debug("Token cache hit for key {}", key);
                return cached.token;
            }

            CompletableFuture<AccessToken> future;
            boolean owner = false;
            synchronized (this) {
                cached = current;
                if (cached != null && cached.isValid(clock.instant())) {
                    logger.debug("Token cache hit for key {} after refresh by another caller", key);
                    return cached.token;
                }
                future = inFlight;
                if (future == null) {
                    future = new CompletableFuture<>();
                    inFlight = future;
                    owner = true;
                }
            }

            if (owner) {
                logger.debug("Token cache miss for key {}, starting refresh", key);
                startRefresh(future, ctx, retriever, scopes);
            } else {
                logger.debug("Token cache miss for key {}, waiting for refresh in flight", key);
            }
            return await(future, ctx);
        }

        private void startRefresh(CompletableFuture<AccessToken> future, RequestContext ctx,
                                  TokenRetriever retriever, List<String> scopes) {
            try {
                executor.execute(() -> refresh(future, ctx, retriever, scopes));
            } catch (RejectedExecutionException e) {
                fail(future, new TokenRequestException("token cache is closed", e));
            }
        }

        private void refresh(CompletableFuture<AccessToken> future, RequestContext ctx,
                             TokenRetriever retriever, List<String> scopes) {
            try {
                retriever.init();
                AccessToken token = retriever.getAccessToken(ctx, scopes);
                if (token == null || token.getToken() == null) {
                    throw new TokenRequestException("retriever returned no access token");
                }
                Instant now = clock.instant();
                Instant validUntil = computeValidUntil(token, retriever.getExpiry(), now);
                synchronized (this) {
                    current = new CachedToken(token, validUntil);
                    inFlight = null;
                }
                logger.debug("Token refreshed for key {}, valid until {}", key, validUntil);
                future.complete(token);
            } catch (Exception e) {
                logger.debug("Token refresh failed for key {}: {}", key, e.getMessage());
                fail(future, e);
            } catch (Throwable t) {
                // Waiters must never be left on a future that cannot complete
                logger.warn("Token refresh failed for key {} with unexpected error", key, t);
                fail(future, new TokenRequestException("failed to retrieve access token: " + t, t));
            }
        }

        private void fail(CompletableFuture<AccessToken> future, Throwable e) {
            synchronized (this) {
                inFlight = null;
            }
            future.completeExceptionally(e);
        }

        private AccessToken await(CompletableFuture<AccessToken> future, RequestContext ctx)
                throws AzureAuthException {
            Duration timeout = ctx.getTimeout();
            try {
                return timeout != null
                        ? future.get(timeout.toNanos(), TimeUnit.NANOSECONDS)
                        : future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TokenRequestCancelledException("interrupted while waiting for access token", e);
            } catch (TimeoutException e) {
                throw new TokenRequestCancelledException(
                        "timed out after " + timeout + " waiting for access token", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof AzureAuthException) {
                    throw (AzureAuthException) cause;
                }
                throw new TokenRequestException("failed to retrieve access token: " + cause.getMessage(), cause);
            }
        }
    }

    private static final class RefreshThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "ConcurrentTokenCache-Refresh-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Builder for {@link ConcurrentTokenCache}.
     */
    public static final class Builder {

        private Duration safetyMargin = DEFAULT_SAFETY_MARGIN;
        private Duration unknownExpiryLifetime = DEFAULT_UNKNOWN_EXPIRY_LIFETIME;
        private Executor executor;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * How long before a token's expiry it stops being served.
         */
        public Builder safetyMargin(Duration margin) {
            Preconditions.requireNonNull(margin, "margin");
            if (margin.isNegative()) {
                throw new IllegalArgumentException("parameter 'margin' cannot be negative");
            }
            this.safetyMargin = margin;
            return this;
        }

        /**
         * How long a token whose expiry is unknown is served.
         */
        public Builder unknownExpiryLifetime(Duration lifetime) {
            Preconditions.requireNonNull(lifetime, "lifetime");
            if (lifetime.isNegative() || lifetime.isZero()) {
                throw new IllegalArgumentException("parameter 'lifetime' must be positive");
            }
            this.unknownExpiryLifetime = lifetime;
            return this;
        }

        /**
         * Executor running refreshes. When unset the cache creates and owns a pool of daemon threads.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Preconditions.requireNonNull(clock, "clock");
            return this;
        }

        public ConcurrentTokenCache build() {
            return new ConcurrentTokenCache(this);
        }
    }
}
