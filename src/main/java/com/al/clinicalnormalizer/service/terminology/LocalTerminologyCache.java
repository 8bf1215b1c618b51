package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.exception.CacheBackendUnavailableException;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * In-process terminology cache.
 *
 * <p>
 * Guava only supports one expiry per cache, so every entry carries its own deadline taken
 * from the {@link CacheTtlPolicy}; the builder-level expiry is the longest TTL and only
 * bounds memory. {@link Cache#get(Object, Callable)} gives one
 * loader per key under concurrent misses.
 */
@Slf4j
public class LocalTerminologyCache implements TerminologyCache {

    private final Cache<TerminologyCacheKey, CachedTerm> cache;
    private final CacheTtlPolicy ttlPolicy;
    private final Ticker ticker;

    public LocalTerminologyCache(CacheTtlPolicy ttlPolicy, long maximumSize, Ticker ticker) {
        this.ttlPolicy = ttlPolicy;
        this.ticker = ticker;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttlPolicy.longest().toNanos(), TimeUnit.NANOSECONDS)
                .ticker(ticker)
                .recordStats()
                .build();
    }

    @Override
    public ResolvedTerm getOrCompute(TerminologyCacheKey key, Supplier<ResolvedTerm> loader) {
        for (int attempt = 0; attempt < 2; attempt++) {
            boolean[] computed = new boolean[1];
            CachedTerm cached = load(key, () -> {
                computed[0] = true;
                return store(loader.get());
            });
            if (computed[0] || cached.isFreshAt(ticker.read())) {
                return cached.term;
            }
            // Only removes the stale entry, never a fresher one written concurrently
            cache.asMap().remove(key, cached);
        }
        log.debug("Cache entry for {} kept expiring, computing without cache", key);
        return loader.get();
    }

    @Override
    public void invalidateAll() {
        log.info("Invalidating {} cached terms", cache.size());
        cache.invalidateAll();
    }

    public long size() {
        return cache.size();
    }

    private CachedTerm load(TerminologyCacheKey key, Callable<CachedTerm> valueLoader) {
        try {
            return cache.get(key, valueLoader);
        } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CacheBackendUnavailableException("Local cache load failed for " + key, cause);
        }
    }

    private CachedTerm store(ResolvedTerm term) {
        Duration ttl = ttlPolicy.ttlFor(term);
        return new CachedTerm(term, ticker.read() + ttl.toNanos());
    }

    private static final class CachedTerm {
        private final ResolvedTerm term;
        private final long expiresAtNanos;

        private CachedTerm(ResolvedTerm term, long expiresAtNanos) {
            this.term = term;
            this.expiresAtNanos = expiresAtNanos;
        }

        private boolean isFreshAt(long nowNanos) {
            return nowNanos < expiresAtNanos;
        }
    }
}
