package com.optiontracker.chain;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-flight, TTL-bounded cache for option chain and expiration lookups.
 *
 * <p>Backed by a Caffeine {@link AsyncCache} holding futures. Concurrent lookups of a key
 * whose fetch is still running join that fetch instead of starting another one. Each
 * entry carries its own TTL (chosen by the caller from the market session at fetch
 * time), applied through a variable {@link Expiry}. A fetch that fails is removed from
 * the cache, so the next lookup fetches again.
 *
 * <p>Created by {@link com.optiontracker.config.ChainCacheConfig}; tests construct it
 * directly with a fake {@link Ticker}.
 */
public class ChainDataCache {

    private static final Logger log = LoggerFactory.getLogger(ChainDataCache.class);

    private final AsyncCache<String, TimedValue> cache;
    private final Executor executor;

    public ChainDataCache(Ticker ticker, Executor executor, long maximumSize) {
        this.executor = executor;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new TimedValueExpiry())
                .ticker(ticker)
                .executor(executor)
                .recordStats()
                .buildAsync();
    }

    /**
     * Returns the cached value for {@code key}, or runs {@code producer} once and caches
     * its result for {@code ttl}. Callers arriving while the producer runs share its future.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> getOrFetchAsync(String key, Supplier<CompletableFuture<T>> producer, Duration ttl) {
        CompletableFuture<TimedValue> entry = cache.get(key, (k, cacheExecutor) -> {
            log.debug("Chain cache miss for {}, fetching (ttl {})", k, ttl);
            return producer.get().thenApply(value -> new TimedValue(value, ttl));
        });
        return entry.thenApply(timed -> (T) timed.getValue());
    }

    /**
     * Blocking variant. The producer runs on the cache executor; a failure of the producer
     * is rethrown unwrapped when it is unchecked.
     */
    public <T> T getOrFetch(String key, Supplier<T> producer, Duration ttl) {
        CompletableFuture<T> future = getOrFetchAsync(key, () -> CompletableFuture.supplyAsync(producer, executor), ttl);
        try {
            return future.get();
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Chain fetch failed for " + key, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for chain data " + key, e);
        }
    }

    /** Removes every entry whose key refers to the ticker. */
    public void invalidateTicker(String ticker) {
        String symbol = ChainCacheKey.normalizeTicker(ticker);
        long before = cache.synchronous().estimatedSize();
        cache.synchronous().asMap().keySet().removeIf(key -> ChainCacheKey.belongsTo(key, symbol));
        log.info("Chain cache cleared for {} ({} -> {} entries)", symbol, before, cache.synchronous().estimatedSize());
    }

    public void invalidateAll() {
        cache.synchronous().invalidateAll();
        log.info("Chain cache cleared");
    }

    public CacheStats stats() {
        return cache.synchronous().stats();
    }

    public long size() {
        return cache.synchronous().estimatedSize();
    }

    /** A cached value with the TTL it was fetched under. */
    static final class TimedValue {

        private final Object value;
        private final Duration ttl;

        TimedValue(Object value, Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }

        Object getValue() {
            return value;
        }

        Duration getTtl() {
            return ttl;
        }
    }

    /** Expires each entry {@code ttl} after it was written; reads do not extend it. */
    private static final class TimedValueExpiry implements Expiry<String, TimedValue> {

        @Override
        public long expireAfterCreate(String key, TimedValue value, long currentTime) {
            return value.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, TimedValue value, long currentTime, long currentDuration) {
            return value.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, TimedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
