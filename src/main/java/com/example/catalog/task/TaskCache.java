package com.example.catalog.task;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Fingerprint-keyed memo of task results with a fixed time-to-live.
 *
 * The first caller for a fingerprint computes on its own thread; concurrent
 * callers with the same fingerprint wait on that caller's future instead of
 * computing again. A failed future is dropped from the cache, so the next
 * call starts from scratch.
 */
public class TaskCache {

    private static final Logger log = LoggerFactory.getLogger(TaskCache.class);

    private final AsyncCache<Fingerprint, CacheEntry> cache;
    private final Duration ttl;
    private final Clock clock;

    public TaskCache(Duration ttl, long maximumSize) {
        this(ttl, maximumSize, Ticker.systemTicker(), Clock.systemUTC());
    }

    TaskCache(Duration ttl, long maximumSize, Ticker ticker, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .buildAsync();
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(Fingerprint fingerprint, Supplier<T> computation) {
        CompletableFuture<CacheEntry> promise = new CompletableFuture<>();
        CompletableFuture<CacheEntry> future = cache.get(fingerprint, (key, executor) -> promise);

        if (future != promise) {
            log.debug("Cache hit or in-flight join for {}", fingerprint);
            return (T) await(future).value();
        }

        try {
            T value = computation.get();
            Instant now = clock.instant();
            promise.complete(new CacheEntry(fingerprint, value, now, now.plus(ttl)));
            return value;
        } catch (RuntimeException | Error e) {
            cache.asMap().remove(fingerprint, promise);
            promise.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * The completed, unexpired entry for a fingerprint, if any.
     */
    public Optional<CacheEntry> lookup(Fingerprint fingerprint) {
        CompletableFuture<CacheEntry> future = cache.getIfPresent(fingerprint);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    public long size() {
        return cache.synchronous().estimatedSize();
    }

    public void invalidateAll() {
        cache.synchronous().invalidateAll();
    }

    private static CacheEntry await(CompletableFuture<CacheEntry> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
