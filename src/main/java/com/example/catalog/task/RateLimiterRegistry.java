package com.example.catalog.task;

import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named rate limiters shared by every task that talks to the same resource.
 *
 * Policies are registered up front; acquiring from an unknown name is a wiring
 * error rather than an implicit unlimited limiter.
 */
public class RateLimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();

    public RateLimiterRegistry register(String name, RateLimitPolicy policy) {
        RateLimiter limiter = RateLimiter.create(policy.permitsPerSecond());
        if (limiters.putIfAbsent(name, limiter) != null) {
            throw new IllegalStateException("Rate limiter already registered: " + name);
        }
        log.info("Rate limiter '{}': {} permit(s) per {}", name, policy.permits(), policy.window());
        return this;
    }

    /**
     * Blocks the calling worker until the named limiter admits it.
     *
     * @return seconds spent waiting
     */
    public double acquire(String name) {
        RateLimiter limiter = limiters.get(name);
        if (limiter == null) {
            throw new IllegalStateException("No rate limiter registered under '" + name + "'");
        }
        double waited = limiter.acquire();
        if (waited > 0) {
            log.debug("Waited {}s for rate limiter '{}'", String.format("%.3f", waited), name);
        }
        return waited;
    }

    public boolean contains(String name) {
        return limiters.containsKey(name);
    }
}
