package com.example.catalog.task;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

public class RateLimiterRegistryTest {

    @Test
    public void policyConvertsToRate() {
        Assertions.assertEquals(2.0, new RateLimitPolicy(10, Duration.ofSeconds(5)).permitsPerSecond(), 1e-9);
        Assertions.assertEquals(0.5, new RateLimitPolicy(30, Duration.ofMinutes(1)).permitsPerSecond(), 1e-9);
    }

    @Test
    public void invalidPolicyIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(0, Duration.ofSeconds(1)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(1, Duration.ZERO));
    }

    @Test
    public void acquiringUnknownLimiterFails() {
        RateLimiterRegistry registry = new RateLimiterRegistry();
        Assertions.assertThrows(IllegalStateException.class, () -> registry.acquire("tops_website"));
    }

    @Test
    public void nameCanOnlyBeRegisteredOnce() {
        RateLimiterRegistry registry = new RateLimiterRegistry()
                .register("tops_website", new RateLimitPolicy(1, Duration.ofSeconds(1)));

        Assertions.assertTrue(registry.contains("tops_website"));
        Assertions.assertThrows(IllegalStateException.class,
                () -> registry.register("tops_website", new RateLimitPolicy(5, Duration.ofSeconds(1))));
    }

    @Test
    public void limiterSpacesOutAcquisitions() {
        RateLimiterRegistry registry = new RateLimiterRegistry()
                .register("slow", new RateLimitPolicy(10, Duration.ofSeconds(1)));

        long start = System.nanoTime();
        for (int i = 0; i < 4; i++) {
            registry.acquire("slow");
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        // first permit is free, the next three are ~100 ms apart
        Assertions.assertTrue(elapsedMs >= 250, "elapsed " + elapsedMs + " ms");
    }
}
