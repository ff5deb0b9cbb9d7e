package com.example.catalog.stabilize;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    /**
     * Sleeps the calling thread. An interrupt is restored and reported as an
     * unchecked exception so the surrounding task fails instead of spinning on.
     */
    static Sleeper threadSleep() {
        return duration -> {
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for the page to settle", e);
            }
        };
    }
}
