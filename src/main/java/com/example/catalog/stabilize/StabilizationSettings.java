package com.example.catalog.stabilize;

import java.time.Duration;

/**
 * @param ringSize          how many consecutive equal samples count as a plateau
 * @param growStepsPerRound grow triggers issued before each sample
 * @param stepDelay         pause after every grow trigger
 * @param settleDelay       pause before sampling
 * @param maxWait           total pause budget; reaching it ends the loop
 */
public record StabilizationSettings(int ringSize,
                                    int growStepsPerRound,
                                    Duration stepDelay,
                                    Duration settleDelay,
                                    Duration maxWait) {

    public StabilizationSettings {
        if (ringSize < 1) {
            throw new IllegalArgumentException("ringSize must be >= 1");
        }
        if (growStepsPerRound < 0) {
            throw new IllegalArgumentException("growStepsPerRound must be >= 0");
        }
        if (stepDelay.isNegative() || settleDelay.isNegative() || maxWait.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        boolean roundTakesTime = !settleDelay.isZero() || (growStepsPerRound > 0 && !stepDelay.isZero());
        if (!maxWait.isZero() && !roundTakesTime) {
            // the budget would never run out
            throw new IllegalArgumentException("a round must pause for some time");
        }
    }

    public static StabilizationSettings defaults() {
        return new StabilizationSettings(3, 3, Duration.ofMillis(500), Duration.ofMillis(2_000), Duration.ofMinutes(5));
    }
}
