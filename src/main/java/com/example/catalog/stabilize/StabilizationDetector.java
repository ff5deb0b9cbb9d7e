package com.example.catalog.stabilize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Keeps prodding a {@link GrowingCollection} until its size stops changing.
 *
 * Each round issues a batch of grow triggers, lets the page settle, then
 * samples the size into a ring of the last {@code ringSize} samples. The loop
 * ends when the whole ring equals the latest sample, or when the pause budget
 * is spent. Either way the collection is returned as currently loaded; running
 * out of time is not an error.
 */
public class StabilizationDetector {

    private static final Logger log = LoggerFactory.getLogger(StabilizationDetector.class);

    private final StabilizationSettings settings;
    private final Sleeper sleeper;

    public StabilizationDetector(StabilizationSettings settings, Sleeper sleeper) {
        this.settings = settings;
        this.sleeper = sleeper;
    }

    public <T> StabilizationResult<T> awaitStable(GrowingCollection<T> collection) {
        Deque<Integer> ring = new ArrayDeque<>(settings.ringSize());
        Budget budget = new Budget(settings.maxWait());
        int latest = collection.size();
        int rounds = 0;

        while (!plateau(ring, latest) && !budget.spent()) {
            for (int i = 0; i < settings.growStepsPerRound() && !budget.spent(); i++) {
                collection.grow();
                budget.pause(settings.stepDelay());
            }
            budget.pause(settings.settleDelay());

            latest = collection.size();
            if (ring.size() == settings.ringSize()) {
                ring.removeFirst();
            }
            ring.addLast(latest);
            rounds++;
            log.debug("Round {}: {} item(s), waited {} ms", rounds, latest, budget.used.toMillis());
        }

        boolean plateaued = plateau(ring, latest);
        if (plateaued) {
            log.info("Stable at {} item(s) after {} round(s), {} ms", latest, rounds, budget.used.toMillis());
        } else {
            log.info("Gave up waiting after {} ms with {} item(s) loaded", budget.used.toMillis(), latest);
        }
        return new StabilizationResult<>(collection.realize(), latest, plateaued, rounds, budget.used);
    }

    private boolean plateau(Deque<Integer> ring, int latest) {
        if (ring.size() < settings.ringSize()) {
            return false;
        }
        for (int sample : ring) {
            if (sample != latest) {
                return false;
            }
        }
        return true;
    }

    private final class Budget {
        private final Duration max;
        private Duration used = Duration.ZERO;

        Budget(Duration max) {
            this.max = max;
        }

        boolean spent() {
            return used.compareTo(max) >= 0;
        }

        // clamped so the total never exceeds max
        void pause(Duration wanted) {
            Duration remaining = max.minus(used);
            Duration actual = wanted.compareTo(remaining) > 0 ? remaining : wanted;
            if (actual.isZero() || actual.isNegative()) {
                return;
            }
            sleeper.sleep(actual);
            used = used.plus(actual);
        }
    }
}
