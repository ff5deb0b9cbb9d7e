package com.example.catalog.stabilize;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class StabilizationDetectorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @Test
    public void stopsOnceSizeHoldsForThreeSamples() {
        ListingThatPlateaus listing = new ListingThatPlateaus(7, 42);
        StabilizationDetector detector = new StabilizationDetector(StabilizationSettings.defaults(), recordingSleeper);

        StabilizationResult<Integer> result = detector.awaitStable(listing);

        Assertions.assertTrue(result.plateaued());
        Assertions.assertEquals(42, result.finalSize());
        Assertions.assertEquals(42, result.collection());
        // 42 is reached during round 2 (6 triggers * 7); rounds 2, 3 and 4 then sample 42
        Assertions.assertEquals(4, result.rounds());
        Assertions.assertEquals(12, listing.triggers);
        // per round: 3 x 500 ms + 2000 ms
        Assertions.assertEquals(Duration.ofMillis(4 * 3_500), result.waited());
    }

    @Test
    public void neverGrowingListStillNeedsAFullRing() {
        ListingThatPlateaus listing = new ListingThatPlateaus(0, 0);
        StabilizationDetector detector = new StabilizationDetector(StabilizationSettings.defaults(), recordingSleeper);

        StabilizationResult<Integer> result = detector.awaitStable(listing);

        Assertions.assertTrue(result.plateaued());
        Assertions.assertEquals(3, result.rounds());
        Assertions.assertEquals(0, result.finalSize());
    }

    @Test
    public void endlessListReturnsWithinTheBudget() {
        EndlessListing listing = new EndlessListing();
        StabilizationSettings settings = new StabilizationSettings(
                3, 3, Duration.ofMillis(500), Duration.ofMillis(2_000), Duration.ofMillis(10_000));
        StabilizationDetector detector = new StabilizationDetector(settings, recordingSleeper);

        StabilizationResult<Integer> result = detector.awaitStable(listing);

        Assertions.assertFalse(result.plateaued());
        Assertions.assertEquals(Duration.ofMillis(10_000), result.waited());
        Duration slept = sleeps.stream().reduce(Duration.ZERO, Duration::plus);
        Assertions.assertEquals(Duration.ofMillis(10_000), slept);
        Assertions.assertEquals(listing.size(), result.collection());
    }

    @Test
    public void zeroBudgetReturnsImmediately() {
        EndlessListing listing = new EndlessListing();
        StabilizationSettings settings = new StabilizationSettings(
                3, 3, Duration.ofMillis(500), Duration.ofMillis(2_000), Duration.ZERO);

        StabilizationResult<Integer> result = new StabilizationDetector(settings, recordingSleeper).awaitStable(listing);

        Assertions.assertFalse(result.plateaued());
        Assertions.assertEquals(0, result.rounds());
        Assertions.assertTrue(sleeps.isEmpty());
    }

    @Test
    public void settingsWithoutAnyPauseAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new StabilizationSettings(
                3, 3, Duration.ZERO, Duration.ZERO, Duration.ofSeconds(1)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new StabilizationSettings(
                0, 3, Duration.ofMillis(1), Duration.ofMillis(1), Duration.ofSeconds(1)));
    }

    /** Loads {@code perTrigger} items per grow trigger until {@code cap}. */
    private static final class ListingThatPlateaus implements GrowingCollection<Integer> {
        private final int perTrigger;
        private final int cap;
        private int triggers;

        ListingThatPlateaus(int perTrigger, int cap) {
            this.perTrigger = perTrigger;
            this.cap = cap;
        }

        @Override
        public void grow() {
            triggers++;
        }

        @Override
        public int size() {
            return Math.min(cap, triggers * perTrigger);
        }

        @Override
        public Integer realize() {
            return size();
        }
    }

    private static final class EndlessListing implements GrowingCollection<Integer> {
        private int size;

        @Override
        public void grow() {
            size++;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public Integer realize() {
            return size;
        }
    }
}
