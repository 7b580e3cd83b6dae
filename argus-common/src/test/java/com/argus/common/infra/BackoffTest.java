package com.argus.common.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    private static final Backoff.Policy POLICY = Backoff.Policy.DEFAULT;

    @Test
    void rawDelay_doublesUntilCap() {
        assertEquals(1_000, Backoff.rawDelay(POLICY, 0));
        assertEquals(2_000, Backoff.rawDelay(POLICY, 1));
        assertEquals(4_000, Backoff.rawDelay(POLICY, 2));
        assertEquals(8_000, Backoff.rawDelay(POLICY, 3));
        assertEquals(16_000, Backoff.rawDelay(POLICY, 4));
        assertEquals(30_000, Backoff.rawDelay(POLICY, 5));
        assertEquals(30_000, Backoff.rawDelay(POLICY, 40));
    }

    @Test
    void compute_midpointRandom_hasNoJitter() {
        assertEquals(4_000, Backoff.compute(POLICY, 2, () -> 0.5));
    }

    @Test
    void compute_extremes_stayWithinTwentyPercent() {
        assertEquals(800, Backoff.compute(POLICY, 0, () -> 0.0));
        // nextDouble() never returns 1.0; the largest value lands just under +20%
        long high = Backoff.compute(POLICY, 0, () -> Math.nextDown(1.0));
        assertTrue(high <= 1_200 && high >= 1_199, "got " + high);
    }

    @Test
    void compute_expectedValue_isNonDecreasing() {
        long previous = -1;
        for (int attempt = 0; attempt <= 4; attempt++) {
            long mid = Backoff.compute(POLICY, attempt, () -> 0.5);
            assertTrue(mid >= previous, "attempt " + attempt);
            previous = mid;
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 10, 100})
    void compute_alwaysWithinBounds(int attempt) {
        Random random = new Random(attempt);
        for (int i = 0; i < 200; i++) {
            long delay = Backoff.compute(POLICY, attempt, random::nextDouble);
            assertTrue(delay >= 0 && delay <= 30_000, "delay " + delay);
            assertTrue(delay <= Backoff.rawDelay(POLICY, attempt) * 1.2);
        }
    }

    @Test
    void compute_beyondCap_matchesAttemptFive() {
        for (int attempt = 5; attempt < 12; attempt++) {
            assertEquals(Backoff.compute(POLICY, 5, () -> 0.25),
                    Backoff.compute(POLICY, attempt, () -> 0.25));
        }
    }

    @Test
    void compute_atCap_jitterNeverExceedsCap() {
        assertEquals(30_000, Backoff.compute(POLICY, 5, () -> Math.nextDown(1.0)));
        assertEquals(24_000, Backoff.compute(POLICY, 5, () -> 0.0));
    }

    @Test
    void compute_negativeAttempt_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Backoff.compute(POLICY, -1, () -> 0.5));
    }

    @Test
    void policy_invalidValues_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Backoff.Policy(1_000, 30_000, 0.5, 0.2));
        assertThrows(IllegalArgumentException.class, () -> new Backoff.Policy(1_000, 30_000, 2.0, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new Backoff.Policy(-1, 30_000, 2.0, 0.2));
    }
}
