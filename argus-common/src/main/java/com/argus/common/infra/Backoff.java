package com.argus.common.infra;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff computation with symmetric jitter.
 * The jittered result is clamped to the policy cap.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy configuration.
     *
     * @param initialMs delay for attempt 0, in milliseconds
     * @param maxMs     cap applied before jitter, in milliseconds
     * @param factor    multiplicative factor per attempt
     * @param jitter    jitter ratio (0..1); the delay moves by up to +/- this share
     */
    public record Policy(long initialMs, long maxMs, double factor, double jitter) {

        /** Reconnect default: 1s initial, 30s cap, factor 2, +/-20% jitter. */
        public static final Policy DEFAULT = new Policy(1_000, 30_000, 2.0, 0.2);

        public Policy {
            if (initialMs < 0 || maxMs < 0) {
                throw new IllegalArgumentException("backoff delays must be >= 0");
            }
            if (factor < 1.0) {
                throw new IllegalArgumentException("backoff factor must be >= 1, got " + factor);
            }
            if (jitter < 0 || jitter > 1) {
                throw new IllegalArgumentException("backoff jitter must be within [0, 1], got " + jitter);
            }
        }
    }

    /**
     * Delay before jitter: {@code min(initialMs * factor^attempt, maxMs)}.
     *
     * @param policy  backoff policy
     * @param attempt 0-based attempt number
     */
    public static long rawDelay(Policy policy, int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        double base = policy.initialMs() * Math.pow(policy.factor(), attempt);
        return (long) Math.min(base, policy.maxMs());
    }

    /**
     * Compute the jittered delay for a given attempt.
     *
     * @param policy  backoff policy
     * @param attempt 0-based attempt number
     * @param random  uniform source in {@code [0, 1)}
     * @return delay in milliseconds, within {@code [0, maxMs]}
     */
    public static long compute(Policy policy, int attempt, DoubleSupplier random) {
        long raw = rawDelay(policy, attempt);
        double offset = (random.getAsDouble() * 2 - 1) * policy.jitter() * raw;
        return Math.min(policy.maxMs(), Math.max(0L, (long) Math.floor(raw + offset)));
    }

    /**
     * Compute the jittered delay using {@link ThreadLocalRandom}.
     */
    public static long compute(Policy policy, int attempt) {
        return compute(policy, attempt, () -> ThreadLocalRandom.current().nextDouble());
    }
}
