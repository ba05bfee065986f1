package org.javai.retry.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Exponential backoff with an optional cap and optional jitter.
 *
 * <pre>
 * delay  = min(initial * multiplier^(attempt-1), cap)
 * jitter = random(0, delay * jitterFactor)
 * result = min(delay + jitter, cap)
 * </pre>
 *
 * <p>Delays are computed in nanoseconds and saturate at {@code Long.MAX_VALUE} nanoseconds.
 * Instances are immutable; {@link #withCap(Duration)} and {@link #withJitter(double, RandomGenerator)}
 * return new instances. The random source is only consulted when a jitter factor above zero is set.
 */
public final class ExponentialBackoff implements BackoffStrategy {

    private final long initialNanos;
    private final double multiplier;
    private final long capNanos;
    private final double jitterFactor;
    private final RandomGenerator random;

    private ExponentialBackoff(long initialNanos, double multiplier, long capNanos,
                               double jitterFactor, RandomGenerator random) {
        this.initialNanos = initialNanos;
        this.multiplier = multiplier;
        this.capNanos = capNanos;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    static ExponentialBackoff of(Duration initial, double multiplier) {
        long initialNanos = Delays.saturatedNanos(Delays.requireNonNegative(initial, "initial"));
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite value >= 1.0, was: " + multiplier);
        }
        return new ExponentialBackoff(initialNanos, multiplier, Long.MAX_VALUE, 0.0, null);
    }

    /**
     * Limits every delay, jitter included, to {@code cap}.
     *
     * @param cap the maximum delay
     * @return a capped copy of this strategy
     */
    public ExponentialBackoff withCap(Duration cap) {
        long cappedAt = Delays.saturatedNanos(Delays.requireNonNegative(cap, "cap"));
        return new ExponentialBackoff(initialNanos, multiplier, cappedAt, jitterFactor, random);
    }

    /**
     * Adds up to {@code factor * delay} of random extra wait.
     *
     * @param factor jitter ratio between 0.0 and 1.0
     * @param random the random source to draw from
     * @return a jittered copy of this strategy
     */
    public ExponentialBackoff withJitter(double factor, RandomGenerator random) {
        if (!(factor >= 0.0 && factor <= 1.0)) {
            throw new IllegalArgumentException("jitter factor must be between 0.0 and 1.0, was: " + factor);
        }
        Objects.requireNonNull(random, "random must not be null");
        return new ExponentialBackoff(initialNanos, multiplier, capNanos, factor, random);
    }

    @Override
    public Duration delayFor(int attemptIndex) {
        Delays.requireValidAttempt(attemptIndex);

        // (long) of a double saturates at Long.MAX_VALUE; 0 * Infinity is NaN which converts to 0
        long delay = (long) (initialNanos * Math.pow(multiplier, attemptIndex - 1));
        delay = Math.min(delay, capNanos);

        if (jitterFactor > 0.0) {
            long jitter = (long) (delay * jitterFactor * random.nextDouble());
            delay = Math.min(Delays.saturatedAdd(delay, jitter), capNanos);
        }
        return Duration.ofNanos(delay);
    }

    public Duration initial() {
        return Duration.ofNanos(initialNanos);
    }

    public double multiplier() {
        return multiplier;
    }

    public double jitterFactor() {
        return jitterFactor;
    }

    @Override
    public String toString() {
        return "ExponentialBackoff[initial=" + Duration.ofNanos(initialNanos) + ", multiplier=" + multiplier
                + (capNanos == Long.MAX_VALUE ? "" : ", cap=" + Duration.ofNanos(capNanos))
                + (jitterFactor > 0.0 ? ", jitter=" + jitterFactor : "") + "]";
    }
}
