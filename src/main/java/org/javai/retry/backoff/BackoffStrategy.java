package org.javai.retry.backoff;

import java.time.Duration;

/**
 * Maps an attempt number to the wait before the next attempt.
 *
 * <p>Implementations are pure: the same attempt index always yields the same delay, unless
 * jitter was configured with an explicitly supplied random source. The engine calls
 * {@link #delayFor(int)} once after every attempt except the last, and never clamps the
 * result: a zero delay means an immediate retry.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * BackoffStrategy backoff = BackoffStrategy.exponential(Duration.ofMillis(100))
 *     .withCap(Duration.ofSeconds(5))
 *     .withJitter(0.2, new Random());
 * }</pre>
 */
@FunctionalInterface
public interface BackoffStrategy {

    /**
     * Returns the delay to wait after the given attempt.
     *
     * @param attemptIndex the attempt that just finished (1-based)
     * @return a non-negative delay
     */
    Duration delayFor(int attemptIndex);

    /**
     * Retries immediately.
     */
    static BackoffStrategy none() {
        return ConstantBackoff.NONE;
    }

    /**
     * Waits the same delay after every attempt.
     */
    static BackoffStrategy constant(Duration delay) {
        return new ConstantBackoff(delay);
    }

    /**
     * Waits {@code initial + increment * (attempt - 1)}.
     */
    static BackoffStrategy linear(Duration initial, Duration increment) {
        return new LinearBackoff(initial, increment);
    }

    /**
     * Doubles the delay after every attempt, starting at {@code initial}.
     */
    static ExponentialBackoff exponential(Duration initial) {
        return ExponentialBackoff.of(initial, 2.0);
    }

    /**
     * Multiplies the delay by {@code multiplier} after every attempt, starting at {@code initial}.
     */
    static ExponentialBackoff exponential(Duration initial, double multiplier) {
        return ExponentialBackoff.of(initial, multiplier);
    }
}
