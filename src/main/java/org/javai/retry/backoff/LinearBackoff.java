package org.javai.retry.backoff;

import java.time.Duration;

/**
 * A delay that grows by a fixed increment after every attempt.
 * Saturates at {@code Long.MAX_VALUE} nanoseconds instead of overflowing.
 *
 * @param initial the delay after the first attempt
 * @param increment added for each further attempt
 */
public record LinearBackoff(Duration initial, Duration increment) implements BackoffStrategy {

    public LinearBackoff {
        Delays.requireNonNegative(initial, "initial");
        Delays.requireNonNegative(increment, "increment");
    }

    @Override
    public Duration delayFor(int attemptIndex) {
        Delays.requireValidAttempt(attemptIndex);
        long growth = Delays.saturatedMultiply(Delays.saturatedNanos(increment), attemptIndex - 1L);
        return Duration.ofNanos(Delays.saturatedAdd(Delays.saturatedNanos(initial), growth));
    }
}
