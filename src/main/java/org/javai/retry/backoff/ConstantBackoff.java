package org.javai.retry.backoff;

import java.time.Duration;

/**
 * The same delay after every attempt.
 *
 * @param delay the wait between attempts
 */
public record ConstantBackoff(Duration delay) implements BackoffStrategy {

    static final ConstantBackoff NONE = new ConstantBackoff(Duration.ZERO);

    public ConstantBackoff {
        Delays.requireNonNegative(delay, "delay");
    }

    @Override
    public Duration delayFor(int attemptIndex) {
        Delays.requireValidAttempt(attemptIndex);
        return delay;
    }
}
