package org.javai.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of one invocation of a policy's operation.
 *
 * @param index 1-based attempt number
 * @param result What the invocation produced
 * @param elapsed Wall time spent in the invocation
 */
public record Attempt<T>(int index, AttemptResult<T> result, Duration elapsed) {

    public Attempt {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1");
        }
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public boolean succeeded() {
        return result.isValue();
    }

    /**
     * Returns the failure if this attempt did not produce a value.
     */
    public Optional<AttemptFailure> failure() {
        if (result instanceof AttemptResult.Failed<T> failed) {
            return Optional.of(failed.failure());
        }
        return Optional.empty();
    }
}
