package org.javai.retry;

import org.javai.retry.backoff.BackoffStrategy;
import org.javai.retry.bailout.BailoutEvaluator;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything that determines how one execution behaves: the operation, when to stop, how long to
 * wait between attempts, and how many attempts are allowed.
 *
 * <p>Immutable and free of per-execution state, so a single config may be executed any number of
 * times, concurrently. Usually obtained from {@link #builder()}, which reports every missing or
 * invalid setting at once.
 *
 * @param name Label used when reporting attempts
 * @param initialValue The result value if no attempt ever produces one (may be null)
 * @param operation The work to retry
 * @param bailout Stopping condition evaluated on every produced value
 * @param backoff Wait between attempts
 * @param maxAttempts Attempt budget, at least 1
 * @param perAttemptTimeout Upper bound on a single invocation, if any
 * @param treatInvocationErrorAsBailout Stop with {@link ExecutionOutcome#OPERATION_FAILED} on the first failed attempt
 * @param bailoutMeansSuccess Report {@link ExecutionOutcome#SUCCEEDED} rather than {@link ExecutionOutcome#BAILED_OUT}
 */
public record PolicyConfig<T>(
        String name,
        T initialValue,
        Operation<T> operation,
        BailoutEvaluator<T> bailout,
        BackoffStrategy backoff,
        int maxAttempts,
        Optional<Duration> perAttemptTimeout,
        boolean treatInvocationErrorAsBailout,
        boolean bailoutMeansSuccess
) {

    public PolicyConfig {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(bailout, "bailout must not be null");
        Objects.requireNonNull(backoff, "backoff must not be null");
        Objects.requireNonNull(perAttemptTimeout, "perAttemptTimeout must not be null, use Optional.empty()");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        perAttemptTimeout.ifPresent(timeout -> {
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("perAttemptTimeout must be positive, was: " + timeout);
            }
        });
    }

    /**
     * Creates a builder for assembling a policy.
     *
     * @param <T> the operation's value type
     * @return a new builder
     */
    public static <T> PolicyBuilder<T> builder() {
        return PolicyBuilder.create();
    }

    /**
     * The outcome to report when the bailout predicate holds.
     */
    public ExecutionOutcome bailoutOutcome() {
        return bailoutMeansSuccess ? ExecutionOutcome.SUCCEEDED : ExecutionOutcome.BAILED_OUT;
    }
}
