package org.javai.retry;

import org.javai.retry.backoff.BackoffStrategy;
import org.javai.retry.bailout.BailoutEvaluator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates the settings of a {@link PolicyConfig}.
 *
 * <p>Setters may be called in any order and any number of times; the last call wins. Nothing is
 * validated until {@link #build()}, which reports every problem in one {@link ConfigurationError}.
 * Passing null to a setter is a programming error and fails immediately.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * PolicyConfig<Response> policy = PolicyBuilder.<Response>create()
 *     .named("fetch-user")
 *     .withOperation(() -> client.fetch(userId))
 *     .withBailoutWhen(response -> response.status() != 503)
 *     .withBackoff(BackoffStrategy.exponential(Duration.ofMillis(100)).withCap(Duration.ofSeconds(2)))
 *     .withPerAttemptTimeout(Duration.ofSeconds(1))
 *     .atMost(5)
 *     .build();
 * }</pre>
 *
 * @param <T> the operation's value type
 */
public final class PolicyBuilder<T> {

    private static final String DEFAULT_NAME = "policy";

    private String name = DEFAULT_NAME;
    private T initialValue;
    private Operation<T> operation;
    private BailoutEvaluator<T> bailout;
    private BackoffStrategy backoff;
    private Integer maxAttempts;
    private Duration perAttemptTimeout;
    private boolean treatInvocationErrorAsBailout;
    private boolean bailoutMeansSuccess;

    private PolicyBuilder() {}

    public static <T> PolicyBuilder<T> create() {
        return new PolicyBuilder<>();
    }

    /**
     * Sets the label used when reporting (optional, defaults to {@code "policy"}).
     */
    public PolicyBuilder<T> named(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    /**
     * Sets the value reported as the final value when no attempt produces one (optional, defaults to null).
     */
    public PolicyBuilder<T> startWith(T initialValue) {
        this.initialValue = initialValue;
        return this;
    }

    /**
     * Sets the operation to retry (required).
     */
    public PolicyBuilder<T> withOperation(Operation<T> operation) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        return this;
    }

    /**
     * Sets the stopping condition (optional, defaults to {@link BailoutEvaluator#never()}).
     */
    public PolicyBuilder<T> withBailoutWhen(BailoutEvaluator<? super T> bailout) {
        Objects.requireNonNull(bailout, "bailout must not be null");
        this.bailout = bailout::shouldBailOut;
        return this;
    }

    /**
     * Sets the wait between attempts (optional, defaults to {@link BackoffStrategy#none()}).
     */
    public PolicyBuilder<T> withBackoff(BackoffStrategy backoff) {
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        return this;
    }

    /**
     * Sets the attempt budget (required, at least 1).
     */
    public PolicyBuilder<T> atMost(int maxAttempts) {
        this.maxAttempts = maxAttempts;
        return this;
    }

    /**
     * Bounds every single invocation (optional, defaults to unbounded).
     */
    public PolicyBuilder<T> withPerAttemptTimeout(Duration timeout) {
        this.perAttemptTimeout = Objects.requireNonNull(timeout, "timeout must not be null");
        return this;
    }

    /**
     * Stops at the first failed attempt with {@link ExecutionOutcome#OPERATION_FAILED}
     * instead of retrying it (optional, defaults to retrying).
     */
    public PolicyBuilder<T> treatInvocationErrorAsBailout() {
        this.treatInvocationErrorAsBailout = true;
        return this;
    }

    /**
     * Reports {@link ExecutionOutcome#SUCCEEDED} when the bailout predicate holds
     * (optional, defaults to {@link ExecutionOutcome#BAILED_OUT}).
     */
    public PolicyBuilder<T> bailoutMeansSuccess() {
        this.bailoutMeansSuccess = true;
        return this;
    }

    /**
     * Validates the accumulated settings and produces an immutable policy.
     *
     * <p>Defaults applied to optional settings: bailout never, zero backoff, no timeout,
     * invocation errors retried, bailout reported as {@link ExecutionOutcome#BAILED_OUT}.
     *
     * @return the configured policy
     * @throws ConfigurationError listing every missing or invalid setting
     */
    public PolicyConfig<T> build() {
        List<String> problems = new ArrayList<>();
        if (name.isBlank()) {
            problems.add("name must not be blank");
        }
        if (operation == null) {
            problems.add("operation is required");
        }
        if (maxAttempts == null) {
            problems.add("maxAttempts is required");
        } else if (maxAttempts < 1) {
            problems.add("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (perAttemptTimeout != null && (perAttemptTimeout.isZero() || perAttemptTimeout.isNegative())) {
            problems.add("perAttemptTimeout must be positive, was: " + perAttemptTimeout);
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationError(problems);
        }

        return new PolicyConfig<>(
                name,
                initialValue,
                operation,
                bailout != null ? bailout : BailoutEvaluator.never(),
                backoff != null ? backoff : BackoffStrategy.none(),
                maxAttempts,
                Optional.ofNullable(perAttemptTimeout),
                treatInvocationErrorAsBailout,
                bailoutMeansSuccess
        );
    }
}
