package org.javai.retry.engine;

import org.javai.retry.Attempt;
import org.javai.retry.AttemptFailure;
import org.javai.retry.AttemptResult;
import org.javai.retry.ExecutionOutcome;
import org.javai.retry.ExecutionResult;
import org.javai.retry.FailureKind;
import org.javai.retry.PolicyConfig;
import org.javai.retry.ops.AttemptReporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Drives the attempt loop of a {@link PolicyConfig}.
 *
 * <p>Each execution invokes the operation, evaluates the bailout predicate on the value it
 * produced, and waits for the backoff delay before the next attempt, until the predicate
 * holds, the attempt budget is spent, or the caller cancels. Failed attempts are recorded in
 * the result's history rather than thrown.
 *
 * <p>The engine keeps no per-execution state: the attempt counter, history and current value
 * live in the {@code execute} call, so one engine may run any number of executions concurrently.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * try (ExecutionEngine engine = ExecutionEngine.builder()
 *         .reporter(new Log4jAttemptReporter())
 *         .build()) {
 *     ExecutionResult<Response> result = engine.execute(policy, token);
 *     if (result.outcome() == ExecutionOutcome.EXHAUSTED) {
 *         result.lastFailure().ifPresent(failure -> ...);
 *     }
 * }
 * }</pre>
 */
public final class ExecutionEngine implements AutoCloseable {

    private final AttemptReporter reporter;
    private final AttemptInvoker invoker;
    private final Sleeper sleeper;

    private ExecutionEngine(AttemptReporter reporter, ExecutorService timeoutExecutor, Sleeper sleeper) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.invoker = new AttemptInvoker(timeoutExecutor);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Creates an engine with no reporting and its own timeout executor.
     */
    public static ExecutionEngine create() {
        return builder().build();
    }

    /**
     * Creates a builder for configuring an ExecutionEngine instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring an ExecutionEngine instance.
     */
    public static final class Builder {
        private AttemptReporter reporter = AttemptReporter.noOp();
        private ExecutorService timeoutExecutor;
        private Sleeper sleeper = Sleeper.cancellable();

        private Builder() {}

        /**
         * Sets the reporter for execution events (optional, defaults to no-op).
         *
         * @param reporter the reporter for execution events
         * @return this builder
         */
        public Builder reporter(AttemptReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the executor that runs attempts bounded by a per-attempt timeout (optional).
         * The engine never shuts down an executor supplied here. When unset, the engine creates
         * a pool of daemon threads on first use and shuts it down in {@link ExecutionEngine#close()}.
         *
         * @param executor the executor for timed attempts
         * @return this builder
         */
        public Builder timeoutExecutor(ExecutorService executor) {
            this.timeoutExecutor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public ExecutionEngine build() {
            return new ExecutionEngine(reporter, timeoutExecutor, sleeper);
        }
    }

    /**
     * Executes a policy that cannot be cancelled.
     *
     * @see #execute(PolicyConfig, CancellationToken)
     */
    public <T> ExecutionResult<T> execute(PolicyConfig<T> config) {
        return execute(config, CancellationToken.create());
    }

    /**
     * Executes a policy until its bailout predicate holds, its attempts are spent, or the token
     * is cancelled.
     *
     * <p>Cancelling the token while an attempt runs interrupts the thread running it and records
     * the attempt as cancelled. Interrupting the calling thread during the wait between attempts
     * has the same effect as cancelling the token; the interrupt flag is preserved.
     *
     * @param config the policy to execute
     * @param token the caller's cancellation signal
     * @return the structured result; never null
     * @throws IllegalStateException if the backoff strategy returns a negative delay
     */
    public <T> ExecutionResult<T> execute(PolicyConfig<T> config, CancellationToken token) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(token, "token must not be null");

        Duration timeout = config.perAttemptTimeout().orElse(null);
        T current = config.initialValue();
        List<Attempt<T>> history = new ArrayList<>();
        ExecutionOutcome outcome;
        int attempt = 0;

        while (true) {
            if (token.isCancelled()) {
                outcome = ExecutionOutcome.CANCELLED;
                break;
            }
            attempt++;

            long startedAt = System.nanoTime();
            AttemptResult<T> result = invoker.invoke(config.operation(), timeout, token);
            history.add(new Attempt<>(attempt, result, Duration.ofNanos(System.nanoTime() - startedAt)));

            if (result instanceof AttemptResult.Value<T> value) {
                current = value.value();
                if (config.bailout().shouldBailOut(current)) {
                    outcome = config.bailoutOutcome();
                    break;
                }
            } else if (result instanceof AttemptResult.Failed<T> failed) {
                AttemptFailure failure = failed.failure();
                reporter.attemptFailed(config.name(), attempt, failure);
                if (failure.kind() == FailureKind.CANCELLED) {
                    outcome = ExecutionOutcome.CANCELLED;
                    break;
                }
                if (config.treatInvocationErrorAsBailout()) {
                    outcome = ExecutionOutcome.OPERATION_FAILED;
                    break;
                }
            }

            if (attempt == config.maxAttempts()) {
                outcome = ExecutionOutcome.EXHAUSTED;
                break;
            }

            Duration delay = config.backoff().delayFor(attempt);
            if (delay == null || delay.isNegative()) {
                throw new IllegalStateException(
                        "backoff returned an invalid delay for attempt " + attempt + ": " + delay);
            }
            reporter.retryScheduled(config.name(), attempt, delay);
            if (!waitBeforeRetry(delay, token)) {
                outcome = ExecutionOutcome.CANCELLED;
                break;
            }
        }

        reporter.completed(config.name(), outcome, history.size());
        return new ExecutionResult<>(current, history.size(), outcome, history);
    }

    /**
     * @return false if the wait was cut short by cancellation or interruption
     */
    private boolean waitBeforeRetry(Duration delay, CancellationToken token) {
        try {
            return !sleeper.sleep(delay, token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Shuts down the timeout executor if this engine created it.
     */
    @Override
    public void close() {
        invoker.shutdown();
    }
}
