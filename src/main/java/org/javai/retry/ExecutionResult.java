package org.javai.retry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The structured result of one execution of a policy.
 *
 * <p>Running out of attempts is an ordinary outcome, not an exception: inspect
 * {@link #outcome()} and, for failure detail, {@link #history()}.
 *
 * @param finalValue The value of the most recent attempt that produced one, or the policy's initial value
 * @param attemptsMade How many times the operation was invoked
 * @param outcome Why the execution stopped
 * @param history Every attempt, in order
 */
public record ExecutionResult<T>(
        T finalValue,
        int attemptsMade,
        ExecutionOutcome outcome,
        List<Attempt<T>> history
) {

    public ExecutionResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        history = List.copyOf(Objects.requireNonNull(history, "history must not be null"));
        if (attemptsMade != history.size()) {
            throw new IllegalArgumentException(
                    "attemptsMade (" + attemptsMade + ") must equal history size (" + history.size() + ")");
        }
    }

    public Optional<Attempt<T>> lastAttempt() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    /**
     * Returns the failure of the last attempt, if that attempt failed.
     */
    public Optional<AttemptFailure> lastFailure() {
        return lastAttempt().flatMap(Attempt::failure);
    }

    /**
     * Returns every recorded failure, in attempt order.
     */
    public List<AttemptFailure> failures() {
        return history.stream()
                .map(Attempt::failure)
                .flatMap(Optional::stream)
                .toList();
    }

    public boolean isCancelled() {
        return outcome == ExecutionOutcome.CANCELLED;
    }

    /**
     * Returns this result unless the execution was cancelled.
     *
     * @return this result
     * @throws ExecutionCancelledException if the outcome is {@link ExecutionOutcome#CANCELLED}
     */
    public ExecutionResult<T> requireNotCancelled() {
        if (isCancelled()) {
            throw new ExecutionCancelledException(attemptsMade);
        }
        return this;
    }
}
