package org.javai.retry.ops;

import org.javai.retry.AttemptFailure;
import org.javai.retry.ExecutionOutcome;

import java.time.Duration;

/**
 * Receives events from the engine as an execution progresses.
 * Implementations might emit structured logs, metrics, or alerts.
 *
 * <p>Reporters are called on the executing thread and must not throw; use
 * {@link CompositeAttemptReporter} to isolate reporters that might.
 */
public interface AttemptReporter {

	/**
	 * Reports an attempt that did not produce a value.
	 *
	 * @param policy The policy name
	 * @param attemptNumber The failed attempt (1-based)
	 * @param failure What went wrong
	 */
	void attemptFailed(String policy, int attemptNumber, AttemptFailure failure);

	/**
	 * Reports that another attempt will follow after a wait.
	 *
	 * @param policy The policy name
	 * @param attemptNumber The attempt that just finished (1-based)
	 * @param delay The wait before the next attempt
	 */
	default void retryScheduled(String policy, int attemptNumber, Duration delay) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports the end of an execution.
	 *
	 * @param policy The policy name
	 * @param outcome Why the execution stopped
	 * @param attemptsMade How many attempts were made
	 */
	default void completed(String policy, ExecutionOutcome outcome, int attemptsMade) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing.
	 */
	static AttemptReporter noOp() {
		return (policy, attemptNumber, failure) -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static AttemptReporter composite(AttemptReporter... reporters) {
		return CompositeAttemptReporter.of(reporters);
	}
}
