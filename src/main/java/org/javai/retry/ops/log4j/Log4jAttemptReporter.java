package org.javai.retry.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.retry.AttemptFailure;
import org.javai.retry.ExecutionOutcome;
import org.javai.retry.ops.AttemptReporter;

import java.time.Duration;

/**
 * Reports execution events using Log4j2.
 *
 * <p>Execution completions are logged at a level that depends on the {@link ExecutionOutcome}:
 * <ul>
 *   <li>{@code EXHAUSTED}, {@code OPERATION_FAILED} → WARN</li>
 *   <li>{@code CANCELLED} → INFO</li>
 *   <li>{@code SUCCEEDED}, {@code BAILED_OUT} → DEBUG</li>
 * </ul>
 * Failed attempts are logged at INFO, scheduled retries at DEBUG.
 */
public class Log4jAttemptReporter implements AttemptReporter {

	private static final Marker ATTEMPT_FAILED_MARKER = MarkerManager.getMarker("ATTEMPT_FAILED");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker BAILOUT_MARKER = MarkerManager.getMarker("BAILOUT");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker CANCELLED_MARKER = MarkerManager.getMarker("CANCELLED");

	private final Logger logger;

	/**
	 * Creates a Log4jAttemptReporter using the default logger name.
	 */
	public Log4jAttemptReporter() {
		this(LogManager.getLogger("org.javai.retry.AttemptReporter"));
	}

	/**
	 * Creates a Log4jAttemptReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jAttemptReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jAttemptReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jAttemptReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void attemptFailed(String policy, int attemptNumber, AttemptFailure failure) {
		logger.atInfo()
			.withMarker(ATTEMPT_FAILED_MARKER)
			.withThrowable(failure.exception())
			.log("Attempt {} of policy [{}] failed. Kind: {}, Message: {}",
				attemptNumber,
				policy,
				failure.kind(),
				failure.message());
	}

	@Override
	public void retryScheduled(String policy, int attemptNumber, Duration delay) {
		logger.atDebug()
			.withMarker(RETRY_MARKER)
			.log("Policy [{}] retrying after attempt {} in {}ms",
				policy,
				attemptNumber,
				delay.toMillis());
	}

	@Override
	public void completed(String policy, ExecutionOutcome outcome, int attemptsMade) {
		logger.atLevel(levelFor(outcome))
			.withMarker(markerFor(outcome))
			.log("Policy [{}] finished with {} after {} attempt(s)",
				policy,
				outcome,
				attemptsMade);
	}

	private static Level levelFor(ExecutionOutcome outcome) {
		return switch (outcome) {
			case EXHAUSTED, OPERATION_FAILED -> Level.WARN;
			case CANCELLED -> Level.INFO;
			case SUCCEEDED, BAILED_OUT -> Level.DEBUG;
		};
	}

	private static Marker markerFor(ExecutionOutcome outcome) {
		return switch (outcome) {
			case EXHAUSTED, OPERATION_FAILED -> RETRY_EXHAUSTED_MARKER;
			case CANCELLED -> CANCELLED_MARKER;
			case SUCCEEDED, BAILED_OUT -> BAILOUT_MARKER;
		};
	}
}
