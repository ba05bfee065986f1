package org.javai.retry.ops;

import org.javai.retry.AttemptFailure;
import org.javai.retry.ExecutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link AttemptReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the exception is
 * logged and the remaining reporters still run; the execution itself is never affected.
 *
 * <p>Example usage:
 * <pre>{@code
 * AttemptReporter reporter = CompositeAttemptReporter.of(
 *     new Log4jAttemptReporter(),
 *     new MetricsAttemptReporter("myapp")
 * );
 * }</pre>
 */
public final class CompositeAttemptReporter implements AttemptReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeAttemptReporter.class);

	private final List<AttemptReporter> reporters;

	private CompositeAttemptReporter(List<AttemptReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeAttemptReporter of(AttemptReporter... reporters) {
		return new CompositeAttemptReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeAttemptReporter of(Collection<? extends AttemptReporter> reporters) {
		return new CompositeAttemptReporter(new ArrayList<>(reporters));
	}

	@Override
	public void attemptFailed(String policy, int attemptNumber, AttemptFailure failure) {
		fanOut("attemptFailed", reporter -> reporter.attemptFailed(policy, attemptNumber, failure));
	}

	@Override
	public void retryScheduled(String policy, int attemptNumber, Duration delay) {
		fanOut("retryScheduled", reporter -> reporter.retryScheduled(policy, attemptNumber, delay));
	}

	@Override
	public void completed(String policy, ExecutionOutcome outcome, int attemptsMade) {
		fanOut("completed", reporter -> reporter.completed(policy, outcome, attemptsMade));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<AttemptReporter> call) {
		for (AttemptReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				LOG.warn("AttemptReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}
}
