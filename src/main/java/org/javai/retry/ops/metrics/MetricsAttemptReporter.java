package org.javai.retry.ops.metrics;

import org.javai.retry.AttemptFailure;
import org.javai.retry.ExecutionOutcome;
import org.javai.retry.ops.AttemptReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports execution events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event becomes one JSON object on one line, suitable for metrics aggregation.
 * The tracking key is the policy name, prefixed by an optional namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"attempt_failed","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.fetch-user","attemptNumber":"2","kind":"TIMEOUT",...}
 * }</pre>
 */
public class MetricsAttemptReporter implements AttemptReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.retry.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsAttemptReporter with no namespace and the default logger.
	 */
	public MetricsAttemptReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsAttemptReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsAttemptReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsAttemptReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsAttemptReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void attemptFailed(String policy, int attemptNumber, AttemptFailure failure) {
		StringBuilder sb = startEvent("attempt_failed", policy);
		appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
		appendField(sb, "kind", failure.kind().name());
		appendField(sb, "message", failure.message());
		if (failure.exception() != null) {
			appendField(sb, "exception", failure.exception().getClass().getName());
		}
		emit(sb);
	}

	@Override
	public void retryScheduled(String policy, int attemptNumber, Duration delay) {
		StringBuilder sb = startEvent("retry_scheduled", policy);
		appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
		appendField(sb, "delayMs", String.valueOf(delay.toMillis()));
		emit(sb);
	}

	@Override
	public void completed(String policy, ExecutionOutcome outcome, int attemptsMade) {
		StringBuilder sb = startEvent("completed", policy);
		appendField(sb, "outcome", outcome.name());
		appendField(sb, "attemptsMade", String.valueOf(attemptsMade));
		emit(sb);
	}

	String buildTrackingKey(String policy) {
		if (namespace == null) {
			return policy;
		}
		return namespace + "." + policy;
	}

	private StringBuilder startEvent(String eventType, String policy) {
		StringBuilder sb = new StringBuilder("{");
		sb.append("\"eventType\":\"").append(eventType).append("\"");
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()));
		appendField(sb, "trackingKey", buildTrackingKey(policy));
		return sb;
	}

	private void emit(StringBuilder sb) {
		sb.append("}");
		logger.info(sb.toString());
	}

	private static void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		StringBuilder escaped = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\\' -> escaped.append("\\\\");
				case '"' -> escaped.append("\\\"");
				case '\n' -> escaped.append("\\n");
				case '\r' -> escaped.append("\\r");
				case '\t' -> escaped.append("\\t");
				default -> {
					if (c < 0x20) {
						escaped.append(String.format("\\u%04x", (int) c));
					} else {
						escaped.append(c);
					}
				}
			}
		}
		return escaped.toString();
	}
}
