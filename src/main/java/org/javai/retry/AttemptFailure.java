package org.javai.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Details of an attempt that did not produce a value.
 *
 * @param kind What went wrong
 * @param message Human-readable description
 * @param exception The underlying exception (may be null)
 */
public record AttemptFailure(FailureKind kind, String message, Throwable exception) {

    public AttemptFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates a failure for an operation that threw.
     */
    public static AttemptFailure invocation(Throwable exception) {
        Objects.requireNonNull(exception, "exception must not be null");
        return new AttemptFailure(FailureKind.INVOCATION_FAILURE, messageFor(exception), exception);
    }

    /**
     * Creates a failure for an attempt that exceeded its timeout.
     */
    public static AttemptFailure timeout(Duration limit) {
        Objects.requireNonNull(limit, "limit must not be null");
        return new AttemptFailure(FailureKind.TIMEOUT, "Attempt timed out after " + limit.toMillis() + "ms", null);
    }

    /**
     * Creates a failure for an attempt abandoned because the execution was cancelled.
     */
    public static AttemptFailure cancelled() {
        return new AttemptFailure(FailureKind.CANCELLED, "Attempt cancelled", null);
    }

    private static String messageFor(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
