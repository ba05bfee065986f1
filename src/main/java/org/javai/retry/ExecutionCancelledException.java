package org.javai.retry;

/**
 * Thrown by {@link ExecutionResult#requireNotCancelled()} for callers that want
 * cancellation surfaced as a hard failure.
 */
public class ExecutionCancelledException extends RuntimeException {

    private final int attemptsMade;

    public ExecutionCancelledException(int attemptsMade) {
        super("Execution cancelled after " + attemptsMade + " attempt(s)");
        this.attemptsMade = attemptsMade;
    }

    public int attemptsMade() {
        return attemptsMade;
    }
}
