package org.javai.retry;

/**
 * Why a single attempt failed to produce a value.
 */
public enum FailureKind {

    /**
     * The operation threw an exception.
     */
    INVOCATION_FAILURE,

    /**
     * The operation did not complete within the per-attempt timeout.
     */
    TIMEOUT,

    /**
     * The caller cancelled the execution while the attempt was in flight.
     */
    CANCELLED
}
