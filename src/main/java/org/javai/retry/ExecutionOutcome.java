package org.javai.retry;

/**
 * Why an execution stopped.
 *
 * <p>The engine does not judge whether a bailout is good or bad news. {@link #BAILED_OUT}
 * only says the predicate held; policies built with
 * {@link PolicyBuilder#bailoutMeansSuccess()} report {@link #SUCCEEDED} instead.
 */
public enum ExecutionOutcome {

    /** The bailout predicate held and the policy treats that as success. */
    SUCCEEDED,

    /** The bailout predicate held. */
    BAILED_OUT,

    /** Every allowed attempt was made without the predicate holding. */
    EXHAUSTED,

    /** An attempt failed and the policy treats invocation errors as a reason to stop. */
    OPERATION_FAILED,

    /** The caller cancelled the execution. */
    CANCELLED;

    /**
     * True when the predicate ended the execution, whichever way the policy reads it.
     */
    public boolean stoppedByPredicate() {
        return this == SUCCEEDED || this == BAILED_OUT;
    }
}
