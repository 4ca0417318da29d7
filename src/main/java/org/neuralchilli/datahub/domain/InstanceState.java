package org.neuralchilli.datahub.domain;

/**
 * Lifecycle state of an instance.
 */
public enum InstanceState {
    /**
     * Created, parent links not yet materialized (or a retry waiting out its delay)
     */
    PENDING,

    /**
     * Waiting for parent conditions
     */
    WAITING,

    /**
     * All parent conditions satisfied, waiting for queue capacity
     */
    READY,

    /**
     * Handed to the execution backend
     */
    RUNNING,

    SUCCEEDED,

    FAILED,

    /**
     * Stopped after exceeding its running timeout
     */
    KILLED,

    /**
     * Never admitted because a required parent did not succeed
     */
    SKIPPED;

    /**
     * Check if this is a terminal state (instance finished)
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == KILLED || this == SKIPPED;
    }

    /**
     * Failed and Killed are handled identically for retries and downstream propagation
     */
    public boolean isFailure() {
        return this == FAILED || this == KILLED;
    }

    /**
     * Check if the instance can be retried
     */
    public boolean canRetry() {
        return isFailure();
    }
}
