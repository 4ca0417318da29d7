package org.neuralchilli.datahub.domain;

/**
 * Why an instance ended in Failed, Killed or Skipped.
 */
public enum FailureReason {
    ADMISSION_TIMEOUT("pending timeout", true),
    EXECUTION_FAILURE("execution failure", true),
    EXECUTION_TIMEOUT("running timeout", true),
    DEPENDENCY_BLOCKED("upstream failed", false);

    private final String description;
    private final boolean retryable;

    FailureReason(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String description() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public String toString() {
        return description;
    }
}
