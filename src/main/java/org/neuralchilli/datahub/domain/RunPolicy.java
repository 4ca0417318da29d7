package org.neuralchilli.datahub.domain;

import java.io.Serializable;
import java.time.Duration;

/**
 * Admission and failure policy of a task, copied onto every instance when it fires.
 * Timeouts and delays are in minutes; a timeout of 0 disables it.
 */
public record RunPolicy(
        String queue,
        int priority,
        int pendingTimeout,
        int runningTimeout,
        int retries,
        int retryDelay,
        boolean softFail
) implements Serializable {

    public static final String DEFAULT_QUEUE = "default";

    public RunPolicy {
        if (queue == null || queue.isBlank()) {
            queue = DEFAULT_QUEUE;
        }
        if (pendingTimeout < 0) {
            throw new IllegalArgumentException("Pending timeout must be >= 0");
        }
        if (runningTimeout < 0) {
            throw new IllegalArgumentException("Running timeout must be >= 0");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("Retries must be >= 0");
        }
        if (retryDelay < 0) {
            throw new IllegalArgumentException("Retry delay must be >= 0");
        }
    }

    public Duration pendingTimeoutDuration() {
        return Duration.ofMinutes(pendingTimeout);
    }

    public Duration runningTimeoutDuration() {
        return Duration.ofMinutes(runningTimeout);
    }

    public Duration retryDelayDuration() {
        return Duration.ofMinutes(retryDelay);
    }

    /**
     * Attempts are numbered from 1, so a budget of N retries allows N + 1 attempts.
     */
    public int maxAttempts() {
        return retries + 1;
    }
}
