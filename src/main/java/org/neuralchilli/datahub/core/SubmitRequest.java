package org.neuralchilli.datahub.core;

import org.neuralchilli.datahub.domain.InstanceKey;

import java.io.Serial;
import java.io.Serializable;

/**
 * Message handed to the execution backend for one attempt.
 * Args are already resolved against the firing cycle.
 */
public final class SubmitRequest implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final InstanceKey key;
    private final String taskName;
    private final String queue;
    private final long mirrorId;
    private final String args;
    private final int runningTimeoutMinutes;

    public SubmitRequest(
            InstanceKey key,
            String taskName,
            String queue,
            long mirrorId,
            String args,
            int runningTimeoutMinutes
    ) {
        if (key == null) {
            throw new IllegalArgumentException("Instance key cannot be null");
        }
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("Queue cannot be null or empty");
        }

        this.key = key;
        this.taskName = taskName;
        this.queue = queue;
        this.mirrorId = mirrorId;
        this.args = args != null ? args : "";
        this.runningTimeoutMinutes = runningTimeoutMinutes;
    }

    public InstanceKey key() {
        return key;
    }

    public long taskId() {
        return key.taskId();
    }

    public String cycleId() {
        return key.cycleId();
    }

    public int attempt() {
        return key.attempt();
    }

    public String taskName() {
        return taskName;
    }

    public String queue() {
        return queue;
    }

    public long mirrorId() {
        return mirrorId;
    }

    public String args() {
        return args;
    }

    public int runningTimeoutMinutes() {
        return runningTimeoutMinutes;
    }

    @Override
    public String toString() {
        return "SubmitRequest[" +
                "key=" + key +
                ", taskName=" + taskName +
                ", queue=" + queue +
                ", mirrorId=" + mirrorId +
                ", args=" + args +
                "]";
    }
}
