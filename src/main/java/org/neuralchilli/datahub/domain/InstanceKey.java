package org.neuralchilli.datahub.domain;

import java.io.Serializable;

/**
 * Identity of one attempt: (task, cycle, attempt).
 * The string forms are used as Hazelcast map keys.
 */
public record InstanceKey(
        long taskId,
        String cycleId,
        int attempt
) implements Serializable {

    public InstanceKey {
        if (taskId <= 0) {
            throw new IllegalArgumentException("Task id must be positive");
        }
        if (cycleId == null || cycleId.isBlank()) {
            throw new IllegalArgumentException("Cycle id cannot be null or empty");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1");
        }
    }

    /**
     * Key of the retry chain this attempt belongs to
     */
    public String lineage() {
        return lineage(taskId, cycleId);
    }

    public static String lineage(long taskId, String cycleId) {
        return taskId + "@" + cycleId;
    }

    public InstanceKey nextAttempt() {
        return new InstanceKey(taskId, cycleId, attempt + 1);
    }

    public String id() {
        return lineage() + "#" + attempt;
    }

    @Override
    public String toString() {
        return id();
    }
}
