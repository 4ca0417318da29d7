package org.neuralchilli.datahub.core;

/**
 * A catalog problem that keeps a task out of scheduling for the current tick.
 * Equal violations on consecutive ticks are the same violation.
 */
public record IntegrityViolation(
        long taskId,
        Kind kind,
        String message
) {

    public enum Kind {
        CYCLE,
        DANGLING_PARENT,
        UNKNOWN_CONDITION,
        EXCLUDED_PARENT
    }

    public IntegrityViolation {
        if (kind == null) {
            throw new IllegalArgumentException("Violation kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Violation message cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return "task " + taskId + " [" + kind + "]: " + message;
    }
}
