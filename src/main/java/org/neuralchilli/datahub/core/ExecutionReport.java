package org.neuralchilli.datahub.core;

import org.neuralchilli.datahub.domain.InstanceKey;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of one attempt as reported by the execution backend.
 * Reports are queued and applied by the tracker at the start of its next tick.
 */
public final class ExecutionReport implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    private final InstanceKey key;
    private final Outcome outcome;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String message;

    public ExecutionReport(
            InstanceKey key,
            Outcome outcome,
            Instant startedAt,
            Instant finishedAt,
            String message
    ) {
        if (key == null) {
            throw new IllegalArgumentException("Instance key cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("Outcome cannot be null");
        }
        this.key = key;
        this.outcome = outcome;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.message = message;
    }

    public static ExecutionReport success(InstanceKey key, Instant startedAt, Instant finishedAt) {
        return new ExecutionReport(key, Outcome.SUCCESS, startedAt, finishedAt, null);
    }

    public static ExecutionReport failure(InstanceKey key, Instant startedAt, Instant finishedAt, String message) {
        return new ExecutionReport(key, Outcome.FAILURE, startedAt, finishedAt, message);
    }

    public InstanceKey key() {
        return key;
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return "ExecutionReport[key=" + key + ", outcome=" + outcome + ", message=" + message + "]";
    }
}
