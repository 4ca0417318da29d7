package org.neuralchilli.datahub.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One attempt at running a task for one firing cycle.
 * Every transition returns a new record; terminal records never change again,
 * and a retry is a new record with the next attempt number.
 */
public record Instance(
        InstanceKey key,
        String taskName,
        FiringCycle cycle,
        TaskPayload payload,
        RunPolicy policy,
        long sequence,
        InstanceState state,
        Map<Long, ParentLink> parents,
        Instant createdAt,
        Instant notBefore,
        Instant admittedAt,
        Instant startedAt,
        Instant killRequestedAt,
        Instant finishedAt,
        FailureReason reason,
        String message
) implements Serializable {

    public Instance {
        if (key == null) {
            throw new IllegalArgumentException("Instance key cannot be null");
        }
        if (cycle == null) {
            throw new IllegalArgumentException("Firing cycle cannot be null");
        }
        if (!cycle.id().equals(key.cycleId())) {
            throw new IllegalArgumentException(
                    "Cycle " + cycle.id() + " does not match key " + key);
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Run policy cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }

        // Sorted so that link evaluation order is reproducible
        parents = parents == null || parents.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(parents));
        if (taskName == null) {
            taskName = String.valueOf(key.taskId());
        }
    }

    /**
     * Create the first attempt of a task for a cycle
     */
    public static Instance create(Task task, FiringCycle cycle, long sequence, Instant now) {
        return new Instance(
                new InstanceKey(task.id(), cycle.id(), 1),
                task.name(),
                cycle,
                task.payload(),
                task.policy(),
                sequence,
                InstanceState.PENDING,
                Map.of(),
                now,
                null,
                null,
                null,
                null,
                null,
                null,
                null
        );
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

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isVirtual() {
        return payload.isVirtual();
    }

    /**
     * Materialize parent links: Pending -> Waiting
     */
    public Instance await(Map<Long, ParentLink> links) {
        requireState("await", InstanceState.PENDING);
        return copy(InstanceState.WAITING, links, admittedAt, startedAt, killRequestedAt,
                finishedAt, reason, message);
    }

    /**
     * Replace link statuses while still waiting
     */
    public Instance withLinks(Map<Long, ParentLink> links) {
        requireState("relink", InstanceState.WAITING);
        return copy(InstanceState.WAITING, links, admittedAt, startedAt, killRequestedAt,
                finishedAt, reason, message);
    }

    /**
     * All parent conditions satisfied: Waiting -> Ready
     */
    public Instance admit(Instant now) {
        requireState("admit", InstanceState.WAITING);
        return copy(InstanceState.READY, parents, now, startedAt, killRequestedAt,
                finishedAt, reason, message);
    }

    /**
     * Dispatched: Ready -> Running
     */
    public Instance start(Instant now) {
        requireState("start", InstanceState.READY);
        return copy(InstanceState.RUNNING, parents, admittedAt, now, killRequestedAt,
                finishedAt, reason, message);
    }

    /**
     * Record that a kill was signalled to the backend; the instance keeps running
     * until the backend acknowledges or the grace period runs out.
     */
    public Instance requestKill(Instant now) {
        requireState("request kill for", InstanceState.RUNNING);
        return copy(InstanceState.RUNNING, parents, admittedAt, startedAt, now,
                finishedAt, reason, message);
    }

    public Instance succeed(Instant now) {
        requireState("complete", InstanceState.RUNNING);
        return copy(InstanceState.SUCCEEDED, parents, admittedAt, startedAt, killRequestedAt,
                now, null, null);
    }

    /**
     * Running -> Failed on execution failure, or Ready -> Failed on pending timeout
     */
    public Instance fail(Instant now, FailureReason failureReason, String failureMessage) {
        if (state != InstanceState.RUNNING && state != InstanceState.READY) {
            throw new IllegalStateException("Cannot fail instance " + key + " in state: " + state);
        }
        return copy(InstanceState.FAILED, parents, admittedAt, startedAt, killRequestedAt,
                now, failureReason, failureMessage);
    }

    public Instance kill(Instant now, String killMessage) {
        requireState("kill", InstanceState.RUNNING);
        return copy(InstanceState.KILLED, parents, admittedAt, startedAt, killRequestedAt,
                now, FailureReason.EXECUTION_TIMEOUT, killMessage);
    }

    public Instance skip(Instant now, String skipMessage) {
        requireState("skip", InstanceState.WAITING);
        return copy(InstanceState.SKIPPED, parents, admittedAt, startedAt, killRequestedAt,
                now, FailureReason.DEPENDENCY_BLOCKED, skipMessage);
    }

    /**
     * Next attempt after a failure. Parent links are carried over; the new
     * instance stays Pending until {@code notBefore}.
     */
    public Instance retry(long newSequence, Instant now, Instant retryNotBefore) {
        if (!state.canRetry()) {
            throw new IllegalStateException("Cannot retry instance " + key + " in state: " + state);
        }
        if (!hasRetriesLeft()) {
            throw new IllegalStateException("Retry budget exhausted for " + key
                    + " (" + policy.maxAttempts() + " attempts)");
        }
        return new Instance(
                key.nextAttempt(),
                taskName,
                cycle,
                payload,
                policy,
                newSequence,
                InstanceState.PENDING,
                parents,
                now,
                retryNotBefore,
                null,
                null,
                null,
                null,
                null,
                null
        );
    }

    public boolean hasRetriesLeft() {
        return attempt() <= policy.retries();
    }

    /**
     * When a Ready instance must have been dispatched by
     */
    public Optional<Instant> pendingDeadline() {
        if (admittedAt == null || policy.pendingTimeout() == 0) {
            return Optional.empty();
        }
        return Optional.of(admittedAt.plus(policy.pendingTimeoutDuration()));
    }

    /**
     * When a Running instance must have finished by
     */
    public Optional<Instant> runningDeadline() {
        if (startedAt == null || policy.runningTimeout() == 0) {
            return Optional.empty();
        }
        return Optional.of(startedAt.plus(policy.runningTimeoutDuration()));
    }

    public boolean isKillRequested() {
        return killRequestedAt != null;
    }

    public Duration getRunDuration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    private void requireState(String action, InstanceState expected) {
        if (state != expected) {
            throw new IllegalStateException(
                    "Cannot " + action + " instance " + key + " in state: " + state);
        }
    }

    private Instance copy(
            InstanceState newState,
            Map<Long, ParentLink> newParents,
            Instant newAdmittedAt,
            Instant newStartedAt,
            Instant newKillRequestedAt,
            Instant newFinishedAt,
            FailureReason newReason,
            String newMessage
    ) {
        return new Instance(
                key, taskName, cycle, payload, policy, sequence, newState, newParents,
                createdAt, notBefore, newAdmittedAt, newStartedAt, newKillRequestedAt,
                newFinishedAt, newReason, newMessage
        );
    }
}
