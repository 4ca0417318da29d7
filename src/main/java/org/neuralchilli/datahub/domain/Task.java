package org.neuralchilli.datahub.domain;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Represents a task definition as served by the task catalog.
 * Only parent edges are declared here; children are derived by the dependency graph.
 */
public record Task(
        long id,
        String name,
        Set<Long> owners,
        TaskPayload payload,
        SchedulePeriod period,
        boolean valid,
        boolean removed,
        Map<Long, Map<String, String>> parent,  // parent id -> condition descriptor
        String queue,
        int priority,
        int pendingTimeout,  // minutes
        int runningTimeout,  // minutes
        int retries,
        int retryDelay,  // minutes
        boolean softFail
) implements Serializable {

    public Task {
        // Validation
        if (id <= 0) {
            throw new IllegalArgumentException("Task id must be positive, got: " + id);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Task payload cannot be null");
        }
        if (period == null) {
            throw new IllegalArgumentException("Task period cannot be null");
        }

        // Defaults
        owners = owners == null ? Set.of() : Set.copyOf(owners);
        if (parent == null) {
            parent = Map.of();
        } else {
            Map<Long, Map<String, String>> copy = new LinkedHashMap<>();
            parent.forEach((parentId, descriptor) ->
                    copy.put(parentId, descriptor == null ? Map.of() : Map.copyOf(descriptor)));
            parent = Map.copyOf(copy);
        }
        if (queue == null || queue.isBlank()) {
            queue = RunPolicy.DEFAULT_QUEUE;
        }
    }

    /**
     * Whether the scheduler should fire this task at all
     */
    public boolean isSchedulable() {
        return valid && !removed;
    }

    public boolean isRoot() {
        return parent.isEmpty();
    }

    public RunPolicy policy() {
        return new RunPolicy(queue, priority, pendingTimeout, runningTimeout, retries, retryDelay, softFail);
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(long id, String name) {
        return new Builder(id, name);
    }

    public static class Builder {
        private final long id;
        private final String name;
        private Set<Long> owners = Set.of();
        private TaskPayload payload = TaskPayload.virtual();
        private SchedulePeriod period = SchedulePeriod.DAILY;
        private boolean valid = true;
        private boolean removed = false;
        private final Map<Long, Map<String, String>> parent = new LinkedHashMap<>();
        private String queue = RunPolicy.DEFAULT_QUEUE;
        private int priority = 0;
        private int pendingTimeout = 0;
        private int runningTimeout = 0;
        private int retries = 0;
        private int retryDelay = 0;
        private boolean softFail = false;

        public Builder(long id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder owners(Set<Long> owners) {
            this.owners = owners;
            return this;
        }

        public Builder payload(TaskPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder real(long mirrorId, String args) {
            this.payload = TaskPayload.real(mirrorId, args);
            return this;
        }

        public Builder virtual() {
            this.payload = TaskPayload.virtual();
            return this;
        }

        public Builder period(SchedulePeriod period) {
            this.period = period;
            return this;
        }

        public Builder valid(boolean valid) {
            this.valid = valid;
            return this;
        }

        public Builder removed(boolean removed) {
            this.removed = removed;
            return this;
        }

        public Builder parent(long parentId, Map<String, String> descriptor) {
            this.parent.put(parentId, descriptor);
            return this;
        }

        public Builder dependsOn(long parentId) {
            return parent(parentId, Map.of(ConditionKind.DESCRIPTOR_KEY, "success"));
        }

        public Builder forceDependsOn(long parentId) {
            return parent(parentId, Map.of(ConditionKind.DESCRIPTOR_KEY, "force"));
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder pendingTimeout(int pendingTimeout) {
            this.pendingTimeout = pendingTimeout;
            return this;
        }

        public Builder runningTimeout(int runningTimeout) {
            this.runningTimeout = runningTimeout;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryDelay(int retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder softFail(boolean softFail) {
            this.softFail = softFail;
            return this;
        }

        public Task build() {
            return new Task(id, name, owners, payload, period, valid, removed, parent,
                    queue, priority, pendingTimeout, runningTimeout, retries, retryDelay, softFail);
        }
    }
}
