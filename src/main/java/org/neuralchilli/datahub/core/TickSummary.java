package org.neuralchilli.datahub.core;

import java.time.Duration;
import java.time.Instant;

/**
 * What one tracker tick did.
 */
public record TickSummary(
        Instant at,
        int tasks,
        int newViolations,
        int reportsApplied,
        int released,
        int fired,
        int resolved,
        int monitored,
        int dispatched,
        Duration duration
) {

    public boolean hasActivity() {
        return newViolations + reportsApplied + released + fired + resolved + monitored + dispatched > 0;
    }

    @Override
    public String toString() {
        return String.format(
                "tasks=%d, violations=%d, reports=%d, released=%d, fired=%d, resolved=%d, monitored=%d, dispatched=%d (%dms)",
                tasks, newViolations, reportsApplied, released, fired, resolved, monitored, dispatched,
                duration.toMillis()
        );
    }

    static Builder builder(Instant at) {
        return new Builder(at);
    }

    static class Builder {
        private final Instant at;
        private int tasks;
        private int newViolations;
        private int reportsApplied;
        private int released;
        private int fired;
        private int resolved;
        private int monitored;
        private int dispatched;
        private Duration duration = Duration.ZERO;

        private Builder(Instant at) {
            this.at = at;
        }

        Builder tasks(int tasks) {
            this.tasks = tasks;
            return this;
        }

        Builder violations(int newViolations) {
            this.newViolations = newViolations;
            return this;
        }

        Builder reports(int reportsApplied) {
            this.reportsApplied = reportsApplied;
            return this;
        }

        Builder released(int released) {
            this.released = released;
            return this;
        }

        Builder fired(int fired) {
            this.fired = fired;
            return this;
        }

        Builder resolved(int resolved) {
            this.resolved = resolved;
            return this;
        }

        Builder monitored(int monitored) {
            this.monitored = monitored;
            return this;
        }

        Builder dispatched(int dispatched) {
            this.dispatched = dispatched;
            return this;
        }

        Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        TickSummary build() {
            return new TickSummary(at, tasks, newViolations, reportsApplied, released,
                    fired, resolved, monitored, dispatched, duration);
        }
    }
}
