package org.neuralchilli.datahub.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.datahub.domain.Instance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for scheduling activity and tick durations.
 */
@ApplicationScoped
public class SchedulerMetrics {

    private static final Logger log = LoggerFactory.getLogger(SchedulerMetrics.class);

    private final LongAdder instancesFired = new LongAdder();
    private final LongAdder instancesDispatched = new LongAdder();
    private final LongAdder instancesSucceeded = new LongAdder();
    private final LongAdder instancesFailed = new LongAdder();
    private final LongAdder instancesKilled = new LongAdder();
    private final LongAdder instancesSkipped = new LongAdder();
    private final LongAdder retriesScheduled = new LongAdder();
    private final LongAdder pendingTimeouts = new LongAdder();
    private final LongAdder integrityViolations = new LongAdder();
    private final LongAdder submitRejections = new LongAdder();

    private final TickTimes tickTimes = new TickTimes();

    public void recordFired() {
        instancesFired.increment();
    }

    public void recordDispatched() {
        instancesDispatched.increment();
    }

    public void recordSubmitRejected() {
        submitRejections.increment();
    }

    public void recordRetryScheduled() {
        retriesScheduled.increment();
    }

    public void recordPendingTimeout() {
        pendingTimeouts.increment();
    }

    public void recordIntegrityViolation() {
        integrityViolations.increment();
    }

    /**
     * Count a terminal transition by its state
     */
    public void recordFinished(Instance instance) {
        switch (instance.state()) {
            case SUCCEEDED -> instancesSucceeded.increment();
            case FAILED -> instancesFailed.increment();
            case KILLED -> instancesKilled.increment();
            case SKIPPED -> instancesSkipped.increment();
            default -> log.warn("Not a terminal instance: {} in {}", instance.key(), instance.state());
        }
    }

    /**
     * Get success rate over finished attempts, in percent.
     */
    public double getSuccessRate() {
        long succeeded = instancesSucceeded.sum();
        long total = succeeded + instancesFailed.sum() + instancesKilled.sum();
        return total > 0 ? (succeeded * 100.0) / total : 0.0;
    }

    /**
     * Record the wall time of one tracker pass
     */
    public void recordTick(Duration elapsed) {
        tickTimes.add(elapsed.toNanos());
    }

    public TickTiming getTickTiming() {
        return tickTimes.snapshot();
    }

    /**
     * Running totals for tick durations. Ticks come from a single thread,
     * the lock only guards readers.
     */
    private static final class TickTimes {
        private long ticks;
        private long totalNanos;
        private long shortestNanos = Long.MAX_VALUE;
        private long longestNanos;

        synchronized void add(long nanos) {
            ticks++;
            totalNanos += nanos;
            shortestNanos = Math.min(shortestNanos, nanos);
            longestNanos = Math.max(longestNanos, nanos);
        }

        synchronized TickTiming snapshot() {
            if (ticks == 0) {
                return TickTiming.NONE;
            }
            return new TickTiming(ticks,
                    Duration.ofNanos(totalNanos / ticks),
                    Duration.ofNanos(shortestNanos),
                    Duration.ofNanos(longestNanos));
        }

        synchronized void clear() {
            ticks = 0;
            totalNanos = 0;
            shortestNanos = Long.MAX_VALUE;
            longestNanos = 0;
        }
    }

    public record TickTiming(long ticks, Duration average, Duration shortest, Duration longest) {

        static final TickTiming NONE = new TickTiming(0, Duration.ZERO, Duration.ZERO, Duration.ZERO);

        @Override
        public String toString() {
            return String.format("%d, avg %dms (shortest %dms, longest %dms)",
                    ticks, average.toMillis(), shortest.toMillis(), longest.toMillis());
        }
    }

    public SchedulerReport getReport() {
        return new SchedulerReport(
                instancesFired.sum(),
                instancesDispatched.sum(),
                submitRejections.sum(),
                instancesSucceeded.sum(),
                instancesFailed.sum(),
                instancesKilled.sum(),
                instancesSkipped.sum(),
                retriesScheduled.sum(),
                pendingTimeouts.sum(),
                integrityViolations.sum(),
                getSuccessRate(),
                getTickTiming()
        );
    }

    /**
     * Scheduler report snapshot.
     */
    public record SchedulerReport(
            long fired,
            long dispatched,
            long submitRejections,
            long succeeded,
            long failed,
            long killed,
            long skipped,
            long retries,
            long pendingTimeouts,
            long integrityViolations,
            double successRate,
            TickTiming tickTiming
    ) {
        @Override
        public String toString() {
            return String.format("""
                Scheduler Report:
                =================
                Instances:
                  Fired: %d, Dispatched: %d (rejected submits: %d)
                  Succeeded: %d, Failed: %d, Killed: %d, Skipped: %d
                  Success Rate: %.1f%%
                  Retries: %d, Pending Timeouts: %d

                Catalog:
                  Integrity Violations: %d

                Tracker:
                  Ticks: %s
                """,
                    fired, dispatched, submitRejections,
                    succeeded, failed, killed, skipped,
                    successRate,
                    retries, pendingTimeouts,
                    integrityViolations,
                    tickTiming
            );
        }
    }

    /**
     * Zero every counter
     */
    public void reset() {
        instancesFired.reset();
        instancesDispatched.reset();
        instancesSucceeded.reset();
        instancesFailed.reset();
        instancesKilled.reset();
        instancesSkipped.reset();
        retriesScheduled.reset();
        pendingTimeouts.reset();
        integrityViolations.reset();
        submitRejections.reset();
        tickTimes.clear();
        log.info("Scheduler metrics reset");
    }

    public void logReport() {
        log.info("\n{}", getReport());
    }
}
