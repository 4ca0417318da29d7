package org.neuralchilli.datahub.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.datahub.config.SchedulerConfig;
import org.neuralchilli.datahub.domain.FailureReason;
import org.neuralchilli.datahub.domain.Instance;
import org.neuralchilli.datahub.domain.InstanceState;
import org.neuralchilli.datahub.monitoring.AuditSink;
import org.neuralchilli.datahub.monitoring.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Deadlines, retries and backend reports.
 * <p>
 * Every terminal transition other than Skipped goes through {@link #complete}:
 * a failure with retry budget left produces the next attempt and is not
 * propagated; anything else is final and fans out to the children.
 */
@ApplicationScoped
public class LifecycleMonitor {

    private static final Logger log = LoggerFactory.getLogger(LifecycleMonitor.class);

    @Inject
    InstanceStore store;

    @Inject
    DependencyResolver resolver;

    @Inject
    ExecutionBackend backend;

    @Inject
    AuditSink auditSink;

    @Inject
    SchedulerMetrics metrics;

    @Inject
    SchedulerConfig config;

    /**
     * Enforce pending and running timeouts, then release due retries.
     *
     * @return number of instances that changed state
     */
    public int check(DependencyGraph graph, Instant now) {
        int changed = 0;

        for (Instance ready : store.active(InstanceState.READY)) {
            try {
                Optional<Instant> deadline = ready.pendingDeadline();
                if (deadline.isPresent() && !now.isBefore(deadline.get())) {
                    metrics.recordPendingTimeout();
                    complete(ready.fail(now, FailureReason.ADMISSION_TIMEOUT,
                            "not dispatched within " + ready.policy().pendingTimeout() + " minute(s)"), graph, now);
                    changed++;
                }
            } catch (Exception e) {
                log.error("Failed to check pending timeout of {}", ready.key(), e);
            }
        }

        for (Instance running : store.active(InstanceState.RUNNING)) {
            try {
                if (checkRunning(running, graph, now)) {
                    changed++;
                }
            } catch (Exception e) {
                log.error("Failed to check running timeout of {}", running.key(), e);
            }
        }

        for (Instance pending : store.active(InstanceState.PENDING)) {
            try {
                if (pending.notBefore() == null || !now.isBefore(pending.notBefore())) {
                    Instance waiting = pending.await(pending.parents());
                    store.save(waiting);
                    log.info("Retry {} is due", waiting.key());
                    resolver.evaluate(waiting, graph, now);
                    changed++;
                }
            } catch (Exception e) {
                log.error("Failed to release retry {}", pending.key(), e);
            }
        }

        return changed;
    }

    private boolean checkRunning(Instance running, DependencyGraph graph, Instant now) {
        Optional<Instant> deadline = running.runningDeadline();
        if (deadline.isEmpty() || now.isBefore(deadline.get())) {
            return false;
        }

        if (!running.isKillRequested()) {
            log.warn("{} exceeded running timeout of {} minute(s), requesting kill",
                    running.key(), running.policy().runningTimeout());
            try {
                backend.kill(running.key());
            } catch (Exception e) {
                // The grace period still applies
                log.error("Kill request for {} failed", running.key(), e);
            }
            store.save(running.requestKill(now));
            return false;
        }

        Instant graceEnd = running.killRequestedAt().plus(config.killGracePeriod());
        if (now.isBefore(graceEnd)) {
            return false;
        }

        log.warn("{} not acknowledged within {}, marking killed", running.key(), config.killGracePeriod());
        complete(running.kill(now, "running timeout, kill not acknowledged"), graph, now);
        return true;
    }

    /**
     * Apply one backend report. Reports for unknown instances, or for
     * instances no longer Running, are ignored.
     *
     * @return whether the report changed an instance
     */
    public boolean applyReport(ExecutionReport report, DependencyGraph graph, Instant now) {
        Optional<Instance> found = store.find(report.key());
        if (found.isEmpty()) {
            log.warn("Ignoring report for unknown instance: {}", report);
            return false;
        }

        Instance running = found.get();
        if (running.state() != InstanceState.RUNNING) {
            log.warn("Ignoring report for {} in state {}: {}", running.key(), running.state(), report);
            return false;
        }

        Instant finishedAt = report.finishedAt() != null ? report.finishedAt() : now;
        Instance finished;
        if (report.isSuccess()) {
            finished = running.succeed(finishedAt);
        } else if (running.isKillRequested()) {
            finished = running.kill(finishedAt, "running timeout, killed by backend");
        } else {
            finished = running.fail(finishedAt, FailureReason.EXECUTION_FAILURE, report.message());
        }

        complete(finished, graph, now);
        return true;
    }

    /**
     * Persist a Succeeded, Failed or Killed instance and either schedule the
     * next attempt or propagate the final state to the children.
     */
    public void complete(Instance terminal, DependencyGraph graph, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalStateException("Instance " + terminal.key() + " is not terminal: " + terminal.state());
        }

        store.save(terminal);
        metrics.recordFinished(terminal);

        if (terminal.state().canRetry() && terminal.hasRetriesLeft()) {
            Instant notBefore = terminal.finishedAt().plus(terminal.policy().retryDelayDuration());
            Instance retry = terminal.retry(store.nextSequence(), now, notBefore);
            store.save(retry);
            metrics.recordRetryScheduled();
            auditSink.instanceFinished(terminal, true);

            log.info("{} {} ({}), attempt {} of {} scheduled not before {}",
                    terminal.key(), terminal.state(), terminal.reason(),
                    retry.attempt(), terminal.policy().maxAttempts(), notBefore);
            return;
        }

        auditSink.instanceFinished(terminal, false);
        if (terminal.state() == InstanceState.SUCCEEDED) {
            log.info("{} succeeded", terminal.key());
        } else {
            log.warn("{} {} ({}): {}", terminal.key(), terminal.state(), terminal.reason(), terminal.message());
        }

        resolver.onTerminal(terminal, graph, now);
    }
}
