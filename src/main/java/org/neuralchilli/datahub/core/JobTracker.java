package org.neuralchilli.datahub.core;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.datahub.config.SchedulerConfig;
import org.neuralchilli.datahub.monitoring.AuditSink;
import org.neuralchilli.datahub.monitoring.SchedulerMetrics;
import org.neuralchilli.datahub.service.TaskCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The scheduling loop. Each tick samples the clock once and runs, in order:
 * <ol>
 *   <li>drain operator releases and backend reports</li>
 *   <li>rebuild the dependency graph from a catalog snapshot, then apply what was drained</li>
 *   <li>fire due tasks</li>
 *   <li>resolve Waiting instances</li>
 *   <li>enforce timeouts and release due retries</li>
 *   <li>dispatch Ready instances</li>
 * </ol>
 * Ticks run on one thread and never overlap. A failing step is logged and
 * the remaining steps still run.
 */
@ApplicationScoped
public class JobTracker {

    private static final Logger log = LoggerFactory.getLogger(JobTracker.class);

    @Inject
    TaskCatalog catalog;

    @Inject
    DependencyGraphBuilder graphBuilder;

    @Inject
    PeriodTrigger trigger;

    @Inject
    DependencyResolver resolver;

    @Inject
    LifecycleMonitor monitor;

    @Inject
    PriorityDispatcher dispatcher;

    @Inject
    ReportInbox inbox;

    @Inject
    AuditSink auditSink;

    @Inject
    SchedulerMetrics metrics;

    @Inject
    SchedulerConfig config;

    @ConfigProperty(name = "datahub.tracker.enabled", defaultValue = "true")
    boolean enabled;

    private final Queue<Release> releases = new ConcurrentLinkedQueue<>();
    private final Set<IntegrityViolation> reportedViolations = new HashSet<>();
    private DependencyGraph graph = DependencyGraph.empty();
    private volatile ScheduledExecutorService executor;

    // Guards start and stop; ticks synchronize on the tracker itself
    private final Object lifecycle = new Object();

    record Release(long taskId, String cycleId) {
    }

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            log.info("Job tracker disabled");
            return;
        }
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public void start() {
        synchronized (lifecycle) {
            if (executor != null) {
                log.warn("Job tracker already running");
                return;
            }

            long intervalMillis = config.tickInterval().toMillis();
            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "job-tracker");
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleWithFixedDelay(this::safeTick, 0, intervalMillis, TimeUnit.MILLISECONDS);
            executor = scheduler;

            log.info("Job tracker started: tick every {}ms, zone {}", intervalMillis, config.zone());
        }
    }

    /**
     * Stop scheduling ticks and wait for a tick in progress to finish.
     * Does not hold the tick lock while waiting.
     */
    public void stop() {
        synchronized (lifecycle) {
            ScheduledExecutorService scheduler = executor;
            if (scheduler == null) {
                return;
            }

            log.info("Stopping job tracker...");
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Job tracker did not stop in 30 seconds, forcing shutdown");
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
            log.info("Job tracker stopped");
            metrics.logReport();
        }
    }

    public boolean isRunning() {
        return executor != null;
    }

    /**
     * Ask for the unsatisfiable parent links of a Waiting instance to be
     * treated as satisfied. Applied on the next tick.
     */
    public void requestRelease(long taskId, String cycleId) {
        releases.add(new Release(taskId, cycleId));
        log.info("Release of task {} in cycle {} requested", taskId, cycleId);
    }

    private void safeTick() {
        try {
            TickSummary summary = tick(Instant.now());
            if (summary.hasActivity()) {
                log.info("Tick: {}", summary);
            } else {
                log.debug("Tick: {}", summary);
            }
        } catch (Throwable t) {
            // Anything escaping here would cancel the schedule
            log.error("Tick failed", t);
        }
    }

    /**
     * Run one scheduling pass at {@code now}
     */
    public synchronized TickSummary tick(Instant now) {
        long started = System.nanoTime();
        TickSummary.Builder summary = TickSummary.builder(now);

        // 0. Drain inputs queued since the last tick
        List<Release> pendingReleases = new ArrayList<>();
        Release release;
        while ((release = releases.poll()) != null) {
            pendingReleases.add(release);
        }
        List<ExecutionReport> reports = List.of();
        try {
            reports = inbox.drain();
        } catch (Exception e) {
            log.error("Failed to drain execution reports", e);
        }

        // 1. Catalog snapshot and dependency graph
        try {
            graph = graphBuilder.build(catalog.snapshot());
            summary.tasks(graph.size());
            summary.violations(auditViolations(graph.violations()));
        } catch (Exception e) {
            log.error("Failed to rebuild dependency graph, keeping the previous one", e);
        }

        int applied = 0;
        for (ExecutionReport report : reports) {
            try {
                if (monitor.applyReport(report, graph, now)) {
                    applied++;
                }
            } catch (Exception e) {
                log.error("Failed to apply {}", report, e);
            }
        }
        summary.reports(applied);

        int released = 0;
        for (Release r : pendingReleases) {
            try {
                if (resolver.release(r.taskId(), r.cycleId(), graph, now)) {
                    released++;
                }
            } catch (Exception e) {
                log.error("Failed to release task {} in cycle {}", r.taskId(), r.cycleId(), e);
            }
        }
        summary.released(released);

        // 2. Fire due tasks
        try {
            summary.fired(trigger.fire(graph, now).size());
        } catch (Exception e) {
            log.error("Period trigger failed", e);
        }

        // 3. Resolve waiting instances
        try {
            summary.resolved(resolver.resolveAll(graph, now));
        } catch (Exception e) {
            log.error("Dependency resolution failed", e);
        }

        // 4. Timeouts and retries
        try {
            summary.monitored(monitor.check(graph, now));
        } catch (Exception e) {
            log.error("Lifecycle check failed", e);
        }

        // 5. Dispatch
        try {
            summary.dispatched(dispatcher.dispatch(graph, now));
        } catch (Exception e) {
            log.error("Dispatch failed", e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metrics.recordTick(elapsed);
        summary.duration(elapsed);
        return summary.build();
    }

    /**
     * Audit violations not reported on the previous tick. A violation that
     * goes away and comes back is reported again.
     */
    private int auditViolations(List<IntegrityViolation> violations) {
        Set<IntegrityViolation> current = new HashSet<>(violations);
        int fresh = 0;
        for (IntegrityViolation violation : violations) {
            if (!reportedViolations.contains(violation)) {
                log.warn("Task {} excluded from scheduling: {}", violation.taskId(), violation.message());
                auditSink.catalogIntegrity(violation);
                metrics.recordIntegrityViolation();
                fresh++;
            }
        }
        reportedViolations.clear();
        reportedViolations.addAll(current);
        return fresh;
    }

    DependencyGraph currentGraph() {
        return graph;
    }
}
