package org.neuralchilli.datahub.worker;

import com.hazelcast.collection.IQueue;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.datahub.core.ExecutionBackend;
import org.neuralchilli.datahub.core.ExecutionReport;
import org.neuralchilli.datahub.core.ReportInbox;
import org.neuralchilli.datahub.core.SubmitRequest;
import org.neuralchilli.datahub.core.SubmitResult;
import org.neuralchilli.datahub.domain.InstanceKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Execution backend for development and single-node setups.
 * <p>
 * Submissions go to the Hazelcast {@code work-queue}; a bounded queue that is
 * full rejects. Worker threads take requests, run them with the
 * {@link CommandRunner} and report the outcome to the {@link ReportInbox}.
 */
@ApplicationScoped
public class LocalExecutionBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalExecutionBackend.class);

    static final String WORK_QUEUE = "work-queue";

    @Inject
    HazelcastInstance hazelcast;

    @Inject
    CommandRunner runner;

    @Inject
    ReportInbox inbox;

    @ConfigProperty(name = "datahub.worker.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "datahub.worker.threads", defaultValue = "4")
    int defaultWorkerThreads;

    @ConfigProperty(name = "datahub.worker.id", defaultValue = "worker-local")
    String workerId;

    private IQueue<SubmitRequest> workQueue;
    private ExecutorService executorService;
    private volatile boolean running = false;

    private final Map<String, Process> processes = new ConcurrentHashMap<>();
    // Accepted and not yet reported, mapped to whether a kill was requested
    private final Map<String, Boolean> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger busyThreads = new AtomicInteger(0);

    @PostConstruct
    void init() {
        workQueue = hazelcast.getQueue(WORK_QUEUE);
    }

    void onStart(@Observes StartupEvent event) {
        if (enabled) {
            start(defaultWorkerThreads);
        } else {
            log.info("Local worker pool disabled, submissions stay queued");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    @Override
    public SubmitResult submit(SubmitRequest request) {
        inFlight.put(request.key().id(), false);
        if (!workQueue.offer(request)) {
            inFlight.remove(request.key().id());
            log.debug("Work queue full, rejecting {}", request.key());
            return SubmitResult.REJECTED;
        }
        log.debug("Queued {} for local execution", request.key());
        return SubmitResult.ACCEPTED;
    }

    @Override
    public void kill(InstanceKey key) {
        String id = key.id();
        if (inFlight.computeIfPresent(id, (k, requested) -> true) == null) {
            log.debug("{} is not in flight, nothing to kill", id);
            return;
        }

        Process process = processes.get(id);
        if (process != null) {
            log.info("Destroying process of {}", id);
            process.destroy();
        } else {
            log.info("{} not started yet, it will be dropped when picked up", id);
        }
    }

    /**
     * Start the worker pool with specified thread count.
     */
    public void start(int threads) {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        running = true;

        log.info("Starting worker pool: {} threads, worker ID: {}", threads, workerId);
        executorService = Executors.newFixedThreadPool(threads, new WorkerThreadFactory(workerId));
        for (int i = 0; i < threads; i++) {
            executorService.submit(this::workerLoop);
        }
    }

    private void workerLoop() {
        String threadName = Thread.currentThread().getName();
        log.debug("[{}] Worker thread started", threadName);

        while (running) {
            try {
                SubmitRequest request = workQueue.poll(1, TimeUnit.SECONDS);
                if (request != null) {
                    execute(request, threadName);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("[{}] Worker thread interrupted, exiting", threadName);
                break;
            } catch (Exception e) {
                log.error("[{}] Error in worker loop", threadName, e);
            }
        }

        log.debug("[{}] Worker thread stopped", threadName);
    }

    void execute(SubmitRequest request, String threadName) {
        String id = request.key().id();
        Instant start = Instant.now();

        if (isKillRequested(id)) {
            inFlight.remove(id);
            inbox.report(ExecutionReport.failure(request.key(), start, start, "killed before start"));
            return;
        }

        log.info("[{}] Executing: {} [{}]", threadName, id, request.taskName());
        busyThreads.incrementAndGet();
        RunResult result;
        try {
            result = runner.run(request, process -> {
                processes.put(id, process);
                if (isKillRequested(id)) {
                    // Kill arrived between pick-up and process start
                    process.destroy();
                }
            });
        } catch (Exception e) {
            log.error("[{}] Exception executing {}", threadName, id, e);
            result = RunResult.failure("Exception: " + e.getMessage());
        } finally {
            processes.remove(id);
            busyThreads.decrementAndGet();
        }

        Instant end = Instant.now();
        if (Boolean.TRUE.equals(inFlight.remove(id))) {
            result = RunResult.failure("killed: " + (result.isSuccess() ? "finished after kill" : result.error()));
        }

        if (result.isSuccess()) {
            log.info("[{}] Completed: {} ({}ms)", threadName, id, Duration.between(start, end).toMillis());
            inbox.report(ExecutionReport.success(request.key(), start, end));
        } else {
            log.error("[{}] Failed: {} - {}", threadName, id, result.error());
            inbox.report(ExecutionReport.failure(request.key(), start, end, result.error()));
        }
    }

    /**
     * Stop the worker pool, letting running commands finish.
     */
    public void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping worker pool gracefully...");
        running = false;

        if (executorService != null) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                    log.warn("Worker pool did not terminate in 60 seconds, forcing shutdown");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Worker pool stopped");
    }

    private boolean isKillRequested(String id) {
        return Boolean.TRUE.equals(inFlight.get(id));
    }

    public WorkerStats getStats() {
        return new WorkerStats(busyThreads.get(), workQueue.size(), inFlight.size(), running);
    }

    /**
     * Thread factory for creating named worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String workerId;

        WorkerThreadFactory(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(workerId + "-thread-" + counter.incrementAndGet());
            t.setDaemon(false); // Keep JVM alive
            return t;
        }
    }

    public record WorkerStats(
            int busyThreads,
            int queueSize,
            int inFlight,
            boolean running
    ) {
    }
}
