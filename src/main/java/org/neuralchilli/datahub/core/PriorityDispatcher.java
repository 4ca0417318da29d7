package org.neuralchilli.datahub.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.datahub.config.SchedulerConfig;
import org.neuralchilli.datahub.domain.FailureReason;
import org.neuralchilli.datahub.domain.Instance;
import org.neuralchilli.datahub.domain.InstanceState;
import org.neuralchilli.datahub.domain.TaskPayload;
import org.neuralchilli.datahub.monitoring.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/**
 * Moves Ready instances to Running.
 * <p>
 * Virtual instances complete on the spot and do not use queue capacity.
 * Real instances are offered to the execution backend per queue in
 * (priority, creation time, creation sequence) order, while the queue has
 * fewer Running instances than its capacity. Once the backend turns one
 * down, the rest of that queue waits for the next tick so that nothing is
 * started ahead of it.
 */
@ApplicationScoped
public class PriorityDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PriorityDispatcher.class);

    static final Comparator<Instance> DISPATCH_ORDER = Comparator
            .comparingInt((Instance instance) -> instance.policy().priority())
            .thenComparing(Instance::createdAt)
            .thenComparingLong(Instance::sequence);

    @Inject
    InstanceStore store;

    @Inject
    LifecycleMonitor monitor;

    @Inject
    ExecutionBackend backend;

    @Inject
    ArgsTemplateResolver argsResolver;

    @Inject
    SchedulerMetrics metrics;

    @Inject
    SchedulerConfig config;

    /**
     * @return number of instances started, virtual ones included
     */
    public int dispatch(DependencyGraph graph, Instant now) {
        int started = completeVirtual(graph, now);

        Map<String, Integer> running = new HashMap<>();
        for (Instance instance : store.active(InstanceState.RUNNING)) {
            running.merge(instance.policy().queue(), 1, Integer::sum);
        }

        Set<String> blockedQueues = new HashSet<>();
        List<Instance> ready = store.active(InstanceState.READY).stream()
                .filter(instance -> !instance.isVirtual())
                .sorted(DISPATCH_ORDER)
                .toList();

        for (Instance instance : ready) {
            String queue = instance.policy().queue();
            if (blockedQueues.contains(queue)) {
                continue;
            }

            int capacity = config.capacityOf(queue);
            if (running.getOrDefault(queue, 0) >= capacity) {
                log.trace("Queue {} is full ({}), {} stays ready", queue, capacity, instance.key());
                blockedQueues.add(queue);
                continue;
            }

            try {
                switch (submit(instance, graph, now)) {
                    case STARTED -> {
                        running.merge(queue, 1, Integer::sum);
                        started++;
                    }
                    case REJECTED -> blockedQueues.add(queue);
                    case FAILED -> log.debug("{} failed before submission", instance.key());
                }
            } catch (Exception e) {
                log.error("Failed to dispatch {}", instance.key(), e);
                blockedQueues.add(queue);
            }
        }

        return started;
    }

    /**
     * Complete Ready virtual instances until none are left; completing one may
     * admit virtual children, so a chain of join nodes resolves in one pass.
     */
    private int completeVirtual(DependencyGraph graph, Instant now) {
        int completed = 0;
        List<Instance> virtual = readyVirtual();
        while (!virtual.isEmpty()) {
            for (Instance instance : virtual) {
                try {
                    Instance running = instance.start(now);
                    store.save(running);
                    monitor.complete(running.succeed(now), graph, now);
                    completed++;
                } catch (Exception e) {
                    log.error("Failed to complete virtual instance {}", instance.key(), e);
                    return completed;
                }
            }
            virtual = readyVirtual();
        }
        return completed;
    }

    private List<Instance> readyVirtual() {
        return store.active(InstanceState.READY).stream()
                .filter(Instance::isVirtual)
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    private enum SubmitOutcome {
        STARTED,
        REJECTED,
        /**
         * Failed before reaching the backend; frees its place in the queue
         */
        FAILED
    }

    private SubmitOutcome submit(Instance instance, DependencyGraph graph, Instant now) {
        String args;
        try {
            args = argsResolver.resolve(instance);
        } catch (ExpressionException e) {
            log.error("Args of {} cannot be resolved: {}", instance.key(), e.getMessage());
            monitor.complete(instance.fail(now, FailureReason.EXECUTION_FAILURE, e.getMessage()), graph, now);
            return SubmitOutcome.FAILED;
        }

        TaskPayload.Real payload = (TaskPayload.Real) instance.payload();
        SubmitRequest request = new SubmitRequest(
                instance.key(),
                instance.taskName(),
                instance.policy().queue(),
                payload.mirrorId(),
                args,
                instance.policy().runningTimeout()
        );

        SubmitResult result = backend.submit(request);
        if (result != SubmitResult.ACCEPTED) {
            metrics.recordSubmitRejected();
            log.debug("Backend rejected {}, stays ready", instance.key());
            return SubmitOutcome.REJECTED;
        }

        Instance running = instance.start(now);
        store.save(running);
        metrics.recordDispatched();
        log.info("Dispatched {} to queue {} (priority {})",
                running.key(), running.policy().queue(), running.policy().priority());
        return SubmitOutcome.STARTED;
    }
}
