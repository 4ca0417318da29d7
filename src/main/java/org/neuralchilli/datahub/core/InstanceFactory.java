package org.neuralchilli.datahub.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.datahub.domain.*;
import org.neuralchilli.datahub.monitoring.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Materializes the first attempt of a task for a firing cycle and links it
 * to the same-cycle instances of its parents.
 */
@ApplicationScoped
public class InstanceFactory {

    private static final Logger log = LoggerFactory.getLogger(InstanceFactory.class);

    @Inject
    InstanceStore store;

    @Inject
    SchedulerMetrics metrics;

    /**
     * Create the instance, move it to Waiting and record the cycle as fired.
     * Parents are expected to have fired earlier in the same pass; a parent
     * without an instance in the cycle leaves the link unsatisfiable.
     */
    public Instance create(Task task, FiringCycle cycle, DependencyGraph graph, Instant now) {
        Instance instance = Instance.create(task, cycle, store.nextSequence(), now);

        Map<Long, ParentLink> links = new TreeMap<>();
        graph.parentsOf(task.id()).forEach((parentId, kind) -> {
            if (store.latest(parentId, cycle.id()).isPresent()) {
                links.put(parentId, ParentLink.unresolved(parentId, kind));
            } else {
                log.warn("Task {} has no instance in cycle {}; {} held until released",
                        parentId, cycle, instance.key());
                links.put(parentId, ParentLink.unsatisfiable(parentId, kind));
            }
        });

        Instance waiting = instance.await(links);
        store.save(waiting);
        store.recordFired(task.id(), cycle.id());
        metrics.recordFired();

        log.info("Fired {} [{}] with {} parent link(s)", waiting.key(), task.name(), links.size());
        return waiting;
    }
}
