package org.neuralchilli.datahub.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.datahub.config.SchedulerConfig;
import org.neuralchilli.datahub.domain.FiringCycle;
import org.neuralchilli.datahub.domain.Instance;
import org.neuralchilli.datahub.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fires each task at most once per period boundary.
 * <p>
 * Only the boundary containing {@code now} is considered: boundaries missed
 * while the tracker was down are not backfilled.
 */
@ApplicationScoped
public class PeriodTrigger {

    private static final Logger log = LoggerFactory.getLogger(PeriodTrigger.class);

    @Inject
    InstanceStore store;

    @Inject
    InstanceFactory factory;

    @Inject
    SchedulerConfig config;

    /**
     * Walk the graph parents-first and create an instance for every task whose
     * current cycle has not fired yet.
     *
     * @return the instances created, in firing order
     */
    public List<Instance> fire(DependencyGraph graph, Instant now) {
        ZoneId zone = config.zoneId();
        List<Instance> fired = new ArrayList<>();

        for (Task task : graph.topologicalOrder()) {
            try {
                FiringCycle cycle = FiringCycle.current(task.period(), now, zone);
                if (isDue(task, cycle)) {
                    fired.add(factory.create(task, cycle, graph, now));
                }
            } catch (Exception e) {
                log.error("Failed to fire task {} [{}]", task.id(), task.name(), e);
            }
        }

        if (!fired.isEmpty()) {
            log.debug("Fired {} instance(s)", fired.size());
        }
        return fired;
    }

    boolean isDue(Task task, FiringCycle cycle) {
        Optional<String> last = store.lastFiredCycle(task.id());
        return last.isEmpty() || !last.get().equals(cycle.id());
    }
}
