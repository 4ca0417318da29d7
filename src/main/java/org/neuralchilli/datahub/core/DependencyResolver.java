package org.neuralchilli.datahub.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.datahub.domain.*;
import org.neuralchilli.datahub.monitoring.AuditSink;
import org.neuralchilli.datahub.monitoring.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Evaluates the start conditions of Waiting instances.
 * <p>
 * A parent link is only decided once the parent's latest attempt in the cycle
 * is terminal. A failed attempt with a retry scheduled is not the latest, so
 * it never decides a link.
 * <ul>
 *   <li>SUCCESS: satisfied by Succeeded, or by Failed/Killed when the parent is soft-fail;
 *       blocked by any other terminal state</li>
 *   <li>FORCE: satisfied by any terminal state</li>
 * </ul>
 * One blocked link skips the instance; all links satisfied admits it.
 */
@ApplicationScoped
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    @Inject
    InstanceStore store;

    @Inject
    AuditSink auditSink;

    @Inject
    SchedulerMetrics metrics;

    /**
     * Re-evaluate every Waiting instance.
     *
     * @return number of instances admitted or skipped
     */
    public int resolveAll(DependencyGraph graph, Instant now) {
        int changed = 0;
        for (Instance candidate : store.active(InstanceState.WAITING)) {
            try {
                // A cascade earlier in this loop may already have moved it
                Optional<Instance> current = store.find(candidate.key());
                if (current.isEmpty() || current.get().state() != InstanceState.WAITING) {
                    continue;
                }
                if (evaluate(current.get(), graph, now).state() != InstanceState.WAITING) {
                    changed++;
                }
            } catch (Exception e) {
                log.error("Failed to resolve dependencies of {}", candidate.key(), e);
            }
        }
        return changed;
    }

    /**
     * Update the links of one Waiting instance and admit or skip it when decided.
     *
     * @return the instance after evaluation
     */
    public Instance evaluate(Instance waiting, DependencyGraph graph, Instant now) {
        Instance evaluated = decide(waiting, now);
        if (evaluated.state() == InstanceState.SKIPPED) {
            onTerminal(evaluated, graph, now);
        }
        return evaluated;
    }

    private Instance decide(Instance waiting, Instant now) {
        if (waiting.state() != InstanceState.WAITING) {
            throw new IllegalStateException("Cannot evaluate " + waiting.key() + " in state: " + waiting.state());
        }

        Map<Long, ParentLink> links = new TreeMap<>();
        boolean changed = false;
        for (ParentLink link : waiting.parents().values()) {
            ParentLink updated = link.status() == ParentLink.Status.UNRESOLVED
                    ? resolve(link, waiting.cycleId())
                    : link;
            changed |= updated != link;
            links.put(updated.parentTaskId(), updated);
        }

        Optional<ParentLink> blocked = links.values().stream().filter(ParentLink::isBlocked).findFirst();
        if (blocked.isPresent()) {
            Instance skipped = waiting.withLinks(links)
                    .skip(now, "parent " + blocked.get().parentTaskId() + " did not satisfy " + blocked.get().kind());
            store.save(skipped);
            metrics.recordFinished(skipped);
            auditSink.instanceFinished(skipped, false);
            log.info("Skipped {}: {}", skipped.key(), skipped.message());
            return skipped;
        }

        if (links.values().stream().allMatch(ParentLink::isSatisfied)) {
            Instance ready = waiting.withLinks(links).admit(now);
            store.save(ready);
            log.debug("Admitted {}", ready.key());
            return ready;
        }

        if (changed) {
            Instance relinked = waiting.withLinks(links);
            store.save(relinked);
            return relinked;
        }
        return waiting;
    }

    /**
     * Fan a final state out to the Waiting instances of the task's children in
     * the same cycle. Skips cascade through a worklist, so chain depth does not
     * grow the stack.
     */
    public void onTerminal(Instance terminal, DependencyGraph graph, Instant now) {
        Deque<Instance> pending = new ArrayDeque<>();
        pending.add(terminal);
        while (!pending.isEmpty()) {
            Instance finished = pending.poll();
            for (Long childId : graph.childrenOf(finished.taskId())) {
                try {
                    Optional<Instance> child = store.latest(childId, finished.cycleId());
                    if (child.isPresent() && child.get().state() == InstanceState.WAITING) {
                        Instance evaluated = decide(child.get(), now);
                        if (evaluated.state() == InstanceState.SKIPPED) {
                            pending.add(evaluated);
                        }
                    }
                } catch (Exception e) {
                    log.error("Failed to propagate {} to child task {}", finished.key(), childId, e);
                }
            }
        }
    }

    /**
     * Operator release: treat the unsatisfiable links of a Waiting instance as satisfied.
     *
     * @return whether a Waiting instance was found
     */
    public boolean release(long taskId, String cycleId, DependencyGraph graph, Instant now) {
        Optional<Instance> latest = store.latest(taskId, cycleId);
        if (latest.isEmpty() || latest.get().state() != InstanceState.WAITING) {
            log.warn("Release ignored: no waiting instance of task {} in cycle {}", taskId, cycleId);
            return false;
        }

        Instance waiting = latest.get();
        Map<Long, ParentLink> links = new TreeMap<>();
        waiting.parents().values().forEach(link -> links.put(link.parentTaskId(),
                link.isUnsatisfiable() ? link.withStatus(ParentLink.Status.SATISFIED) : link));

        Instance released = waiting.withLinks(links);
        store.save(released);
        log.info("Released {} by operator request", released.key());

        evaluate(released, graph, now);
        return true;
    }

    private ParentLink resolve(ParentLink link, String cycleId) {
        Optional<Instance> parent = store.latest(link.parentTaskId(), cycleId);
        if (parent.isEmpty() || !parent.get().isTerminal()) {
            return link;
        }

        InstanceState state = parent.get().state();
        if (link.kind() == ConditionKind.FORCE) {
            return link.withStatus(ParentLink.Status.SATISFIED);
        }

        if (state == InstanceState.SUCCEEDED) {
            return link.withStatus(ParentLink.Status.SATISFIED);
        }
        if (state.isFailure() && parent.get().policy().softFail()) {
            return link.withStatus(ParentLink.Status.SATISFIED);
        }
        return link.withStatus(ParentLink.Status.BLOCKED);
    }
}
