package org.neuralchilli.datahub.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.datahub.domain.ConditionKind;
import org.neuralchilli.datahub.domain.Task;
import org.neuralchilli.datahub.service.CatalogIntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the per-tick DependencyGraph from a catalog snapshot.
 * <p>
 * A task is excluded when one of its parents is not in the snapshot, when a
 * condition descriptor names an unknown kind, when it lies on a cycle, or when
 * any of its parents is excluded. Exclusions are returned as violations and
 * never abort the build.
 */
@ApplicationScoped
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public DependencyGraph build(Collection<Task> snapshot) {
        Map<Long, Task> tasks = new TreeMap<>();
        for (Task task : snapshot) {
            if (task.isSchedulable()) {
                tasks.put(task.id(), task);
            }
        }

        List<IntegrityViolation> violations = new ArrayList<>();
        Set<Long> excluded = new HashSet<>();
        Map<Long, Map<Long, ConditionKind>> conditions = new HashMap<>();

        // Pass 1: references and condition kinds
        for (Task task : tasks.values()) {
            Map<Long, ConditionKind> parents = new TreeMap<>();
            for (Map.Entry<Long, Map<String, String>> entry : new TreeMap<>(task.parent()).entrySet()) {
                long parentId = entry.getKey();
                if (!tasks.containsKey(parentId)) {
                    violations.add(new IntegrityViolation(task.id(), IntegrityViolation.Kind.DANGLING_PARENT,
                            "parent " + parentId + " does not exist or is not schedulable"));
                    excluded.add(task.id());
                    continue;
                }
                try {
                    parents.put(parentId, ConditionKind.fromDescriptor(entry.getValue()));
                } catch (CatalogIntegrityException e) {
                    violations.add(new IntegrityViolation(task.id(), IntegrityViolation.Kind.UNKNOWN_CONDITION,
                            e.getMessage()));
                    excluded.add(task.id());
                }
            }
            conditions.put(task.id(), parents);
        }

        // Pass 2: cycles, over every declared edge between known tasks
        Map<Long, List<Long>> childrenIndex = childrenIndex(tasks);
        for (Long onCycle : findCycleMembers(tasks.keySet(), childrenIndex)) {
            violations.add(new IntegrityViolation(onCycle, IntegrityViolation.Kind.CYCLE,
                    "task is part of a dependency cycle"));
            excluded.add(onCycle);
        }

        // Pass 3: a task whose parent cannot fire cannot fire either
        Deque<Long> frontier = new ArrayDeque<>(new TreeSet<>(excluded));
        while (!frontier.isEmpty()) {
            long parentId = frontier.poll();
            for (Long childId : childrenIndex.getOrDefault(parentId, List.of())) {
                if (excluded.add(childId)) {
                    violations.add(new IntegrityViolation(childId, IntegrityViolation.Kind.EXCLUDED_PARENT,
                            "parent " + parentId + " is excluded from scheduling"));
                    frontier.add(childId);
                }
            }
        }

        DirectedAcyclicGraph<Long, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
        Map<Long, Task> kept = new HashMap<>();
        for (Task task : tasks.values()) {
            if (!excluded.contains(task.id())) {
                dag.addVertex(task.id());
                kept.put(task.id(), task);
            }
        }

        Map<Long, Map<Long, ConditionKind>> keptConditions = new HashMap<>();
        for (Long childId : kept.keySet()) {
            Map<Long, ConditionKind> parents = conditions.get(childId);
            for (Long parentId : parents.keySet()) {
                try {
                    // Edge direction: from parent to child
                    dag.addEdge(parentId, childId);
                } catch (IllegalArgumentException e) {
                    // Cycles were removed above; reaching this means the detection is broken
                    throw new IllegalStateException(
                            "Edge " + parentId + " -> " + childId + " would create a cycle", e);
                }
            }
            keptConditions.put(childId, Collections.unmodifiableMap(parents));
        }

        violations.sort(Comparator.comparingLong(IntegrityViolation::taskId)
                .thenComparing(IntegrityViolation::kind)
                .thenComparing(IntegrityViolation::message));

        log.debug("Dependency graph built: {} tasks, {} edges, {} excluded",
                dag.vertexSet().size(), dag.edgeSet().size(), excluded.size());

        return new DependencyGraph(dag, kept, keptConditions, violations);
    }

    private Map<Long, List<Long>> childrenIndex(Map<Long, Task> tasks) {
        Map<Long, List<Long>> children = new TreeMap<>();
        for (Task task : tasks.values()) {
            for (Long parentId : task.parent().keySet()) {
                if (tasks.containsKey(parentId)) {
                    children.computeIfAbsent(parentId, k -> new ArrayList<>()).add(task.id());
                }
            }
        }
        children.values().forEach(Collections::sort);
        return children;
    }

    /**
     * Depth-first search with an explicit path stack. Whenever an edge closes
     * back onto the path, every task on the path from that point is on the
     * cycle. Tasks that sit on a cycle but are not found here are downstream
     * of one that is, so pass 3 excludes them.
     */
    private Set<Long> findCycleMembers(Set<Long> taskIds, Map<Long, List<Long>> childrenIndex) {
        Set<Long> visited = new HashSet<>();
        Set<Long> onCycle = new TreeSet<>();
        Deque<Long> path = new ArrayDeque<>();
        Deque<Iterator<Long>> pending = new ArrayDeque<>();
        Set<Long> onPath = new HashSet<>();

        for (Long root : taskIds) {
            if (visited.contains(root)) {
                continue;
            }
            enter(root, childrenIndex, visited, path, pending, onPath);

            while (!path.isEmpty()) {
                Iterator<Long> children = pending.peek();
                if (!children.hasNext()) {
                    onPath.remove(path.pop());
                    pending.pop();
                    continue;
                }

                Long childId = children.next();
                if (onPath.contains(childId)) {
                    // Path iterates from the top, so walk down until the cycle entry
                    for (Long member : path) {
                        onCycle.add(member);
                        if (member.equals(childId)) {
                            break;
                        }
                    }
                } else if (!visited.contains(childId)) {
                    enter(childId, childrenIndex, visited, path, pending, onPath);
                }
            }
        }
        return onCycle;
    }

    private static void enter(
            Long taskId,
            Map<Long, List<Long>> childrenIndex,
            Set<Long> visited,
            Deque<Long> path,
            Deque<Iterator<Long>> pending,
            Set<Long> onPath
    ) {
        visited.add(taskId);
        path.push(taskId);
        pending.push(childrenIndex.getOrDefault(taskId, List.of()).iterator());
        onPath.add(taskId);
    }
}
