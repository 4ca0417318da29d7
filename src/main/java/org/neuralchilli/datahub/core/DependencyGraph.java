package org.neuralchilli.datahub.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.datahub.domain.ConditionKind;
import org.neuralchilli.datahub.domain.Task;

import java.util.*;

/**
 * Immutable dependency view of one catalog snapshot.
 * Vertices are task ids; an edge runs from a parent to each child that declares it.
 * Tasks excluded for integrity reasons are absent from the graph.
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY = new DependencyGraph(
            new DirectedAcyclicGraph<>(DefaultEdge.class), Map.of(), Map.of(), List.of());

    private final DirectedAcyclicGraph<Long, DefaultEdge> dag;
    private final Map<Long, Task> tasks;
    private final Map<Long, Map<Long, ConditionKind>> conditions;
    private final List<IntegrityViolation> violations;
    private final List<Task> topologicalOrder;

    DependencyGraph(
            DirectedAcyclicGraph<Long, DefaultEdge> dag,
            Map<Long, Task> tasks,
            Map<Long, Map<Long, ConditionKind>> conditions,
            List<IntegrityViolation> violations
    ) {
        this.dag = dag;
        this.tasks = Map.copyOf(tasks);
        this.conditions = Map.copyOf(conditions);
        this.violations = List.copyOf(violations);
        this.topologicalOrder = computeOrder(dag, this.tasks);
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    private static List<Task> computeOrder(DirectedAcyclicGraph<Long, DefaultEdge> dag, Map<Long, Task> tasks) {
        // Among tasks with no pending parents, the smallest id goes first
        TopologicalOrderIterator<Long, DefaultEdge> iterator =
                new TopologicalOrderIterator<>(dag, Comparator.naturalOrder());

        List<Task> order = new ArrayList<>(dag.vertexSet().size());
        while (iterator.hasNext()) {
            order.add(tasks.get(iterator.next()));
        }
        return Collections.unmodifiableList(order);
    }

    public boolean contains(long taskId) {
        return tasks.containsKey(taskId);
    }

    public Optional<Task> task(long taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Parent ids of a task with the condition each one must meet, ordered by parent id
     */
    public Map<Long, ConditionKind> parentsOf(long taskId) {
        return conditions.getOrDefault(taskId, Map.of());
    }

    /**
     * Tasks that declare {@code taskId} as a parent, ordered by id
     */
    public List<Long> childrenOf(long taskId) {
        if (!dag.containsVertex(taskId)) {
            return List.of();
        }
        return dag.outgoingEdgesOf(taskId).stream()
                .map(dag::getEdgeTarget)
                .sorted()
                .toList();
    }

    /**
     * Every schedulable task, parents before children, ties broken by id
     */
    public List<Task> topologicalOrder() {
        return topologicalOrder;
    }

    public List<IntegrityViolation> violations() {
        return violations;
    }

    public int size() {
        return tasks.size();
    }

    public int edgeCount() {
        return dag.edgeSet().size();
    }
}
