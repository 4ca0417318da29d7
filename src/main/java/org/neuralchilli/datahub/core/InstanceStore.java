package org.neuralchilli.datahub.core;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.datahub.domain.Instance;
import org.neuralchilli.datahub.domain.InstanceKey;
import org.neuralchilli.datahub.domain.InstanceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Durable scheduler state in Hazelcast maps.
 * <p>
 * Non-terminal instances live in {@code active-instances}; once terminal they
 * move to {@code archived-instances} and are never removed. The lineage index
 * points every (task, cycle) at its latest attempt, and the last fired cycle
 * per task keeps the trigger idempotent across restarts.
 * <p>
 * Only the tracker thread writes here.
 */
@ApplicationScoped
public class InstanceStore {

    private static final Logger log = LoggerFactory.getLogger(InstanceStore.class);

    public static final String ACTIVE_MAP = "active-instances";
    public static final String ARCHIVE_MAP = "archived-instances";
    public static final String LINEAGE_MAP = "lineage-index";
    public static final String LAST_FIRED_MAP = "last-fired-cycles";
    public static final String SEQUENCE_MAP = "scheduler-sequences";

    private static final String INSTANCE_SEQUENCE = "instance";

    private static final Comparator<Instance> BY_SEQUENCE = Comparator.comparingLong(Instance::sequence);

    @Inject
    HazelcastInstance hazelcast;

    private IMap<String, Instance> active;
    private IMap<String, Instance> archive;
    private IMap<String, Integer> lineage;
    private IMap<Long, String> lastFired;
    private IMap<String, Long> sequences;

    @PostConstruct
    void init() {
        active = hazelcast.getMap(ACTIVE_MAP);
        archive = hazelcast.getMap(ARCHIVE_MAP);
        lineage = hazelcast.getMap(LINEAGE_MAP);
        lastFired = hazelcast.getMap(LAST_FIRED_MAP);
        sequences = hazelcast.getMap(SEQUENCE_MAP);
    }

    public void save(Instance instance) {
        String id = instance.key().id();

        if (instance.isTerminal()) {
            archive.set(id, instance);
            active.delete(id);
            log.trace("Archived {} in state {}", id, instance.state());
        } else {
            active.set(id, instance);
            log.trace("Saved {} in state {}", id, instance.state());
        }

        String lineageKey = instance.key().lineage();
        Integer latest = lineage.get(lineageKey);
        if (latest == null || instance.attempt() >= latest) {
            lineage.set(lineageKey, instance.attempt());
        }
    }

    public Optional<Instance> find(InstanceKey key) {
        String id = key.id();
        Instance instance = active.get(id);
        if (instance == null) {
            instance = archive.get(id);
        }
        return Optional.ofNullable(instance);
    }

    /**
     * Latest attempt of a task in a cycle
     */
    public Optional<Instance> latest(long taskId, String cycleId) {
        Integer attempt = lineage.get(InstanceKey.lineage(taskId, cycleId));
        if (attempt == null) {
            return Optional.empty();
        }
        return find(new InstanceKey(taskId, cycleId, attempt));
    }

    /**
     * Every attempt of a task in a cycle, oldest first
     */
    public List<Instance> history(long taskId, String cycleId) {
        Integer latest = lineage.get(InstanceKey.lineage(taskId, cycleId));
        if (latest == null) {
            return List.of();
        }

        List<Instance> attempts = new ArrayList<>(latest);
        for (int attempt = 1; attempt <= latest; attempt++) {
            find(new InstanceKey(taskId, cycleId, attempt)).ifPresent(attempts::add);
        }
        return attempts;
    }

    /**
     * Non-terminal instances in creation order
     */
    public List<Instance> active() {
        return active.values().stream()
                .sorted(BY_SEQUENCE)
                .toList();
    }

    public List<Instance> active(InstanceState state) {
        return active.values().stream()
                .filter(instance -> instance.state() == state)
                .sorted(BY_SEQUENCE)
                .toList();
    }

    public Optional<String> lastFiredCycle(long taskId) {
        return Optional.ofNullable(lastFired.get(taskId));
    }

    public void recordFired(long taskId, String cycleId) {
        lastFired.set(taskId, cycleId);
    }

    /**
     * Next value of the creation sequence, strictly increasing across restarts
     */
    public long nextSequence() {
        Long current = sequences.get(INSTANCE_SEQUENCE);
        long next = current == null ? 1L : current + 1;
        sequences.set(INSTANCE_SEQUENCE, next);
        return next;
    }

    public int activeCount() {
        return active.size();
    }

    public int archivedCount() {
        return archive.size();
    }
}
