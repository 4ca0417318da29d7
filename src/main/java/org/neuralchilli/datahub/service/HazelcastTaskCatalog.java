package org.neuralchilli.datahub.service;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.datahub.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * Task catalog backed by the {@code task-catalog} Hazelcast map,
 * which the CRUD side (or {@link CatalogLoaderService}) keeps up to date.
 */
@ApplicationScoped
public class HazelcastTaskCatalog implements TaskCatalog {

    private static final Logger log = LoggerFactory.getLogger(HazelcastTaskCatalog.class);

    public static final String MAP_NAME = "task-catalog";

    @Inject
    HazelcastInstance hazelcast;

    private IMap<Long, Task> tasks;

    @PostConstruct
    void init() {
        tasks = hazelcast.getMap(MAP_NAME);
    }

    @Override
    public List<Task> snapshot() {
        List<Task> snapshot = tasks.values().stream()
                .filter(Task::isSchedulable)
                .sorted(Comparator.comparingLong(Task::id))
                .toList();

        log.trace("Catalog snapshot: {} schedulable of {} tasks", snapshot.size(), tasks.size());
        return snapshot;
    }

    public IMap<Long, Task> getTasks() {
        return tasks;
    }
}
