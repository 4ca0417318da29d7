package org.neuralchilli.datahub.service;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.datahub.config.CatalogYamlParser;
import org.neuralchilli.datahub.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads task definitions from YAML files into the catalog map.
 * Stands in for the CRUD side of the system when running standalone.
 */
@ApplicationScoped
public class CatalogLoaderService {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoaderService.class);

    @Inject
    CatalogYamlParser yamlParser;

    @Inject
    HazelcastInstance hazelcast;

    @ConfigProperty(name = "datahub.catalog.path")
    String catalogPath;

    private IMap<Long, Task> tasks;

    @PostConstruct
    void init() {
        tasks = hazelcast.getMap(HazelcastTaskCatalog.MAP_NAME);
    }

    void onStart(@Observes StartupEvent event) {
        log.info("Loading task catalog from: {}", catalogPath);
        logResults(reloadAll());
    }

    /**
     * Load every catalog file and drop tasks that no longer appear in any of them.
     * Tasks of files that fail to parse are left untouched.
     */
    public List<LoadResult> reloadAll() {
        List<LoadResult> results = loadAll();

        boolean anyFailure = results.stream().anyMatch(r -> !r.isSuccess());
        if (anyFailure) {
            log.warn("Some catalog files failed to load, keeping previously loaded tasks");
            return results;
        }

        Set<Long> loaded = new HashSet<>();
        results.forEach(r -> loaded.addAll(r.taskIds()));

        for (Long id : new ArrayList<>(tasks.keySet())) {
            if (!loaded.contains(id)) {
                tasks.remove(id);
                log.info("Removed task {} no longer present in catalog files", id);
            }
        }
        return results;
    }

    /**
     * Load all catalog files under the configured directory
     */
    public List<LoadResult> loadAll() {
        List<LoadResult> results = new ArrayList<>();

        Path dir = Path.of(catalogPath);
        if (!Files.exists(dir)) {
            log.warn("Catalog directory does not exist: {}", catalogPath);
            return results;
        }

        try (Stream<Path> paths = Files.walk(dir)) {
            paths.filter(this::isYamlFile)
                    .sorted()
                    .forEach(path -> results.add(loadFile(path)));
        } catch (IOException e) {
            log.error("Error scanning catalog directory: {}", catalogPath, e);
        }

        return results;
    }

    /**
     * Load a single catalog file
     */
    public LoadResult loadFile(Path path) {
        try {
            log.debug("Loading catalog file: {}", path);

            String yaml = Files.readString(path);
            List<Task> parsed = yamlParser.parseTasks(yaml);

            Map<Long, Task> batch = new LinkedHashMap<>();
            for (Task task : parsed) {
                if (batch.put(task.id(), task) != null) {
                    throw new IllegalArgumentException("Duplicate task id " + task.id() + " in " + path);
                }
            }
            tasks.putAll(batch);

            log.info("✓ Loaded {} tasks from {}", batch.size(), path.getFileName());
            return LoadResult.success(path.getFileName().toString(), new ArrayList<>(batch.keySet()));

        } catch (IOException e) {
            log.error("✗ Failed to read catalog file: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        } catch (Exception e) {
            log.error("✗ Failed to load catalog file: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        }
    }

    private boolean isYamlFile(Path path) {
        String fileName = path.toString().toLowerCase();
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} catalog files: {} successful, {} failed",
                    results.size(), successful, failed);

            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  ✗ {}: {}", r.file(), r.error().orElse("unknown error")));
        } else {
            log.info("Loaded {} catalog files: all successful ({} tasks)",
                    results.size(), tasks.size());
        }
    }
}
