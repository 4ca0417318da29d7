package org.neuralchilli.datahub.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.datahub.TestHazelcast;
import org.neuralchilli.datahub.config.CatalogYamlParser;
import org.neuralchilli.datahub.domain.Task;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogLoaderServiceTest {

    @TempDir
    Path tempDir;

    private CatalogLoaderService loader;
    private HazelcastTaskCatalog catalog;

    @BeforeEach
    void setup() {
        TestHazelcast.reset();

        loader = new CatalogLoaderService();
        loader.yamlParser = new CatalogYamlParser();
        loader.hazelcast = TestHazelcast.get();
        loader.catalogPath = tempDir.toString();
        loader.init();

        catalog = new HazelcastTaskCatalog();
        catalog.hazelcast = TestHazelcast.get();
        catalog.init();
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(tempDir.resolve(name), content);
    }

    @Test
    void shouldLoadYamlFilesIntoCatalog() throws IOException {
        // Given
        write("a.yaml", """
                tasks:
                  - {id: 2, name: two, type: virtual, period: daily}
                  - {id: 1, name: one, type: virtual, period: daily}
                """);
        write("b.yml", "{id: 3, name: three, mirror_id: 9, period: hourly, parents: [1]}");
        write("notes.txt", "not a catalog file");

        // When
        List<LoadResult> results = loader.loadAll();

        // Then
        assertThat(results).extracting(LoadResult::file).containsExactly("a.yaml", "b.yml");
        assertThat(results).allMatch(LoadResult::isSuccess);
        assertThat(catalog.snapshot()).extracting(Task::id).containsExactly(1L, 2L, 3L);
    }

    @Test
    void shouldLeaveNonSchedulableTasksOutOfSnapshot() throws IOException {
        // Given
        write("a.yaml", """
                tasks:
                  - {id: 1, name: one, type: virtual, period: daily}
                  - {id: 2, name: two, type: virtual, period: daily, valid: false}
                  - {id: 3, name: three, type: virtual, period: daily, removed: true}
                """);

        // When
        loader.loadAll();

        // Then
        assertThat(catalog.getTasks().keySet()).containsExactlyInAnyOrder(1L, 2L, 3L);
        assertThat(catalog.snapshot()).extracting(Task::id).containsExactly(1L);
    }

    @Test
    void shouldReportFailureForBrokenFile() throws IOException {
        // Given
        write("good.yaml", "{id: 1, name: one, type: virtual, period: daily}");
        write("bad.yaml", "{id: 2, name: two, type: virtual}");

        // When
        List<LoadResult> results = loader.loadAll();

        // Then
        LoadResult bad = results.stream().filter(r -> r.file().equals("bad.yaml")).findFirst().orElseThrow();
        assertThat(bad.isSuccess()).isFalse();
        assertThat(bad.error()).hasValueSatisfying(e -> assertThat(e).contains("period"));
        assertThat(catalog.snapshot()).extracting(Task::id).containsExactly(1L);
    }

    @Test
    void shouldRejectDuplicateIdsWithinFile() throws IOException {
        // Given
        write("dup.yaml", """
                tasks:
                  - {id: 1, name: one, type: virtual, period: daily}
                  - {id: 1, name: again, type: virtual, period: daily}
                """);

        // When
        LoadResult result = loader.loadFile(tempDir.resolve("dup.yaml"));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).hasValueSatisfying(e -> assertThat(e).contains("Duplicate task id 1"));
        assertThat(catalog.getTasks().keySet()).isEmpty();
    }

    @Test
    void shouldDropTasksRemovedFromFilesOnReload() throws IOException {
        // Given
        write("a.yaml", """
                tasks:
                  - {id: 1, name: one, type: virtual, period: daily}
                  - {id: 2, name: two, type: virtual, period: daily}
                """);
        loader.reloadAll();

        // When
        write("a.yaml", "{id: 1, name: one, type: virtual, period: daily}");
        loader.reloadAll();

        // Then
        assertThat(catalog.snapshot()).extracting(Task::id).containsExactly(1L);
    }

    @Test
    void shouldKeepTasksWhenReloadHasFailures() throws IOException {
        // Given
        write("a.yaml", "{id: 1, name: one, type: virtual, period: daily}");
        write("b.yaml", "{id: 2, name: two, type: virtual, period: daily}");
        loader.reloadAll();

        // When
        write("b.yaml", "{id: 2, name: two");
        loader.reloadAll();

        // Then
        assertThat(catalog.snapshot()).extracting(Task::id).containsExactly(1L, 2L);
    }

    @Test
    void shouldReturnNothingForMissingDirectory() {
        loader.catalogPath = tempDir.resolve("missing").toString();

        assertThat(loader.loadAll()).isEmpty();
    }
}
