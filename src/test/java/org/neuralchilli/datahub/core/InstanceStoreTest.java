package org.neuralchilli.datahub.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.datahub.TestHazelcast;
import org.neuralchilli.datahub.domain.*;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InstanceStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final FiringCycle CYCLE = FiringCycle.current(SchedulePeriod.DAILY, NOW, java.time.ZoneOffset.UTC);

    private InstanceStore store;

    @BeforeEach
    void setup() {
        TestHazelcast.reset();
        store = new InstanceStore();
        store.hazelcast = TestHazelcast.get();
        store.init();
    }

    private Instance waiting(long taskId, long sequence) {
        Task task = Task.builder(taskId, "task-" + taskId).real(1, "run").retries(1).build();
        return Instance.create(task, CYCLE, sequence, NOW).await(Map.of());
    }

    @Test
    void shouldKeepActiveInstancesUntilTerminal() {
        // Given
        Instance running = waiting(1, 1).admit(NOW).start(NOW);
        store.save(running);

        // Then
        assertThat(store.activeCount()).isEqualTo(1);
        assertThat(store.find(running.key())).contains(running);

        // When
        Instance done = running.succeed(NOW.plusSeconds(60));
        store.save(done);

        // Then
        assertThat(store.activeCount()).isZero();
        assertThat(store.archivedCount()).isEqualTo(1);
        assertThat(store.find(running.key())).contains(done);
    }

    @Test
    void shouldTrackLatestAttemptAndHistory() {
        // Given
        Instance failed = waiting(1, 1).admit(NOW).start(NOW)
                .fail(NOW.plusSeconds(30), FailureReason.EXECUTION_FAILURE, "boom");
        Instance retry = failed.retry(2, NOW.plusSeconds(30), NOW.plusSeconds(90));

        // When
        store.save(failed);
        store.save(retry);

        // Then
        assertThat(store.latest(1, CYCLE.id())).contains(retry);
        assertThat(store.history(1, CYCLE.id()))
                .extracting(Instance::attempt, Instance::state)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple(1, InstanceState.FAILED),
                        org.assertj.core.groups.Tuple.tuple(2, InstanceState.PENDING)
                );
        assertThat(store.latest(2, CYCLE.id())).isEmpty();
        assertThat(store.history(2, CYCLE.id())).isEmpty();
    }

    @Test
    void shouldListActiveInstancesInCreationOrder() {
        // Given
        store.save(waiting(3, 7));
        store.save(waiting(1, 9));
        store.save(waiting(2, 8).admit(NOW));

        // Then
        assertThat(store.active()).extracting(Instance::sequence).containsExactly(7L, 8L, 9L);
        assertThat(store.active(InstanceState.WAITING)).extracting(Instance::taskId).containsExactly(3L, 1L);
        assertThat(store.active(InstanceState.READY)).extracting(Instance::taskId).containsExactly(2L);
    }

    @Test
    void shouldIssueIncreasingSequenceNumbers() {
        long first = store.nextSequence();
        long second = store.nextSequence();

        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(2);
    }

    @Test
    void shouldRememberLastFiredCycle() {
        assertThat(store.lastFiredCycle(5)).isEmpty();

        store.recordFired(5, "HOURLY@2024-05-01T10:00");

        assertThat(store.lastFiredCycle(5)).contains("HOURLY@2024-05-01T10:00");
    }
}
