package org.neuralchilli.datahub.serializer;

import com.hazelcast.map.IMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.datahub.TestHazelcast;
import org.neuralchilli.datahub.domain.*;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Instances written through the registered serializer come back equal.
 */
class InstanceSerializerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123456789Z");

    private IMap<String, Instance> map;

    @BeforeEach
    void setup() {
        TestHazelcast.reset();
        map = TestHazelcast.get().getMap("serializer-test");
    }

    private Instance roundTrip(Instance instance) {
        map.set(instance.key().id(), instance);
        return map.get(instance.key().id());
    }

    @Test
    void shouldKeepEveryFieldOfFinishedRealInstance() {
        // Given
        Task task = Task.builder(42, "load_orders")
                .real(300, "{\"command\": \"load\", \"args\": [\"${cycleDate}\"]}")
                .period(SchedulePeriod.HOURLY)
                .queue("etl").priority(3).pendingTimeout(5).runningTimeout(60)
                .retries(2).retryDelay(10).softFail(true)
                .build();
        FiringCycle cycle = FiringCycle.current(SchedulePeriod.HOURLY, NOW, ZoneOffset.UTC);
        Instance killed = Instance.create(task, cycle, 17, NOW)
                .await(Map.of(
                        1L, new ParentLink(1, ConditionKind.SUCCESS, ParentLink.Status.SATISFIED),
                        2L, new ParentLink(2, ConditionKind.FORCE, ParentLink.Status.UNSATISFIABLE)))
                .withLinks(Map.of(
                        1L, new ParentLink(1, ConditionKind.SUCCESS, ParentLink.Status.SATISFIED),
                        2L, new ParentLink(2, ConditionKind.FORCE, ParentLink.Status.SATISFIED)))
                .admit(NOW.plusSeconds(1))
                .start(NOW.plusSeconds(2))
                .requestKill(NOW.plusSeconds(3600))
                .kill(NOW.plusSeconds(3660), "running timeout, kill not acknowledged");

        // When
        Instance read = roundTrip(killed);

        // Then
        assertThat(read).isEqualTo(killed);
        assertThat(read.createdAt().getNano()).isEqualTo(123456789);
        assertThat(read.cycle().id()).isEqualTo("HOURLY@2024-05-01T10:00");
    }

    @Test
    void shouldKeepNullsOfFreshVirtualInstance() {
        // Given
        FiringCycle once = FiringCycle.current(SchedulePeriod.ONCE, NOW, ZoneOffset.UTC);
        Instance pending = Instance.create(Task.builder(1, "bootstrap").build(), once, 1, NOW);

        // When
        Instance read = roundTrip(pending);

        // Then
        assertThat(read).isEqualTo(pending);
        assertThat(read.payload().isVirtual()).isTrue();
        assertThat(read.parents()).isEmpty();
        assertThat(read.reason()).isNull();
        assertThat(read.message()).isNull();
        assertThat(read.notBefore()).isNull();
    }

    @Test
    void shouldKeepRetryNotBefore() {
        // Given
        Task task = Task.builder(5, "flaky").real(1, "").retries(1).build();
        FiringCycle cycle = FiringCycle.current(SchedulePeriod.DAILY, NOW, ZoneOffset.UTC);
        Instance retry = Instance.create(task, cycle, 1, NOW).await(Map.of()).admit(NOW).start(NOW)
                .fail(NOW.plusSeconds(30), FailureReason.EXECUTION_FAILURE, "exited with code 1")
                .retry(2, NOW.plusSeconds(30), NOW.plusSeconds(90));

        // When
        Instance read = roundTrip(retry);

        // Then
        assertThat(read.attempt()).isEqualTo(2);
        assertThat(read.notBefore()).isEqualTo(NOW.plusSeconds(90));
        assertThat(read).isEqualTo(retry);
    }
}
