package org.neuralchilli.datahub.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.datahub.TestHazelcast;
import org.neuralchilli.datahub.domain.*;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyResolverTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:10:00Z");
    private static final Instant T1 = Instant.parse("2024-05-01T00:11:00Z");
    private static final String DAY = "DAILY@2024-05-01T00:00";

    private SchedulerHarness harness;

    @BeforeEach
    void setup() {
        TestHazelcast.reset();
        harness = new SchedulerHarness(TestHazelcast.get());
    }

    @Test
    void shouldSatisfyForceLinkWhenParentFails() {
        // Given
        harness.add(
                Task.builder(1, "A").real(10, "run a"),
                Task.builder(2, "cleanup").real(20, "clean").forceDependsOn(1)
        );
        harness.tick(T0);

        // When
        harness.fail(1, DAY, T1);
        harness.tick(T1);

        // Then
        assertThat(harness.stateOf(1, DAY)).isEqualTo(InstanceState.FAILED);
        Instance cleanup = harness.latest(2, DAY);
        assertThat(cleanup.state()).isEqualTo(InstanceState.RUNNING);
        assertThat(cleanup.parents().get(1L).status()).isEqualTo(ParentLink.Status.SATISFIED);
    }

    @Test
    void shouldCascadeSkipDownTheChainInOneTick() {
        // Given
        harness.add(
                Task.builder(1, "A").real(10, "run a"),
                Task.builder(2, "B").real(20, "run b").dependsOn(1),
                Task.builder(3, "C").dependsOn(2)
        );
        harness.tick(T0);

        // When
        harness.fail(1, DAY, T1);
        TickSummary summary = harness.tick(T1);

        // Then
        assertThat(harness.stateOf(2, DAY)).isEqualTo(InstanceState.SKIPPED);
        assertThat(harness.stateOf(3, DAY)).isEqualTo(InstanceState.SKIPPED);
        assertThat(harness.latest(2, DAY).parents().get(1L).isBlocked()).isTrue();
        assertThat(harness.latest(3, DAY).reason()).isEqualTo(FailureReason.DEPENDENCY_BLOCKED);
        assertThat(summary.reportsApplied()).isEqualTo(1);
        assertThat(harness.audit.finished)
                .extracting(f -> f.instance().taskId())
                .containsExactly(1L, 2L, 3L);
    }

    @Test
    void shouldSatisfyForceLinkWhenParentIsSkipped() {
        // Given
        harness.add(
                Task.builder(1, "A").real(10, "run a"),
                Task.builder(2, "B").real(20, "run b").dependsOn(1),
                Task.builder(3, "report").real(30, "report").forceDependsOn(2)
        );
        harness.tick(T0);

        // When
        harness.fail(1, DAY, T1);
        harness.tick(T1);

        // Then
        assertThat(harness.stateOf(2, DAY)).isEqualTo(InstanceState.SKIPPED);
        assertThat(harness.stateOf(3, DAY)).isEqualTo(InstanceState.RUNNING);
    }

    @Test
    void shouldWaitForAllParents() {
        // Given
        harness.add(
                Task.builder(1, "A").real(10, "run a"),
                Task.builder(2, "B").real(20, "run b"),
                Task.builder(3, "join").dependsOn(1).dependsOn(2)
        );
        harness.tick(T0);

        // When
        harness.succeed(1, DAY, T1);
        harness.tick(T1);

        // Then
        Instance join = harness.latest(3, DAY);
        assertThat(join.state()).isEqualTo(InstanceState.WAITING);
        assertThat(join.parents().get(1L).isSatisfied()).isTrue();
        assertThat(join.parents().get(2L).status()).isEqualTo(ParentLink.Status.UNRESOLVED);

        // When
        harness.succeed(2, DAY, T1.plusSeconds(30));
        harness.tick(T1.plusSeconds(60));

        // Then
        assertThat(harness.stateOf(3, DAY)).isEqualTo(InstanceState.SUCCEEDED);
    }

    @Test
    void shouldIgnoreReleaseWithoutWaitingInstance() {
        // Given
        harness.add(Task.builder(1, "A").real(10, "run a"));
        harness.tick(T0);

        // When
        boolean released = harness.resolver.release(1, DAY, harness.graph(), T1);
        boolean unknown = harness.resolver.release(2, DAY, harness.graph(), T1);

        // Then
        assertThat(released).isFalse();
        assertThat(unknown).isFalse();
        assertThat(harness.stateOf(1, DAY)).isEqualTo(InstanceState.RUNNING);
    }

    @Test
    void shouldOnlyReleaseUnsatisfiableLinks() {
        // Given: parent 1 is weekly, parent 2 shares the daily cycle
        harness.add(
                Task.builder(1, "weekly").period(SchedulePeriod.WEEKLY),
                Task.builder(2, "daily").real(20, "run"),
                Task.builder(3, "child").real(30, "run").dependsOn(1).dependsOn(2)
        );
        harness.tick(T0);

        // When
        boolean released = harness.resolver.release(3, DAY, harness.graph(), T1);

        // Then: still waiting on the daily parent
        Instance child = harness.latest(3, DAY);
        assertThat(released).isTrue();
        assertThat(child.state()).isEqualTo(InstanceState.WAITING);
        assertThat(child.parents().get(1L).isSatisfied()).isTrue();
        assertThat(child.parents().get(2L).status()).isEqualTo(ParentLink.Status.UNRESOLVED);
    }
}
