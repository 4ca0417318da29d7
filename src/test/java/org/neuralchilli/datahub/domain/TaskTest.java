package org.neuralchilli.datahub.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    @Test
    void shouldBuildVirtualDailyTaskByDefault() {
        Task task = Task.builder(1, "join").build();

        assertThat(task.payload().isVirtual()).isTrue();
        assertThat(task.period()).isEqualTo(SchedulePeriod.DAILY);
        assertThat(task.queue()).isEqualTo(RunPolicy.DEFAULT_QUEUE);
        assertThat(task.isRoot()).isTrue();
        assertThat(task.isSchedulable()).isTrue();
    }

    @Test
    void shouldCopyPolicyFields() {
        Task task = Task.builder(2, "load")
                .real(10, "run")
                .queue("etl")
                .priority(3)
                .pendingTimeout(15)
                .runningTimeout(60)
                .retries(2)
                .retryDelay(5)
                .softFail(true)
                .build();

        RunPolicy policy = task.policy();
        assertThat(policy).isEqualTo(new RunPolicy("etl", 3, 15, 60, 2, 5, true));
        assertThat(policy.maxAttempts()).isEqualTo(3);
    }

    @Test
    void shouldNotBeSchedulableWhenInvalidOrRemoved() {
        assertThat(Task.builder(1, "a").valid(false).build().isSchedulable()).isFalse();
        assertThat(Task.builder(1, "a").removed(true).build().isSchedulable()).isFalse();
    }

    @Test
    void shouldDefaultBlankQueue() {
        Task task = Task.builder(1, "a").queue(" ").build();

        assertThat(task.queue()).isEqualTo("default");
    }

    @Test
    void shouldCopyParentDescriptorsDefensively() {
        Map<String, String> descriptor = new HashMap<>(Map.of("kind", "force"));
        Task task = Task.builder(3, "c").parent(1, descriptor).parent(2, null).owners(Set.of(7L)).build();
        descriptor.put("kind", "success");

        assertThat(task.parent().get(1L)).containsEntry("kind", "force");
        assertThat(task.parent().get(2L)).isEmpty();
        assertThat(task.owners()).containsExactly(7L);
        assertThat(task.isRoot()).isFalse();
    }

    @Test
    void shouldRejectInvalidDefinitions() {
        assertThatThrownBy(() -> Task.builder(0, "a").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> Task.builder(1, " ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Task.builder(1, "a").period(null).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Task.builder(1, "a").retries(-1).build().policy())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
