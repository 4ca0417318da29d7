package org.neuralchilli.datahub.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.datahub.domain.FiringCycle;
import org.neuralchilli.datahub.domain.Instance;
import org.neuralchilli.datahub.domain.SchedulePeriod;
import org.neuralchilli.datahub.domain.Task;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class ArgsTemplateResolverTest {

    private final ArgsTemplateResolver resolver = new ArgsTemplateResolver();

    private final ArgsContext ctx = new ArgsContext(
            7L, "load_orders", "DAILY@2025-10-17T00:00", "DAILY",
            LocalDateTime.parse("2025-10-17T00:00"), 2, 300L
    );

    @Test
    void shouldReturnTemplateWithoutExpressionsAsIs() {
        String result = resolver.interpolate("{\"command\": \"load\", \"args\": [\"--all\"]}", ctx);

        assertThat(result).isEqualTo("{\"command\": \"load\", \"args\": [\"--all\"]}");
    }

    @Test
    void shouldExposeInstanceVariables() {
        String result = resolver.interpolate(
                "${taskName} ${taskId} ${cycleId} ${period} ${attempt} ${mirrorId}", ctx);

        assertThat(result).isEqualTo("load_orders 7 DAILY@2025-10-17T00:00 DAILY 2 300");
    }

    @Test
    void shouldExposeCycleStart() {
        assertThat(resolver.interpolate("--from=${cycle}", ctx)).isEqualTo("--from=2025-10-17T00:00");
        assertThat(resolver.interpolate("--day=${cycleDate}", ctx)).isEqualTo("--day=2025-10-17");
    }

    @Test
    void shouldEvaluateDateFunctions() {
        assertThat(resolver.interpolate("${date.sub(cycleDate, 1, 'days')}", ctx)).isEqualTo("2025-10-16");
        assertThat(resolver.interpolate("${date.add(cycle, 6, 'hours')}", ctx)).isEqualTo("2025-10-17T06:00");
        assertThat(resolver.interpolate("${date.format(cycleDate, 'yyyyMMdd')}", ctx)).isEqualTo("20251017");
    }

    @Test
    void shouldEvaluateExpressionInsideJson() {
        String result = resolver.interpolate(
                "{\"command\": \"load\", \"args\": [\"--day=${date.sub(cycleDate, 1, 'days')}\"]}", ctx);

        assertThat(result).isEqualTo("{\"command\": \"load\", \"args\": [\"--day=2025-10-16\"]}");
    }

    @Test
    void shouldEvaluateConditional() {
        String result = resolver.interpolate("${attempt > 1 ? '--resume' : '--fresh'}", ctx);

        assertThat(result).isEqualTo("--resume");
    }

    @Test
    void shouldFailOnUnknownVariable() {
        assertThatThrownBy(() -> resolver.interpolate("--x=${nosuch}", ctx))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("Failed to evaluate expression: ${nosuch}");
    }

    @Test
    void shouldFailOnUnclosedExpression() {
        assertThatThrownBy(() -> resolver.interpolate("--day=${cycleDate", ctx))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("Unclosed expression");
    }

    @Test
    void shouldFailWhenFunctionThrows() {
        assertThatThrownBy(() -> resolver.interpolate("${date.add(cycleDate, 1, 'fortnights')}", ctx))
                .isInstanceOf(ExpressionException.class);
    }

    @Test
    void shouldResolveArgsOfRealInstance() {
        // Given
        Task task = Task.builder(3, "export").real(42, "export --day=${cycleDate} --try=${attempt}").build();
        FiringCycle cycle = FiringCycle.current(SchedulePeriod.DAILY,
                Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        Instance instance = Instance.create(task, cycle, 1, Instant.parse("2024-05-01T10:00:00Z"));

        // When
        String args = resolver.resolve(instance);

        // Then
        assertThat(args).isEqualTo("export --day=2024-05-01 --try=1");
    }

    @Test
    void shouldResolveVirtualInstanceToEmptyArgs() {
        Task task = Task.builder(3, "join").build();
        FiringCycle cycle = FiringCycle.current(SchedulePeriod.DAILY,
                Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

        String args = resolver.resolve(Instance.create(task, cycle, 1, Instant.parse("2024-05-01T10:00:00Z")));

        assertThat(args).isEmpty();
    }
}
