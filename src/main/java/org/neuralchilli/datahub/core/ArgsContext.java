package org.neuralchilli.datahub.core;

import org.neuralchilli.datahub.domain.Instance;
import org.neuralchilli.datahub.domain.TaskPayload;

import java.time.LocalDateTime;

/**
 * Variables visible to args expressions, taken from the instance being dispatched.
 */
public record ArgsContext(
        long taskId,
        String taskName,
        String cycleId,
        String period,
        LocalDateTime cycleStart,
        int attempt,
        long mirrorId
) {

    public static ArgsContext of(Instance instance) {
        long mirrorId = instance.payload() instanceof TaskPayload.Real real ? real.mirrorId() : 0L;
        return new ArgsContext(
                instance.taskId(),
                instance.taskName(),
                instance.cycleId(),
                instance.cycle().period().name(),
                instance.cycle().start(),
                instance.attempt(),
                mirrorId
        );
    }

    /**
     * Cycle start as {@code yyyy-MM-ddTHH:mm}
     */
    public String cycle() {
        return cycleStart.toString();
    }

    /**
     * Cycle start date as {@code yyyy-MM-dd}
     */
    public String cycleDate() {
        return cycleStart.toLocalDate().toString();
    }
}
