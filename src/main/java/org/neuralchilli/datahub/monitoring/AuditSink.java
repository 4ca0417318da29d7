package org.neuralchilli.datahub.monitoring;

import org.neuralchilli.datahub.core.IntegrityViolation;
import org.neuralchilli.datahub.domain.Instance;

/**
 * Operator-facing notifications.
 */
public interface AuditSink {

    /**
     * An instance reached a terminal state.
     *
     * @param instance       the terminal attempt
     * @param retryScheduled whether a further attempt was created for the same cycle
     */
    void instanceFinished(Instance instance, boolean retryScheduled);

    /**
     * A task was excluded from scheduling. Called once per distinct violation
     * until it disappears from the catalog.
     */
    void catalogIntegrity(IntegrityViolation violation);
}
