package org.neuralchilli.datahub.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.datahub.core.IntegrityViolation;
import org.neuralchilli.datahub.domain.Instance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to the {@code datahub.audit} log category,
 * so they can be routed to their own handler.
 */
@ApplicationScoped
public class LoggingAuditSink implements AuditSink {

    private static final Logger audit = LoggerFactory.getLogger("datahub.audit");

    @Override
    public void instanceFinished(Instance instance, boolean retryScheduled) {
        switch (instance.state()) {
            case SUCCEEDED -> audit.info("{} [{}] SUCCEEDED in {}ms",
                    instance.key(), instance.taskName(), instance.getRunDuration().toMillis());
            case SKIPPED -> audit.warn("{} [{}] SKIPPED: {}",
                    instance.key(), instance.taskName(), instance.message());
            default -> audit.warn("{} [{}] {} ({}): {}{}",
                    instance.key(), instance.taskName(), instance.state(), instance.reason(),
                    instance.message(), retryScheduled ? ", retry scheduled" : "");
        }
    }

    @Override
    public void catalogIntegrity(IntegrityViolation violation) {
        audit.warn("Catalog integrity: {}", violation);
    }
}
