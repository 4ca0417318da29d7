package org.neuralchilli.datahub.core;

import org.neuralchilli.datahub.domain.InstanceKey;

/**
 * The runner that executes SQL/MR/Spark payloads.
 * Submission must not block on execution; outcomes come back through {@link ReportInbox}.
 * A backend only reports outcomes and never touches scheduling state.
 */
public interface ExecutionBackend {

    /**
     * Hand over one attempt.
     *
     * @return ACCEPTED when the backend took ownership of the work
     */
    SubmitResult submit(SubmitRequest request);

    /**
     * Best-effort signal to stop an attempt. Acknowledged by reporting a failure for it.
     */
    void kill(InstanceKey key);
}
