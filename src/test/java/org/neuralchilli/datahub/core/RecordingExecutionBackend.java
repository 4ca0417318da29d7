package org.neuralchilli.datahub.core;

import org.neuralchilli.datahub.domain.InstanceKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Backend double that accepts everything unless told otherwise and remembers what it saw.
 */
public class RecordingExecutionBackend implements ExecutionBackend {

    final List<SubmitRequest> submitted = new ArrayList<>();
    final List<InstanceKey> killed = new ArrayList<>();
    final Set<Long> rejectedTasks = new HashSet<>();
    boolean failing = false;

    @Override
    public SubmitResult submit(SubmitRequest request) {
        if (failing) {
            throw new IllegalStateException("backend unavailable");
        }
        if (rejectedTasks.contains(request.taskId())) {
            return SubmitResult.REJECTED;
        }
        submitted.add(request);
        return SubmitResult.ACCEPTED;
    }

    @Override
    public void kill(InstanceKey key) {
        killed.add(key);
    }

    List<Long> submittedTaskIds() {
        return submitted.stream().map(SubmitRequest::taskId).toList();
    }
}
