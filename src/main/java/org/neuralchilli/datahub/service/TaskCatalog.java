package org.neuralchilli.datahub.service;

import org.neuralchilli.datahub.domain.Task;

import java.util.List;

/**
 * Read-only view of the task definitions owned by the catalog.
 */
public interface TaskCatalog {

    /**
     * All tasks that are valid and not removed, ordered by id.
     * The returned list is a snapshot and does not change afterwards.
     */
    List<Task> snapshot();
}
