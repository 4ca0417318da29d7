package org.neuralchilli.datahub.service;

import java.util.List;
import java.util.Optional;

/**
 * Result of loading one catalog file.
 */
public sealed interface LoadResult {

    boolean isSuccess();

    /**
     * File the result belongs to
     */
    String file();

    /**
     * Ids of the tasks read from the file (empty on failure)
     */
    List<Long> taskIds();

    Optional<String> error();

    record Success(String file, List<Long> taskIds) implements LoadResult {
        public Success {
            taskIds = List.copyOf(taskIds);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String file, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public List<Long> taskIds() {
            return List.of();
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String file, List<Long> taskIds) {
        return new Success(file, taskIds);
    }

    static LoadResult failure(String file, Exception e) {
        return new Failure(file, e.getMessage());
    }
}
