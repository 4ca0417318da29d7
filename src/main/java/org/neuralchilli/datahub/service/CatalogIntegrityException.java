package org.neuralchilli.datahub.service;

/**
 * Thrown when a catalog entry cannot be scheduled as declared:
 * a dependency cycle, a dangling parent reference or an unknown condition kind.
 * The dependency graph builder catches it and excludes the task for the tick.
 */
public class CatalogIntegrityException extends RuntimeException {

    public CatalogIntegrityException(String message) {
        super(message);
    }

    public CatalogIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
