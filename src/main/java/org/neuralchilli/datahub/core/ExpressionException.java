package org.neuralchilli.datahub.core;

/**
 * Thrown when a {@code ${...}} expression in task args cannot be compiled or evaluated.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
