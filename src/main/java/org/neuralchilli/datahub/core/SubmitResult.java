package org.neuralchilli.datahub.core;

/**
 * Answer of the execution backend to a submission.
 */
public enum SubmitResult {
    ACCEPTED,

    /**
     * Backend cannot take the work now; the instance stays Ready and is offered again next tick
     */
    REJECTED
}
