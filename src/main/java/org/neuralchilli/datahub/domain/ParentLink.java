package org.neuralchilli.datahub.domain;

import java.io.Serializable;

/**
 * Link from an instance to the same-cycle instance of one of its parent tasks.
 */
public record ParentLink(
        long parentTaskId,
        ConditionKind kind,
        Status status
) implements Serializable {

    public enum Status {
        /**
         * Parent has not reached a final state yet
         */
        UNRESOLVED,
        SATISFIED,
        /**
         * Parent finished in a way that can never satisfy the condition
         */
        BLOCKED,
        /**
         * Parent had no instance in the cycle when the link was made
         */
        UNSATISFIABLE
    }

    public ParentLink {
        if (kind == null) {
            throw new IllegalArgumentException("Condition kind cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Link status cannot be null");
        }
    }

    public static ParentLink unresolved(long parentTaskId, ConditionKind kind) {
        return new ParentLink(parentTaskId, kind, Status.UNRESOLVED);
    }

    public static ParentLink unsatisfiable(long parentTaskId, ConditionKind kind) {
        return new ParentLink(parentTaskId, kind, Status.UNSATISFIABLE);
    }

    public ParentLink withStatus(Status newStatus) {
        return new ParentLink(parentTaskId, kind, newStatus);
    }

    public boolean isSatisfied() {
        return status == Status.SATISFIED;
    }

    public boolean isBlocked() {
        return status == Status.BLOCKED;
    }

    public boolean isUnsatisfiable() {
        return status == Status.UNSATISFIABLE;
    }
}
