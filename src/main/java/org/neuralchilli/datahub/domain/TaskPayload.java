package org.neuralchilli.datahub.domain;

import java.io.Serializable;

/**
 * What a task runs. Real payloads go to the execution backend,
 * virtual ones are join points that only fan out to their children.
 */
public sealed interface TaskPayload extends Serializable {

    boolean isVirtual();

    /**
     * Code snapshot plus opaque execution arguments.
     */
    record Real(long mirrorId, String args) implements TaskPayload {
        public Real {
            if (args == null) {
                args = "";
            }
        }

        @Override
        public boolean isVirtual() {
            return false;
        }
    }

    /**
     * Payload-less join node
     */
    record Virtual() implements TaskPayload {
        @Override
        public boolean isVirtual() {
            return true;
        }
    }

    static TaskPayload real(long mirrorId, String args) {
        return new Real(mirrorId, args);
    }

    static TaskPayload virtual() {
        return new Virtual();
    }
}
