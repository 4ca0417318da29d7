package org.neuralchilli.datahub.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.datahub.domain.*;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Compact binary serializer for Instance, the most frequently written value
 * in the scheduler maps. Enums are written by ordinal, so constants may only
 * be appended.
 */
public class InstanceSerializer implements StreamSerializer<Instance> {

    public static final int TYPE_ID = 1001;

    private static final byte PAYLOAD_VIRTUAL = 0;
    private static final byte PAYLOAD_REAL = 1;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, Instance instance) throws IOException {
        // Identity
        out.writeLong(instance.taskId());
        out.writeString(instance.cycleId());
        out.writeInt(instance.attempt());
        out.writeString(instance.taskName());

        // Cycle
        out.writeInt(instance.cycle().period().ordinal());
        out.writeString(instance.cycle().start().toString());

        writePayload(out, instance.payload());
        writePolicy(out, instance.policy());

        out.writeLong(instance.sequence());
        out.writeInt(instance.state().ordinal());

        // Parent links
        out.writeInt(instance.parents().size());
        for (ParentLink link : instance.parents().values()) {
            out.writeLong(link.parentTaskId());
            out.writeInt(link.kind().ordinal());
            out.writeInt(link.status().ordinal());
        }

        // Timestamps
        out.writeLong(instance.createdAt().getEpochSecond());
        out.writeInt(instance.createdAt().getNano());
        writeInstantOrNull(out, instance.notBefore());
        writeInstantOrNull(out, instance.admittedAt());
        writeInstantOrNull(out, instance.startedAt());
        writeInstantOrNull(out, instance.killRequestedAt());
        writeInstantOrNull(out, instance.finishedAt());

        // Failure
        out.writeInt(instance.reason() != null ? instance.reason().ordinal() : -1);
        writeStringOrNull(out, instance.message());
    }

    @Override
    public Instance read(ObjectDataInput in) throws IOException {
        long taskId = in.readLong();
        String cycleId = in.readString();
        int attempt = in.readInt();
        String taskName = in.readString();

        SchedulePeriod period = SchedulePeriod.values()[in.readInt()];
        LocalDateTime start = LocalDateTime.parse(in.readString());
        FiringCycle cycle = new FiringCycle(cycleId, period, start);

        TaskPayload payload = readPayload(in);
        RunPolicy policy = readPolicy(in);

        long sequence = in.readLong();
        InstanceState state = InstanceState.values()[in.readInt()];

        int linkCount = in.readInt();
        Map<Long, ParentLink> parents = new HashMap<>(linkCount);
        for (int i = 0; i < linkCount; i++) {
            long parentTaskId = in.readLong();
            ConditionKind kind = ConditionKind.values()[in.readInt()];
            ParentLink.Status status = ParentLink.Status.values()[in.readInt()];
            parents.put(parentTaskId, new ParentLink(parentTaskId, kind, status));
        }

        Instant createdAt = Instant.ofEpochSecond(in.readLong(), in.readInt());
        Instant notBefore = readInstantOrNull(in);
        Instant admittedAt = readInstantOrNull(in);
        Instant startedAt = readInstantOrNull(in);
        Instant killRequestedAt = readInstantOrNull(in);
        Instant finishedAt = readInstantOrNull(in);

        int reasonOrdinal = in.readInt();
        FailureReason reason = reasonOrdinal >= 0 ? FailureReason.values()[reasonOrdinal] : null;
        String message = readStringOrNull(in);

        return new Instance(
                new InstanceKey(taskId, cycleId, attempt),
                taskName,
                cycle,
                payload,
                policy,
                sequence,
                state,
                parents,
                createdAt,
                notBefore,
                admittedAt,
                startedAt,
                killRequestedAt,
                finishedAt,
                reason,
                message
        );
    }

    private void writePayload(ObjectDataOutput out, TaskPayload payload) throws IOException {
        if (payload instanceof TaskPayload.Real real) {
            out.writeByte(PAYLOAD_REAL);
            out.writeLong(real.mirrorId());
            out.writeString(real.args());
        } else {
            out.writeByte(PAYLOAD_VIRTUAL);
        }
    }

    private TaskPayload readPayload(ObjectDataInput in) throws IOException {
        byte type = in.readByte();
        return switch (type) {
            case PAYLOAD_VIRTUAL -> TaskPayload.virtual();
            case PAYLOAD_REAL -> TaskPayload.real(in.readLong(), in.readString());
            default -> throw new IOException("Unknown payload type: " + type);
        };
    }

    private void writePolicy(ObjectDataOutput out, RunPolicy policy) throws IOException {
        out.writeString(policy.queue());
        out.writeInt(policy.priority());
        out.writeInt(policy.pendingTimeout());
        out.writeInt(policy.runningTimeout());
        out.writeInt(policy.retries());
        out.writeInt(policy.retryDelay());
        out.writeBoolean(policy.softFail());
    }

    private RunPolicy readPolicy(ObjectDataInput in) throws IOException {
        return new RunPolicy(
                in.readString(),
                in.readInt(),
                in.readInt(),
                in.readInt(),
                in.readInt(),
                in.readInt(),
                in.readBoolean()
        );
    }

    // Helper methods for nullable values
    private void writeStringOrNull(ObjectDataOutput out, String value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeString(value);
        }
    }

    private String readStringOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readString() : null;
    }

    private void writeInstantOrNull(ObjectDataOutput out, Instant value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeLong(value.getEpochSecond());
            out.writeInt(value.getNano());
        }
    }

    private Instant readInstantOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? Instant.ofEpochSecond(in.readLong(), in.readInt()) : null;
    }
}
