package org.neuralchilli.datahub.domain;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Logical time bucket shared by every instance fired for the same period boundary.
 * Parent and child instances are only ever linked within one cycle.
 */
public record FiringCycle(
        String id,
        SchedulePeriod period,
        LocalDateTime start
) implements Serializable {

    public static final String ONCE_ID = "ONCE";

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    public FiringCycle {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Cycle id cannot be null or empty");
        }
        if (period == null) {
            throw new IllegalArgumentException("Cycle period cannot be null");
        }
        if (start == null) {
            throw new IllegalArgumentException("Cycle start cannot be null");
        }
    }

    /**
     * The cycle containing {@code now} for the given period.
     * All ONCE tasks share a single cycle so they can depend on each other.
     */
    public static FiringCycle current(SchedulePeriod period, Instant now, ZoneId zone) {
        LocalDateTime boundary = period.boundaryOf(LocalDateTime.ofInstant(now, zone));
        return of(period, boundary);
    }

    public static FiringCycle of(SchedulePeriod period, LocalDateTime boundary) {
        String id = period == SchedulePeriod.ONCE
                ? ONCE_ID
                : period.name() + "@" + boundary.format(ID_FORMAT);
        return new FiringCycle(id, period, boundary);
    }

    @Override
    public String toString() {
        return id;
    }
}
