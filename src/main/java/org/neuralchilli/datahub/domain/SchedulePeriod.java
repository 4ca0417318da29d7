package org.neuralchilli.datahub.domain;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * How often a task fires.
 */
public enum SchedulePeriod {
    /**
     * Fires a single cycle, ever
     */
    ONCE,

    /**
     * Fires at the top of every hour
     */
    HOURLY,

    /**
     * Fires at midnight
     */
    DAILY,

    /**
     * Fires at midnight on Mondays
     */
    WEEKLY,

    /**
     * Fires at midnight on the first day of the month
     */
    MONTHLY;

    /**
     * Floor a local time to the boundary of the period that contains it.
     * ONCE has no boundaries, the time is only truncated to the minute.
     */
    public LocalDateTime boundaryOf(LocalDateTime time) {
        return switch (this) {
            case ONCE -> time.truncatedTo(ChronoUnit.MINUTES);
            case HOURLY -> time.truncatedTo(ChronoUnit.HOURS);
            case DAILY -> time.truncatedTo(ChronoUnit.DAYS);
            case WEEKLY -> time.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> time.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.firstDayOfMonth());
        };
    }

    /**
     * Case-insensitive lookup used by the catalog parser.
     */
    public static SchedulePeriod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Schedule period cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown schedule period: " + value + ". Use: once, hourly, daily, weekly, monthly"
            );
        }
    }
}
