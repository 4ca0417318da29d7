package org.neuralchilli.datahub.core;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Date functions for args expressions, exposed as {@code date}.
 * Every function accepts an ISO date ({@code 2024-05-01}) or an ISO date-time
 * ({@code 2024-05-01T13:00}) and returns a value of the same shape.
 */
public class DateFunctions {

    /**
     * Add time to a date
     * @param dateStr ISO date or date-time
     * @param amount Amount to add (can be negative)
     * @param unit Unit: "hours", "days", "weeks", "months", "years"
     */
    public String add(String dateStr, long amount, String unit) {
        if (!isDateTime(dateStr)) {
            LocalDate date = LocalDate.parse(dateStr);
            return switch (unit.toLowerCase()) {
                case "days", "day" -> date.plusDays(amount).toString();
                case "weeks", "week" -> date.plusWeeks(amount).toString();
                case "months", "month" -> date.plusMonths(amount).toString();
                case "years", "year" -> date.plusYears(amount).toString();
                default -> throw new IllegalArgumentException(
                        "Invalid unit for a date: " + unit + ". Use: days, weeks, months, years"
                );
            };
        }

        LocalDateTime dateTime = LocalDateTime.parse(dateStr);
        return switch (unit.toLowerCase()) {
            case "hours", "hour" -> dateTime.plusHours(amount).toString();
            case "days", "day" -> dateTime.plusDays(amount).toString();
            case "weeks", "week" -> dateTime.plusWeeks(amount).toString();
            case "months", "month" -> dateTime.plusMonths(amount).toString();
            case "years", "year" -> dateTime.plusYears(amount).toString();
            default -> throw new IllegalArgumentException(
                    "Invalid unit: " + unit + ". Use: hours, days, weeks, months, years"
            );
        };
    }

    public String sub(String dateStr, long amount, String unit) {
        return add(dateStr, -amount, unit);
    }

    /**
     * Format a date or date-time
     * @param pattern DateTimeFormatter pattern
     */
    public String format(String dateStr, String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern);
        if (isDateTime(dateStr)) {
            return LocalDateTime.parse(dateStr).format(formatter);
        }
        return LocalDate.parse(dateStr).format(formatter);
    }

    /**
     * Date part of a date-time
     */
    public String day(String dateStr) {
        return isDateTime(dateStr) ? LocalDateTime.parse(dateStr).toLocalDate().toString() : dateStr;
    }

    public long daysBetween(String startDate, String endDate) {
        return ChronoUnit.DAYS.between(LocalDate.parse(day(startDate)), LocalDate.parse(day(endDate)));
    }

    private boolean isDateTime(String value) {
        return value.indexOf('T') > 0;
    }
}
