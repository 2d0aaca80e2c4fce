package com.pocketplan.forecast.model.recurrence;

import java.util.Objects;

/**
 * A fixed day of the month; days past the end of a short month clamp to its last day.
 */
public record MonthlyFixed(int dayOfMonth, int interval, BankDayAdjustment adjustment) implements DateRecurrence {

    public MonthlyFixed {
        if (dayOfMonth < 1 || dayOfMonth > 31) {
            throw new IllegalArgumentException("day_of_month must be between 1 and 31");
        }
        RecurrencePattern.requirePositiveInterval(interval);
        Objects.requireNonNull(adjustment, "adjustment");
    }
}
