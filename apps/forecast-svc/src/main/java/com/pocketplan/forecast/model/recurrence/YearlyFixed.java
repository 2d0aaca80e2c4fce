package com.pocketplan.forecast.model.recurrence;

import java.time.Month;
import java.util.Objects;

/**
 * A fixed day in a fixed month, every {@code interval} years. Clamped like {@link MonthlyFixed}.
 */
public record YearlyFixed(Month month, int dayOfMonth, int interval, BankDayAdjustment adjustment) implements DateRecurrence {

    public YearlyFixed {
        Objects.requireNonNull(month, "month");
        if (dayOfMonth < 1 || dayOfMonth > 31) {
            throw new IllegalArgumentException("day_of_month must be between 1 and 31");
        }
        RecurrencePattern.requirePositiveInterval(interval);
        Objects.requireNonNull(adjustment, "adjustment");
    }
}
