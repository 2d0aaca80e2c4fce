package com.pocketplan.forecast.model.recurrence;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * Every {@code interval} weeks on {@code weekday}, starting with the first such weekday on or after
 * the pattern's start date.
 */
public record Weekly(DayOfWeek weekday, int interval, BankDayAdjustment adjustment) implements DateRecurrence {

    public Weekly {
        Objects.requireNonNull(weekday, "weekday");
        RecurrencePattern.requirePositiveInterval(interval);
        Objects.requireNonNull(adjustment, "adjustment");
    }
}
