package com.pocketplan.forecast.model.recurrence;

import java.time.DayOfWeek;
import java.time.Month;
import java.util.Objects;

public record YearlyRelative(
        Month month,
        DayOfWeek weekday,
        RelativePosition relativePosition,
        int interval,
        BankDayAdjustment adjustment
) implements DateRecurrence {

    public YearlyRelative {
        Objects.requireNonNull(month, "month");
        Objects.requireNonNull(weekday, "weekday");
        Objects.requireNonNull(relativePosition, "relativePosition");
        RecurrencePattern.requirePositiveInterval(interval);
        Objects.requireNonNull(adjustment, "adjustment");
    }
}
