package com.pocketplan.forecast.model.recurrence;

import java.time.DayOfWeek;
import java.util.Objects;

public record MonthlyRelative(
        DayOfWeek weekday,
        RelativePosition relativePosition,
        int interval,
        BankDayAdjustment adjustment
) implements DateRecurrence {

    public MonthlyRelative {
        Objects.requireNonNull(weekday, "weekday");
        Objects.requireNonNull(relativePosition, "relativePosition");
        RecurrencePattern.requirePositiveInterval(interval);
        Objects.requireNonNull(adjustment, "adjustment");
    }
}
