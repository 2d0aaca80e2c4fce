package com.pocketplan.forecast.model.recurrence;

import java.util.Objects;

public record Daily(int interval, BankDayAdjustment adjustment) implements DateRecurrence {

    public Daily {
        RecurrencePattern.requirePositiveInterval(interval);
        Objects.requireNonNull(adjustment, "adjustment");
    }
}
