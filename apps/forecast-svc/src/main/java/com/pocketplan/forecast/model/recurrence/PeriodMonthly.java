package com.pocketplan.forecast.model.recurrence;

public record PeriodMonthly(int interval) implements PeriodRecurrence {

    public PeriodMonthly {
        RecurrencePattern.requirePositiveInterval(interval);
    }
}
