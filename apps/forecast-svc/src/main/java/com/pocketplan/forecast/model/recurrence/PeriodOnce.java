package com.pocketplan.forecast.model.recurrence;

/**
 * The amount applies once, to the month containing the pattern's start date.
 */
public record PeriodOnce() implements PeriodRecurrence {
}
