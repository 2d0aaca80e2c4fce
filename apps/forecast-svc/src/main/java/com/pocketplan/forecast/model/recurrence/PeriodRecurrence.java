package com.pocketplan.forecast.model.recurrence;

/**
 * Recurrences that apply an amount to a whole month. Never bank-day adjusted.
 */
public sealed interface PeriodRecurrence extends RecurrencePattern permits PeriodOnce, PeriodMonthly, PeriodYearly {
}
