package com.pocketplan.forecast.model.recurrence;

/**
 * Recurrences that resolve to a concrete calendar day which may then be moved onto a bank day.
 */
public sealed interface DateRecurrence extends RecurrencePattern
        permits Once, Daily, Weekly, MonthlyFixed, MonthlyRelative, YearlyFixed, YearlyRelative {

    BankDayAdjustment adjustment();
}
