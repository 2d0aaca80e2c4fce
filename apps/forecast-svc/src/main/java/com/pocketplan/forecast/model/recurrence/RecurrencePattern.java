package com.pocketplan.forecast.model.recurrence;

/**
 * How an amount pattern repeats.
 *
 * <p>The variants form a closed set split into three families:
 *
 * <ul>
 *   <li>{@link DateRecurrence} - lands on a computed calendar day, optionally shifted onto a bank day
 *   <li>{@link BankDayRecurrence} - lands on the Nth bank day of a month, counted from either end
 *   <li>{@link PeriodRecurrence} - applies to a whole month rather than a specific day
 * </ul>
 */
public sealed interface RecurrencePattern permits DateRecurrence, BankDayRecurrence, PeriodRecurrence {

    static void requirePositiveInterval(int interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be at least 1");
        }
    }
}
