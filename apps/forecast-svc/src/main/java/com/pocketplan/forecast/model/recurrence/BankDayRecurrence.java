package com.pocketplan.forecast.model.recurrence;

/**
 * Recurrences anchored to the Nth bank day of a month. The result is a bank day by construction,
 * so no adjustment applies.
 */
public sealed interface BankDayRecurrence extends RecurrencePattern permits MonthlyBankDay, YearlyBankDay {

    int MAX_BANK_DAY_NUMBER = 10;

    int bankDayNumber();

    boolean fromEnd();

    int interval();

    static void requireBankDayNumber(int bankDayNumber) {
        if (bankDayNumber < 1 || bankDayNumber > MAX_BANK_DAY_NUMBER) {
            throw new IllegalArgumentException("bank_day_number must be between 1 and " + MAX_BANK_DAY_NUMBER);
        }
    }
}
