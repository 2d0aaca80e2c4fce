package com.pocketplan.forecast.model.recurrence;

public record MonthlyBankDay(int bankDayNumber, boolean fromEnd, int interval) implements BankDayRecurrence {

    public MonthlyBankDay {
        BankDayRecurrence.requireBankDayNumber(bankDayNumber);
        RecurrencePattern.requirePositiveInterval(interval);
    }
}
