package com.pocketplan.forecast.model.recurrence;

import java.time.Month;
import java.util.Objects;

public record YearlyBankDay(Month month, int bankDayNumber, boolean fromEnd, int interval) implements BankDayRecurrence {

    public YearlyBankDay {
        Objects.requireNonNull(month, "month");
        BankDayRecurrence.requireBankDayNumber(bankDayNumber);
        RecurrencePattern.requirePositiveInterval(interval);
    }
}
