package com.pocketplan.forecast.bankday;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only bank-day lookup. Implementations must answer from already materialized data; the
 * occurrence engine calls this in tight loops.
 */
@FunctionalInterface
public interface BankDayCalendar {

    boolean isBankDay(LocalDate date);

    /**
     * Weekends and holidays in the inclusive range, ascending.
     */
    default List<LocalDate> nonBankDays(LocalDate fromInclusive, LocalDate toInclusive) {
        if (toInclusive.isBefore(fromInclusive)) {
            throw new IllegalArgumentException("from_date must be before or equal to to_date");
        }
        List<LocalDate> days = new ArrayList<>();
        LocalDate cursor = fromInclusive;
        while (!cursor.isAfter(toInclusive)) {
            if (!isBankDay(cursor)) {
                days.add(cursor);
            }
            cursor = cursor.plusDays(1);
        }
        return days;
    }
}
