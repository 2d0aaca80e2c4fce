package com.pocketplan.forecast.bankday;

import com.pocketplan.forecast.model.recurrence.AdjustmentDirection;
import com.pocketplan.forecast.model.recurrence.BankDayAdjustment;
import java.time.LocalDate;
import java.time.YearMonth;
import org.springframework.stereotype.Component;

/**
 * Moves a computed date onto a bank day. Stateless; the only outside input is the calendar passed in.
 */
@Component
public class BankDayAdjuster {

    /**
     * Longest walk tolerated before the calendar is considered broken. Also bounds how far an adjusted
     * date can drift from its candidate, which the generator relies on when widening its scan.
     */
    public static final int MAX_SHIFT_DAYS = 31;

    public LocalDate adjust(LocalDate date, BankDayAdjustment adjustment, BankDayCalendar calendar) {
        if (!adjustment.isActive() || calendar.isBankDay(date)) {
            return date;
        }
        LocalDate adjusted = walk(date, adjustment.direction(), calendar);
        if (adjustment.keepInMonth() && !YearMonth.from(adjusted).equals(YearMonth.from(date))) {
            LocalDate reversed = walk(date, adjustment.direction().reverse(), calendar);
            if (YearMonth.from(reversed).equals(YearMonth.from(date))) {
                return reversed;
            }
        }
        return adjusted;
    }

    private static LocalDate walk(LocalDate start, AdjustmentDirection direction, BankDayCalendar calendar) {
        int step = direction == AdjustmentDirection.NEXT ? 1 : -1;
        LocalDate cursor = start;
        for (int shifted = 0; shifted <= MAX_SHIFT_DAYS; shifted++) {
            if (calendar.isBankDay(cursor)) {
                return cursor;
            }
            cursor = cursor.plusDays(step);
        }
        throw new IllegalStateException("no bank day within " + MAX_SHIFT_DAYS + " days of " + start);
    }
}
