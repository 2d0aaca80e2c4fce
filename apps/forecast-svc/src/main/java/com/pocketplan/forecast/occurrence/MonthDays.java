package com.pocketplan.forecast.occurrence;

import com.pocketplan.forecast.bankday.BankDayCalendar;
import com.pocketplan.forecast.model.recurrence.RelativePosition;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * Calendar lookups inside a single month.
 */
final class MonthDays {

    private MonthDays() {
    }

    /**
     * {@code dayOfMonth} in {@code month}, or the month's last day when the month is shorter.
     */
    static LocalDate clampedDay(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    static LocalDate relativeWeekday(YearMonth month, DayOfWeek weekday, RelativePosition position) {
        if (position == RelativePosition.LAST) {
            LocalDate cursor = month.atEndOfMonth();
            while (cursor.getDayOfWeek() != weekday) {
                cursor = cursor.minusDays(1);
            }
            return cursor;
        }
        // every month has at least four of each weekday
        return month.atDay(1)
                .with(TemporalAdjusters.nextOrSame(weekday))
                .plusWeeks(position.ordinalInMonth() - 1L);
    }

    /**
     * The Nth bank day of the month counted from the start, or from the end when {@code fromEnd}.
     * Empty when the month has fewer than N bank days.
     */
    static Optional<LocalDate> nthBankDay(YearMonth month, int n, boolean fromEnd, BankDayCalendar calendar) {
        int length = month.lengthOfMonth();
        int found = 0;
        for (int offset = 0; offset < length; offset++) {
            LocalDate day = fromEnd ? month.atDay(length - offset) : month.atDay(offset + 1);
            if (calendar.isBankDay(day)) {
                found++;
                if (found == n) {
                    return Optional.of(day);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Smallest k &ge; 0 such that {@code k * step >= distance}.
     */
    static long firstStepAtOrAfter(long distance, long step) {
        if (distance <= 0) {
            return 0;
        }
        return (distance + step - 1) / step;
    }

    /** Months since year 0. */
    static long monthIndex(YearMonth month) {
        return month.getYear() * 12L + month.getMonthValue() - 1;
    }

    static YearMonth fromMonthIndex(long index) {
        return YearMonth.of(Math.toIntExact(Math.floorDiv(index, 12L)), (int) Math.floorMod(index, 12L) + 1);
    }
}
