package com.pocketplan.forecast.bankday;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bank day = Monday to Friday and not a public holiday. Holiday sets are materialized once per year.
 */
public class HolidayBankDayCalendar implements BankDayCalendar {

    private final HolidayCalendar holidayCalendar;
    private final Map<Integer, Set<LocalDate>> holidaysByYear = new ConcurrentHashMap<>();

    public HolidayBankDayCalendar(HolidayCalendar holidayCalendar) {
        this.holidayCalendar = Objects.requireNonNull(holidayCalendar, "holidayCalendar");
    }

    public String countryCode() {
        return holidayCalendar.countryCode();
    }

    @Override
    public boolean isBankDay(LocalDate date) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        if (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY) {
            return false;
        }
        return !holidaysByYear.computeIfAbsent(date.getYear(), holidayCalendar::holidays).contains(date);
    }
}
