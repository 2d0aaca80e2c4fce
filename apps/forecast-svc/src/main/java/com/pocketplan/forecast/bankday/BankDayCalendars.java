package com.pocketplan.forecast.bankday;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bank-day calendars keyed by ISO country code.
 */
public class BankDayCalendars {

    private final Map<String, HolidayBankDayCalendar> calendars;

    public BankDayCalendars(List<HolidayCalendar> holidayCalendars) {
        this.calendars = holidayCalendars.stream()
                .map(HolidayBankDayCalendar::new)
                .collect(Collectors.toUnmodifiableMap(
                        calendar -> calendar.countryCode().toUpperCase(Locale.ROOT),
                        Function.identity()));
    }

    public static BankDayCalendars defaults() {
        return new BankDayCalendars(List.of(new DanishHolidayCalendar()));
    }

    public BankDayCalendar forCountry(String countryCode) {
        String key = countryCode == null ? "" : countryCode.trim().toUpperCase(Locale.ROOT);
        HolidayBankDayCalendar calendar = calendars.get(key);
        if (calendar == null) {
            throw new IllegalArgumentException("Unsupported country code: " + countryCode);
        }
        return calendar;
    }
}
