package com.pocketplan.forecast.bankday;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Danish public holidays, computed rather than looked up.
 */
public class DanishHolidayCalendar implements HolidayCalendar {

    public static final String COUNTRY_CODE = "DK";

    @Override
    public String countryCode() {
        return COUNTRY_CODE;
    }

    @Override
    public Set<LocalDate> holidays(int year) {
        Set<LocalDate> holidays = new HashSet<>();
        holidays.add(LocalDate.of(year, 1, 1));   // Nytårsdag
        holidays.add(LocalDate.of(year, 6, 5));   // Grundlovsdag
        holidays.add(LocalDate.of(year, 12, 25)); // Juledag
        holidays.add(LocalDate.of(year, 12, 26)); // 2. juledag

        LocalDate easter = easterSunday(year);
        holidays.add(easter.minusDays(3));  // Skærtorsdag
        holidays.add(easter.minusDays(2));  // Langfredag
        holidays.add(easter);               // Påskedag
        holidays.add(easter.plusDays(1));   // 2. påskedag
        holidays.add(easter.plusDays(39));  // Kristi himmelfartsdag
        holidays.add(easter.plusDays(49));  // Pinsedag
        holidays.add(easter.plusDays(50));  // 2. pinsedag
        return Set.copyOf(holidays);
    }

    /**
     * Anonymous Gregorian computus.
     */
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
