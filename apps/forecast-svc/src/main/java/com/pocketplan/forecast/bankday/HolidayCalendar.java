package com.pocketplan.forecast.bankday;

import java.time.LocalDate;
import java.util.Set;

/**
 * Public holidays of one country.
 */
public interface HolidayCalendar {

    String countryCode();

    Set<LocalDate> holidays(int year);
}
