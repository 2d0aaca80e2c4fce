package com.pocketplan.forecast.service;

import com.pocketplan.forecast.bankday.BankDayCalendars;
import com.pocketplan.forecast.config.PocketplanProperties;
import com.pocketplan.forecast.model.DateWindow;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Non-bank days for shading a timeline.
 */
@Service
public class BankDayService {

    private final BankDayCalendars calendars;
    private final PocketplanProperties properties;

    public BankDayService(BankDayCalendars calendars, PocketplanProperties properties) {
        this.calendars = calendars;
        this.properties = properties;
    }

    public String defaultCountry() {
        return properties.bankDays().country();
    }

    public List<LocalDate> nonBankDays(String country, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("from_date must be before or equal to to_date");
        }
        int maxRangeDays = properties.bankDays().maxRangeDays();
        if (new DateWindow(from, to).lengthInDays() > maxRangeDays) {
            throw new IllegalArgumentException("Date range cannot exceed " + maxRangeDays + " days");
        }
        return calendars.forCountry(country == null ? defaultCountry() : country).nonBankDays(from, to);
    }
}
