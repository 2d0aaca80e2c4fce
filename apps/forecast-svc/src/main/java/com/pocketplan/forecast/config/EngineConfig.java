package com.pocketplan.forecast.config;

import com.pocketplan.forecast.bankday.BankDayCalendar;
import com.pocketplan.forecast.bankday.BankDayCalendars;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public BankDayCalendars bankDayCalendars() {
        return BankDayCalendars.defaults();
    }

    @Bean
    public BankDayCalendar bankDayCalendar(BankDayCalendars calendars, PocketplanProperties properties) {
        String country = properties.bankDays().country();
        log.info("Bank day calendar configured: country={}", country);
        return calendars.forCountry(country);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
