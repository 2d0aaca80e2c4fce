package com.pocketplan.forecast.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "pocketplan")
public record PocketplanProperties(
        BankDays bankDays,
        Forecast forecast,
        Preview preview
) {

    @ConstructorBinding
    public PocketplanProperties {
        // every section is optional; missing ones fall back to their defaults
        if (bankDays == null) {
            bankDays = new BankDays(null, null);
        }
        if (forecast == null) {
            forecast = new Forecast(null, null, null, null);
        }
        if (preview == null) {
            preview = new Preview(null);
        }
        if (forecast.defaultMonths() > forecast.maxMonths()) {
            throw new IllegalArgumentException("forecast.defaultMonths must not exceed forecast.maxMonths");
        }
    }

    public static PocketplanProperties defaults() {
        return new PocketplanProperties(null, null, null);
    }

    public record BankDays(String country, Integer maxRangeDays) {
        public BankDays {
            if (country == null || country.isBlank()) {
                country = "DK";
            }
            if (maxRangeDays == null) {
                maxRangeDays = 366;
            }
            if (maxRangeDays <= 0) {
                throw new IllegalArgumentException("bankDays.maxRangeDays must be positive");
            }
        }
    }

    /**
     * @param largeExpenseThreshold minor units; an expense occurrence strictly above it is "large"
     */
    public record Forecast(
            Integer defaultMonths,
            Integer maxMonths,
            Long largeExpenseThreshold,
            Integer largeExpenseLookaheadMonths
    ) {
        public Forecast {
            if (defaultMonths == null) {
                defaultMonths = 12;
            }
            if (maxMonths == null) {
                maxMonths = 60;
            }
            if (largeExpenseThreshold == null) {
                largeExpenseThreshold = 500_000L;
            }
            if (largeExpenseLookaheadMonths == null) {
                largeExpenseLookaheadMonths = 3;
            }
            if (defaultMonths <= 0 || maxMonths <= 0) {
                throw new IllegalArgumentException("forecast months must be positive");
            }
            if (largeExpenseThreshold < 0) {
                throw new IllegalArgumentException("forecast.largeExpenseThreshold must not be negative");
            }
            if (largeExpenseLookaheadMonths <= 0) {
                throw new IllegalArgumentException("forecast.largeExpenseLookaheadMonths must be positive");
            }
        }
    }

    public record Preview(Integer maxRangeDays) {
        public Preview {
            if (maxRangeDays == null) {
                maxRangeDays = 1096;
            }
            if (maxRangeDays <= 0) {
                throw new IllegalArgumentException("preview.maxRangeDays must be positive");
            }
        }
    }
}
