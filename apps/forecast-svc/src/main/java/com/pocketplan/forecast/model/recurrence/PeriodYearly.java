package com.pocketplan.forecast.model.recurrence;

import java.time.Month;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The amount applies to each selected month, every {@code interval} years.
 */
public record PeriodYearly(Set<Month> months, int interval) implements PeriodRecurrence {

    public PeriodYearly {
        Objects.requireNonNull(months, "months");
        if (months.isEmpty()) {
            throw new IllegalArgumentException("period_yearly requires at least one month");
        }
        RecurrencePattern.requirePositiveInterval(interval);
        months = Set.copyOf(EnumSet.copyOf(months));
    }

    /**
     * Selected months in calendar order.
     */
    public List<Month> orderedMonths() {
        return EnumSet.copyOf(months).stream().toList();
    }
}
