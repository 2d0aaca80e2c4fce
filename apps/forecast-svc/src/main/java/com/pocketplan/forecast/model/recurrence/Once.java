package com.pocketplan.forecast.model.recurrence;

import java.util.Objects;

/**
 * A single occurrence on the pattern's start date.
 */
public record Once(BankDayAdjustment adjustment) implements DateRecurrence {

    public Once {
        Objects.requireNonNull(adjustment, "adjustment");
    }

    public static Once plain() {
        return new Once(BankDayAdjustment.NONE);
    }
}
