package com.pocketplan.forecast.model.recurrence;

import java.util.Locale;

/**
 * Which occurrence of a weekday inside a month. {@link #LAST} is resolved by scanning back from
 * the end of the month.
 */
public enum RelativePosition {
    FIRST(1),
    SECOND(2),
    THIRD(3),
    FOURTH(4),
    LAST(-1);

    private final int ordinalInMonth;

    RelativePosition(int ordinalInMonth) {
        this.ordinalInMonth = ordinalInMonth;
    }

    public int ordinalInMonth() {
        return ordinalInMonth;
    }

    public static RelativePosition fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("relative_position must be one of first, second, third, fourth, last");
        }
    }
}
