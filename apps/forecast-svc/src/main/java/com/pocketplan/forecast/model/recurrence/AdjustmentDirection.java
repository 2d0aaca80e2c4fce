package com.pocketplan.forecast.model.recurrence;

import java.util.Locale;

public enum AdjustmentDirection {
    NONE,
    NEXT,
    PREVIOUS;

    public static AdjustmentDirection fromWire(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("bank_day_adjustment must be one of none, next, previous");
        }
    }

    public AdjustmentDirection reverse() {
        return switch (this) {
            case NEXT -> PREVIOUS;
            case PREVIOUS -> NEXT;
            case NONE -> NONE;
        };
    }
}
