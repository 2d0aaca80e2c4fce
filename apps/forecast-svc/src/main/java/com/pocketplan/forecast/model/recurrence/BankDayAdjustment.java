package com.pocketplan.forecast.model.recurrence;

import java.util.Objects;

/**
 * Post-hoc shift of a computed date onto a bank day.
 *
 * @param direction which way to walk when the date is not a bank day
 * @param keepInMonth reverse the walk instead of leaving the originally targeted month
 * @param noDedup keep same-day collisions as separate occurrences instead of merging them
 */
public record BankDayAdjustment(AdjustmentDirection direction, boolean keepInMonth, boolean noDedup) {

    public static final BankDayAdjustment NONE = new BankDayAdjustment(AdjustmentDirection.NONE, true, false);

    public BankDayAdjustment {
        Objects.requireNonNull(direction, "direction");
    }

    public static BankDayAdjustment next() {
        return new BankDayAdjustment(AdjustmentDirection.NEXT, true, false);
    }

    public static BankDayAdjustment previous() {
        return new BankDayAdjustment(AdjustmentDirection.PREVIOUS, true, false);
    }

    public boolean isActive() {
        return direction != AdjustmentDirection.NONE;
    }

    public BankDayAdjustment withKeepInMonth(boolean keep) {
        return new BankDayAdjustment(direction, keep, noDedup);
    }

    public BankDayAdjustment withNoDedup(boolean keepSeparate) {
        return new BankDayAdjustment(direction, keepInMonth, keepSeparate);
    }
}
