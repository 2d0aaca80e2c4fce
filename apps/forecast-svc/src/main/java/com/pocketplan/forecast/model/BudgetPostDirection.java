package com.pocketplan.forecast.model;

import java.util.Locale;

public enum BudgetPostDirection {
    INCOME,
    EXPENSE,
    TRANSFER;

    public static BudgetPostDirection fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("direction must be provided");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("direction must be one of income, expense, transfer");
        }
    }
}
