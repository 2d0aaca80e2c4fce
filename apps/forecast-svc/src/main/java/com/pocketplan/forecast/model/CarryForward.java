package com.pocketplan.forecast.model;

import java.time.YearMonth;
import java.util.Objects;
import java.util.UUID;

/**
 * Unused planned amount of an accumulating expense post, already computed by the allocation side,
 * to be added to the post's expected expenses in {@code month}.
 */
public record CarryForward(UUID budgetPostId, YearMonth month, long amount) {

    public CarryForward {
        Objects.requireNonNull(budgetPostId, "budgetPostId");
        Objects.requireNonNull(month, "month");
    }
}
