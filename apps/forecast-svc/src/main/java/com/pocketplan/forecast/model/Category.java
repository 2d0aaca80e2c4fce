package com.pocketplan.forecast.model;

import java.util.Objects;
import java.util.UUID;

/**
 * @param parentId {@code null} for a root category
 */
public record Category(UUID id, UUID budgetId, String name, UUID parentId) {

    public Category {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(budgetId, "budgetId");
    }
}
