package com.pocketplan.forecast.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Planned income, expense or transfer grouping one or more amount patterns.
 *
 * <p>Income and expense posts book against a pool of containers; every pattern must name a non-empty
 * subset of that pool. Transfer posts move money between two explicit containers and their patterns
 * carry no container ids.
 */
public record BudgetPost(
        UUID id,
        UUID budgetId,
        BudgetPostDirection direction,
        UUID categoryId,
        String name,
        boolean accumulate,
        Set<UUID> containerPool,
        UUID transferFromContainerId,
        UUID transferToContainerId,
        List<AmountPattern> amountPatterns
) {

    public BudgetPost {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(budgetId, "budgetId");
        Objects.requireNonNull(direction, "direction");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be provided");
        }
        if (amountPatterns == null || amountPatterns.isEmpty()) {
            throw new IllegalArgumentException("budget post requires at least one amount pattern");
        }
        amountPatterns = List.copyOf(amountPatterns);
        containerPool = containerPool == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(containerPool));
        if (accumulate && direction != BudgetPostDirection.EXPENSE) {
            throw new IllegalArgumentException("accumulate is only allowed on expense posts");
        }
        if (direction == BudgetPostDirection.TRANSFER) {
            if (transferFromContainerId == null || transferToContainerId == null) {
                throw new IllegalArgumentException("transfer posts require from and to containers");
            }
            if (transferFromContainerId.equals(transferToContainerId)) {
                throw new IllegalArgumentException("transfer containers must differ");
            }
            for (AmountPattern pattern : amountPatterns) {
                if (!pattern.containerIds().isEmpty()) {
                    throw new IllegalArgumentException("transfer patterns must not carry container ids");
                }
            }
        } else {
            if (categoryId == null) {
                throw new IllegalArgumentException("income and expense posts require a category");
            }
            if (containerPool.isEmpty()) {
                throw new IllegalArgumentException("income and expense posts require a container pool");
            }
            for (AmountPattern pattern : amountPatterns) {
                if (pattern.containerIds().isEmpty()) {
                    throw new IllegalArgumentException("amount pattern requires at least one container");
                }
                if (!containerPool.containsAll(pattern.containerIds())) {
                    throw new IllegalArgumentException("amount pattern containers must belong to the post's container pool");
                }
            }
        }
    }

    public BudgetPost withContainerPool(Set<UUID> pool, List<AmountPattern> patterns) {
        return new BudgetPost(id, budgetId, direction, categoryId, name, accumulate, pool,
                transferFromContainerId, transferToContainerId, patterns);
    }

    public boolean isTransfer() {
        return direction == BudgetPostDirection.TRANSFER;
    }
}
