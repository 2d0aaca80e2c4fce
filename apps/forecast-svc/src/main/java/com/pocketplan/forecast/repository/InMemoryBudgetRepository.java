package com.pocketplan.forecast.repository;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBudgetRepository implements BudgetRepository {

    private final Set<UUID> budgets = ConcurrentHashMap.newKeySet();

    @Override
    public void register(UUID budgetId) {
        budgets.add(budgetId);
    }

    @Override
    public boolean existsById(UUID budgetId) {
        return budgets.contains(budgetId);
    }
}
