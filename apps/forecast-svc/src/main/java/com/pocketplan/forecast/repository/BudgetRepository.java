package com.pocketplan.forecast.repository;

import java.util.UUID;

public interface BudgetRepository {

    void register(UUID budgetId);

    boolean existsById(UUID budgetId);
}
