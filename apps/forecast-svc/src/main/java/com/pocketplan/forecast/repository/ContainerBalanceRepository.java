package com.pocketplan.forecast.repository;

import java.util.Map;
import java.util.UUID;

/**
 * Current balance per container of a budget, in minor units.
 */
public interface ContainerBalanceRepository {

    void saveBalance(UUID budgetId, UUID containerId, long balance);

    Map<UUID, Long> findBalancesByBudgetId(UUID budgetId);
}
