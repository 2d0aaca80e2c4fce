package com.pocketplan.forecast.repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryContainerBalanceRepository implements ContainerBalanceRepository {

    private final Map<UUID, Map<UUID, Long>> balancesByBudget = new ConcurrentHashMap<>();

    @Override
    public void saveBalance(UUID budgetId, UUID containerId, long balance) {
        balancesByBudget.computeIfAbsent(budgetId, key -> new ConcurrentHashMap<>()).put(containerId, balance);
    }

    @Override
    public Map<UUID, Long> findBalancesByBudgetId(UUID budgetId) {
        return Map.copyOf(new LinkedHashMap<>(balancesByBudget.getOrDefault(budgetId, Map.of())));
    }
}
