package com.pocketplan.forecast.repository;

import com.pocketplan.forecast.model.CarryForward;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCarryForwardRepository implements CarryForwardRepository {

    private final Map<UUID, List<CarryForward>> storage = new ConcurrentHashMap<>();

    @Override
    public void save(UUID budgetId, CarryForward carryForward) {
        storage.computeIfAbsent(budgetId, key -> new CopyOnWriteArrayList<>()).add(carryForward);
    }

    @Override
    public List<CarryForward> findByBudgetId(UUID budgetId) {
        return List.copyOf(storage.getOrDefault(budgetId, List.of()));
    }
}
