package com.pocketplan.forecast.repository;

import com.pocketplan.forecast.model.CarryForward;
import java.util.List;
import java.util.UUID;

/**
 * Pre-computed carry-forward amounts for accumulating expense posts, supplied by the allocation side.
 */
public interface CarryForwardRepository {

    void save(UUID budgetId, CarryForward carryForward);

    List<CarryForward> findByBudgetId(UUID budgetId);
}
