package com.pocketplan.forecast.repository;

import com.pocketplan.forecast.model.BudgetPost;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BudgetPostRepository {

    BudgetPost save(BudgetPost budgetPost);

    Optional<BudgetPost> findById(UUID budgetId, UUID budgetPostId);

    List<BudgetPost> findByBudgetId(UUID budgetId);

    void deleteByBudgetId(UUID budgetId);
}
