package com.pocketplan.forecast.repository;

import com.pocketplan.forecast.model.Category;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CategoryRepository {

    Category save(Category category);

    Optional<Category> findById(UUID categoryId);

    List<Category> findByBudgetId(UUID budgetId);
}
