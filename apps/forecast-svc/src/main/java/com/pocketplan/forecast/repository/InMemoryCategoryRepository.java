package com.pocketplan.forecast.repository;

import com.pocketplan.forecast.model.Category;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCategoryRepository implements CategoryRepository {

    private final Map<UUID, Category> storage = new ConcurrentHashMap<>();

    @Override
    public Category save(Category category) {
        storage.put(category.id(), category);
        return category;
    }

    @Override
    public Optional<Category> findById(UUID categoryId) {
        return Optional.ofNullable(storage.get(categoryId));
    }

    @Override
    public List<Category> findByBudgetId(UUID budgetId) {
        return storage.values().stream()
                .filter(category -> category.budgetId().equals(budgetId))
                .sorted(Comparator.comparing(Category::id))
                .toList();
    }
}
