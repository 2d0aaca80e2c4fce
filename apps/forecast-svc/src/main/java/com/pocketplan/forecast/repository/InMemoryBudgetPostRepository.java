package com.pocketplan.forecast.repository;

import com.pocketplan.forecast.model.BudgetPost;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBudgetPostRepository implements BudgetPostRepository {

    private final Map<UUID, BudgetPost> storage = new ConcurrentHashMap<>();

    @Override
    public BudgetPost save(BudgetPost budgetPost) {
        storage.put(budgetPost.id(), budgetPost);
        return budgetPost;
    }

    @Override
    public Optional<BudgetPost> findById(UUID budgetId, UUID budgetPostId) {
        return Optional.ofNullable(storage.get(budgetPostId))
                .filter(post -> post.budgetId().equals(budgetId));
    }

    @Override
    public List<BudgetPost> findByBudgetId(UUID budgetId) {
        return storage.values().stream()
                .filter(post -> post.budgetId().equals(budgetId))
                .sorted(Comparator.comparing(BudgetPost::name).thenComparing(BudgetPost::id))
                .toList();
    }

    @Override
    public void deleteByBudgetId(UUID budgetId) {
        storage.entrySet().removeIf(entry -> entry.getValue().budgetId().equals(budgetId));
    }
}
