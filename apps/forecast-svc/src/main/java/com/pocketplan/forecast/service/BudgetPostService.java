package com.pocketplan.forecast.service;

import com.pocketplan.forecast.model.AmountPattern;
import com.pocketplan.forecast.model.BudgetPost;
import com.pocketplan.forecast.model.Category;
import com.pocketplan.forecast.repository.BudgetPostRepository;
import com.pocketplan.forecast.repository.BudgetRepository;
import com.pocketplan.forecast.repository.CategoryRepository;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class BudgetPostService {

    private static final Logger log = LoggerFactory.getLogger(BudgetPostService.class);

    private final BudgetRepository budgetRepository;
    private final BudgetPostRepository budgetPostRepository;
    private final CategoryRepository categoryRepository;

    public BudgetPostService(
            BudgetRepository budgetRepository,
            BudgetPostRepository budgetPostRepository,
            CategoryRepository categoryRepository
    ) {
        this.budgetRepository = budgetRepository;
        this.budgetPostRepository = budgetPostRepository;
        this.categoryRepository = categoryRepository;
    }

    /**
     * Saves a new or changed post after checking it against its nearest posted ancestor, then narrows the
     * pools of descendant posts that are no longer subsets of their constraining pool.
     */
    public Registration register(BudgetPost post) {
        requireBudget(post.budgetId());
        if (post.isTransfer()) {
            budgetPostRepository.save(post);
            log.info("Registered transfer post {} in budget {}", post.id(), post.budgetId());
            return new Registration(post, List.of());
        }

        Category category = categoryRepository.findById(post.categoryId())
                .filter(found -> found.budgetId().equals(post.budgetId()))
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + post.categoryId()));
        List<BudgetPost> existing = budgetPostRepository.findByBudgetId(post.budgetId());
        boolean duplicate = existing.stream()
                .anyMatch(other -> !other.id().equals(post.id())
                        && other.direction() == post.direction()
                        && category.id().equals(other.categoryId()));
        if (duplicate) {
            log.warn("Rejected budget post {}: duplicate for category {}", post.id(), category.id());
            throw new IllegalArgumentException("A " + post.direction().name().toLowerCase(Locale.ROOT)
                    + " post already exists for category " + category.id());
        }

        ContainerPoolResolver resolver = new ContainerPoolResolver(
                categoryRepository.findByBudgetId(post.budgetId()), existing, post.direction());
        resolver.constrainingPool(category.id()).ifPresent(pool -> {
            if (!pool.containsAll(post.containerPool())) {
                log.warn("Rejected budget post {}: pool {} exceeds ancestor pool {}", post.id(), post.containerPool(), pool);
                throw new IllegalArgumentException("Container pool must be a subset of ancestor post pool");
            }
        });

        budgetPostRepository.save(post);
        resolver.put(post);
        List<PoolNarrowing> narrowed = cascade(resolver, category.id());
        log.info("Registered {} post {} in budget {} ({} descendants narrowed)",
                post.direction().name().toLowerCase(Locale.ROOT), post.id(), post.budgetId(), narrowed.size());
        return new Registration(post, narrowed);
    }

    public List<BudgetPost> list(UUID budgetId) {
        requireBudget(budgetId);
        return budgetPostRepository.findByBudgetId(budgetId);
    }

    public BudgetPost get(UUID budgetId, UUID budgetPostId) {
        requireBudget(budgetId);
        return budgetPostRepository.findById(budgetId, budgetPostId)
                .orElseThrow(() -> new ResourceNotFoundException("Budget post not found: " + budgetPostId));
    }

    private List<PoolNarrowing> cascade(ContainerPoolResolver resolver, UUID categoryId) {
        List<PoolNarrowing> narrowed = new ArrayList<>();
        for (BudgetPost descendant : resolver.descendantPosts(categoryId)) {
            Set<UUID> allowed = resolver.constrainingPool(descendant.categoryId())
                    .orElseThrow(() -> new IllegalStateException("Descendant post " + descendant.id() + " lost its ancestor"));
            if (allowed.containsAll(descendant.containerPool())) {
                continue;
            }
            Set<UUID> pool = intersect(descendant.containerPool(), allowed);
            if (pool.isEmpty()) {
                pool = allowed;
            }
            List<UUID> poolIds = sorted(pool);
            List<AmountPattern> patterns = new ArrayList<>();
            for (AmountPattern pattern : descendant.amountPatterns()) {
                List<UUID> kept = pattern.containerIds().stream().filter(poolIds::contains).toList();
                patterns.add(pattern.withContainerIds(kept.isEmpty() ? poolIds : kept));
            }
            BudgetPost updated = descendant.withContainerPool(pool, patterns);
            budgetPostRepository.save(updated);
            resolver.put(updated);
            narrowed.add(new PoolNarrowing(descendant.id(), sorted(descendant.containerPool()), poolIds));
        }
        return narrowed;
    }

    private void requireBudget(UUID budgetId) {
        if (!budgetRepository.existsById(budgetId)) {
            throw new ResourceNotFoundException("Budget not found: " + budgetId);
        }
    }

    private static Set<UUID> intersect(Set<UUID> left, Set<UUID> right) {
        Set<UUID> result = new LinkedHashSet<>(left);
        result.retainAll(right);
        return result;
    }

    private static List<UUID> sorted(Set<UUID> ids) {
        return ids.stream().sorted().toList();
    }

    public record Registration(BudgetPost post, List<PoolNarrowing> narrowed) {
    }

    public record PoolNarrowing(UUID budgetPostId, List<UUID> oldContainerIds, List<UUID> newContainerIds) {
    }
}
