package com.pocketplan.forecast.service;

import com.pocketplan.forecast.model.BudgetPost;
import com.pocketplan.forecast.model.BudgetPostDirection;
import com.pocketplan.forecast.model.Category;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Container-pool constraints for the posts of one budget and one direction.
 *
 * <p>A post's pool must be a subset of the pool of the post on its nearest ancestor category that has a
 * post; levels without a post are skipped. Lookups walk the category tree upward by parent id and memoize
 * the nearest posted ancestor per category, so a resolver is meant for a single snapshot.
 */
public class ContainerPoolResolver {

    private final Map<UUID, Category> categories;
    private final Map<UUID, BudgetPost> postsByCategory;
    private final Map<UUID, Optional<UUID>> nearestPostedAncestor = new HashMap<>();
    private final Map<UUID, Integer> depths = new HashMap<>();

    public ContainerPoolResolver(List<Category> categories, List<BudgetPost> posts, BudgetPostDirection direction) {
        if (direction == BudgetPostDirection.TRANSFER) {
            throw new IllegalArgumentException("transfer posts have no container pool hierarchy");
        }
        this.categories = categories.stream().collect(Collectors.toMap(Category::id, Function.identity()));
        this.postsByCategory = new HashMap<>();
        for (BudgetPost post : posts) {
            if (post.direction() == direction && post.categoryId() != null) {
                postsByCategory.put(post.categoryId(), post);
            }
        }
    }

    /**
     * The post whose pool constrains a post placed on {@code categoryId}, if any ancestor has one.
     */
    public Optional<BudgetPost> constrainingPost(UUID categoryId) {
        return nearestPostedAncestorOf(categoryId).map(postsByCategory::get);
    }

    public Optional<Set<UUID>> constrainingPool(UUID categoryId) {
        return constrainingPost(categoryId).map(BudgetPost::containerPool);
    }

    /**
     * Records a new or changed post. Ancestor links do not depend on pool contents, so the memo stays valid.
     */
    public void put(BudgetPost post) {
        BudgetPost previous = postsByCategory.put(post.categoryId(), post);
        if (previous == null) {
            // a category gaining its first post can become the nearest posted ancestor of others
            nearestPostedAncestor.clear();
        }
    }

    /**
     * Posts on categories below {@code categoryId}, parents before children.
     */
    public List<BudgetPost> descendantPosts(UUID categoryId) {
        List<BudgetPost> result = new ArrayList<>();
        for (Map.Entry<UUID, BudgetPost> entry : postsByCategory.entrySet()) {
            if (!entry.getKey().equals(categoryId) && isDescendant(entry.getKey(), categoryId)) {
                result.add(entry.getValue());
            }
        }
        result.sort(Comparator.comparingInt((BudgetPost post) -> depth(post.categoryId()))
                .thenComparing(BudgetPost::name));
        return result;
    }

    private Optional<UUID> nearestPostedAncestorOf(UUID categoryId) {
        Optional<UUID> cached = nearestPostedAncestor.get(categoryId);
        if (cached != null) {
            return cached;
        }
        List<UUID> visited = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        Optional<UUID> found = Optional.empty();
        UUID current = parentOf(categoryId);
        while (current != null) {
            if (!seen.add(current)) {
                throw new IllegalStateException("Category tree contains a cycle at " + current);
            }
            Optional<UUID> known = nearestPostedAncestor.get(current);
            if (postsByCategory.containsKey(current)) {
                found = Optional.of(current);
                break;
            }
            if (known != null) {
                found = known;
                break;
            }
            visited.add(current);
            current = parentOf(current);
        }
        nearestPostedAncestor.put(categoryId, found);
        // every unposted level walked through shares the same answer
        for (UUID level : visited) {
            nearestPostedAncestor.put(level, found);
        }
        return found;
    }

    private boolean isDescendant(UUID candidate, UUID ancestor) {
        Set<UUID> seen = new HashSet<>();
        UUID current = parentOf(candidate);
        while (current != null) {
            if (current.equals(ancestor)) {
                return true;
            }
            if (!seen.add(current)) {
                throw new IllegalStateException("Category tree contains a cycle at " + current);
            }
            current = parentOf(current);
        }
        return false;
    }

    private int depth(UUID categoryId) {
        Integer known = depths.get(categoryId);
        if (known != null) {
            return known;
        }
        int depth = 0;
        Set<UUID> seen = new HashSet<>();
        UUID current = parentOf(categoryId);
        while (current != null) {
            if (!seen.add(current)) {
                throw new IllegalStateException("Category tree contains a cycle at " + current);
            }
            depth++;
            current = parentOf(current);
        }
        depths.put(categoryId, depth);
        return depth;
    }

    private UUID parentOf(UUID categoryId) {
        Category category = categories.get(categoryId);
        return category == null ? null : category.parentId();
    }
}
