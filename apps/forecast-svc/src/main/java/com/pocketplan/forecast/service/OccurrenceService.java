package com.pocketplan.forecast.service;

import com.pocketplan.forecast.config.PocketplanProperties;
import com.pocketplan.forecast.model.BudgetPost;
import com.pocketplan.forecast.model.DateWindow;
import com.pocketplan.forecast.model.Occurrence;
import com.pocketplan.forecast.occurrence.OccurrenceGenerator;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Occurrences of saved budget posts. Uses the same generator path as the forecast and the preview.
 */
@Service
public class OccurrenceService {

    private static final Logger log = LoggerFactory.getLogger(OccurrenceService.class);

    private final BudgetPostService budgetPostService;
    private final OccurrenceGenerator occurrenceGenerator;
    private final PocketplanProperties properties;
    private final Clock clock;

    public OccurrenceService(
            BudgetPostService budgetPostService,
            OccurrenceGenerator occurrenceGenerator,
            PocketplanProperties properties,
            Clock clock
    ) {
        this.budgetPostService = budgetPostService;
        this.occurrenceGenerator = occurrenceGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    public PostOccurrences forPost(UUID budgetId, UUID budgetPostId, LocalDate from, LocalDate to) {
        DateWindow window = resolveWindow(from, to);
        BudgetPost post = budgetPostService.get(budgetId, budgetPostId);
        return expand(post, window);
    }

    public List<PostOccurrences> forBudget(UUID budgetId, LocalDate from, LocalDate to) {
        DateWindow window = resolveWindow(from, to);
        List<PostOccurrences> result = budgetPostService.list(budgetId).stream()
                .map(post -> expand(post, window))
                .toList();
        log.debug("Expanded {} posts of budget {} over {}..{}", result.size(), budgetId, window.from(), window.to());
        return result;
    }

    /**
     * Missing bounds default to the current month; a window longer than the preview limit is rejected.
     */
    DateWindow resolveWindow(LocalDate from, LocalDate to) {
        YearMonth current = YearMonth.now(clock);
        DateWindow window = new DateWindow(
                from != null ? from : current.atDay(1),
                to != null ? to : current.atEndOfMonth());
        int maxRangeDays = properties.preview().maxRangeDays();
        if (window.lengthInDays() > maxRangeDays) {
            throw new IllegalArgumentException("occurrence window cannot exceed " + maxRangeDays + " days");
        }
        return window;
    }

    private PostOccurrences expand(BudgetPost post, DateWindow window) {
        return new PostOccurrences(post.id(), occurrenceGenerator.generateAll(post.amountPatterns(), window));
    }

    public record PostOccurrences(UUID budgetPostId, List<Occurrence> occurrences) {
    }
}
