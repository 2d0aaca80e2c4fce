package com.pocketplan.forecast.forecast;

import com.pocketplan.forecast.model.AmountPattern;
import com.pocketplan.forecast.model.BudgetPost;
import com.pocketplan.forecast.model.CarryForward;
import com.pocketplan.forecast.model.DateWindow;
import com.pocketplan.forecast.model.ForecastResult;
import com.pocketplan.forecast.model.Occurrence;
import com.pocketplan.forecast.occurrence.OccurrenceGenerator;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Month-by-month balance projection over all budget posts of a budget.
 *
 * <p>Occurrence amounts are summed with their sign, so a negative expense pattern (a refund)
 * lowers the month's expenses. The post direction only picks the bucket. Transfers never touch
 * the totals but move money between the two named containers.
 */
@Component
public class ForecastProjector {

    private final OccurrenceGenerator occurrenceGenerator;

    public ForecastProjector(OccurrenceGenerator occurrenceGenerator) {
        this.occurrenceGenerator = occurrenceGenerator;
    }

    public ForecastResult project(ProjectionInput input) {
        Map<UUID, Long> containers = new TreeMap<>(input.startingBalances());
        long balance = containers.values().stream().reduce(0L, Math::addExact);
        Map<UUID, Map<YearMonth, Long>> carryForwards = indexCarryForwards(input);

        List<ForecastResult.MonthProjection> projections = new ArrayList<>(input.months());
        List<ExpenseCandidate> largeExpenseCandidates = new ArrayList<>();
        YearMonth lookaheadEnd = input.firstMonth().plusMonths(input.largeExpenseLookaheadMonths() - 1L);

        for (int offset = 0; offset < input.months(); offset++) {
            YearMonth month = input.firstMonth().plusMonths(offset);
            DateWindow window = DateWindow.ofMonth(month);
            long income = 0L;
            long expenses = 0L;

            for (BudgetPost post : input.posts()) {
                List<AmountPattern> patterns = post.amountPatterns();
                for (int index = 0; index < patterns.size(); index++) {
                    AmountPattern pattern = patterns.get(index);
                    List<Occurrence> occurrences = occurrenceGenerator.generate(index, pattern, window);
                    if (occurrences.isEmpty()) {
                        continue;
                    }
                    long monthTotal = sum(occurrences);
                    switch (post.direction()) {
                        case INCOME -> {
                            income = Math.addExact(income, monthTotal);
                            credit(containers, bookingContainer(post, pattern), monthTotal);
                        }
                        case EXPENSE -> {
                            expenses = Math.addExact(expenses, monthTotal);
                            credit(containers, bookingContainer(post, pattern), Math.negateExact(monthTotal));
                            if (!month.isAfter(lookaheadEnd)) {
                                for (Occurrence occurrence : occurrences) {
                                    largeExpenseCandidates.add(new ExpenseCandidate(post, occurrence));
                                }
                            }
                        }
                        case TRANSFER -> {
                            credit(containers, post.transferFromContainerId(), Math.negateExact(monthTotal));
                            credit(containers, post.transferToContainerId(), monthTotal);
                        }
                        default -> throw new IllegalStateException("Unhandled direction " + post.direction());
                    }
                }
                if (post.accumulate()) {
                    long carried = carryForwards.getOrDefault(post.id(), Map.of()).getOrDefault(month, 0L);
                    if (carried != 0L) {
                        expenses = Math.addExact(expenses, carried);
                        credit(containers, bookingContainer(post, post.amountPatterns().get(0)), Math.negateExact(carried));
                    }
                }
            }

            long endBalance = Math.subtractExact(Math.addExact(balance, income), expenses);
            projections.add(new ForecastResult.MonthProjection(
                    month, balance, income, expenses, endBalance, Collections.unmodifiableMap(new TreeMap<>(containers))));
            balance = endBalance;
        }

        return new ForecastResult(
                List.copyOf(projections),
                lowestPoint(projections),
                nextLargeExpense(largeExpenseCandidates, input.largeExpenseThreshold()).orElse(null)
        );
    }

    private static ForecastResult.LowestPoint lowestPoint(List<ForecastResult.MonthProjection> projections) {
        ForecastResult.MonthProjection lowest = null;
        for (ForecastResult.MonthProjection projection : projections) {
            // strict comparison keeps the earliest month on ties
            if (lowest == null || projection.endBalance() < lowest.endBalance()) {
                lowest = projection;
            }
        }
        return lowest == null ? null : new ForecastResult.LowestPoint(lowest.month(), lowest.endBalance());
    }

    private static Optional<ForecastResult.LargeExpense> nextLargeExpense(List<ExpenseCandidate> candidates, long threshold) {
        return candidates.stream()
                .filter(candidate -> candidate.occurrence().amount() > threshold)
                .min(Comparator.comparing((ExpenseCandidate candidate) -> candidate.occurrence().date())
                        .thenComparing(candidate -> candidate.post().name()))
                .map(candidate -> new ForecastResult.LargeExpense(
                        candidate.post().id(),
                        candidate.post().name(),
                        candidate.occurrence().amount(),
                        candidate.occurrence().date()));
    }

    private static Map<UUID, Map<YearMonth, Long>> indexCarryForwards(ProjectionInput input) {
        Map<UUID, Map<YearMonth, Long>> index = new LinkedHashMap<>();
        for (CarryForward carryForward : input.carryForwards()) {
            index.computeIfAbsent(carryForward.budgetPostId(), key -> new LinkedHashMap<>())
                    .merge(carryForward.month(), carryForward.amount(), Math::addExact);
        }
        return index;
    }

    private static long sum(List<Occurrence> occurrences) {
        long total = 0L;
        for (Occurrence occurrence : occurrences) {
            total = Math.addExact(total, occurrence.amount());
        }
        return total;
    }

    private static UUID bookingContainer(BudgetPost post, AmountPattern pattern) {
        return pattern.primaryContainerId()
                .orElseThrow(() -> new IllegalStateException("Pattern of post " + post.id() + " has no container"));
    }

    private static void credit(Map<UUID, Long> containers, UUID containerId, long amount) {
        containers.merge(containerId, amount, Math::addExact);
    }

    private record ExpenseCandidate(BudgetPost post, Occurrence occurrence) {
    }

    /**
     * @param startingBalances current balance per container, minor units
     * @param largeExpenseThreshold an expense occurrence strictly above it is reported as large
     * @param largeExpenseLookaheadMonths how many months, counting {@code firstMonth}, are searched for it
     */
    public record ProjectionInput(
            List<BudgetPost> posts,
            Map<UUID, Long> startingBalances,
            List<CarryForward> carryForwards,
            YearMonth firstMonth,
            int months,
            long largeExpenseThreshold,
            int largeExpenseLookaheadMonths
    ) {
        public ProjectionInput {
            Objects.requireNonNull(firstMonth, "firstMonth");
            posts = posts == null ? List.of() : List.copyOf(posts);
            startingBalances = startingBalances == null ? Map.of() : Map.copyOf(startingBalances);
            carryForwards = carryForwards == null ? List.of() : List.copyOf(carryForwards);
            if (months <= 0) {
                throw new IllegalArgumentException("months must be positive");
            }
            if (largeExpenseLookaheadMonths <= 0) {
                throw new IllegalArgumentException("largeExpenseLookaheadMonths must be positive");
            }
        }
    }
}
