package com.pocketplan.forecast.forecast;

import static org.assertj.core.api.Assertions.assertThat;

import com.pocketplan.forecast.bankday.BankDayAdjuster;
import com.pocketplan.forecast.bankday.BankDayCalendar;
import com.pocketplan.forecast.config.PocketplanProperties;
import com.pocketplan.forecast.model.AmountPattern;
import com.pocketplan.forecast.model.BudgetPost;
import com.pocketplan.forecast.model.BudgetPostDirection;
import com.pocketplan.forecast.model.CarryForward;
import com.pocketplan.forecast.model.DateWindow;
import com.pocketplan.forecast.model.ForecastResult;
import com.pocketplan.forecast.model.Occurrence;
import com.pocketplan.forecast.model.recurrence.BankDayAdjustment;
import com.pocketplan.forecast.model.recurrence.MonthlyFixed;
import com.pocketplan.forecast.model.recurrence.Once;
import com.pocketplan.forecast.model.recurrence.PeriodMonthly;
import com.pocketplan.forecast.model.recurrence.RecurrencePattern;
import com.pocketplan.forecast.model.recurrence.Weekly;
import com.pocketplan.forecast.occurrence.OccurrenceGenerator;
import com.pocketplan.forecast.occurrence.PeriodOccurrences;
import com.pocketplan.forecast.preview.TimelinePreviewService;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForecastProjectorTest {

    private static final BankDayCalendar WEEKDAYS_ONLY = date -> date.getDayOfWeek().getValue() <= 5;
    private static final YearMonth JANUARY = YearMonth.of(2024, 1);

    private final UUID budgetId = UUID.randomUUID();
    private final UUID checking = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private final UUID savings = UUID.fromString("00000000-0000-0000-0000-00000000000b");

    private OccurrenceGenerator generator;
    private ForecastProjector projector;

    @BeforeEach
    void setUp() {
        generator = new OccurrenceGenerator(new BankDayAdjuster(), new PeriodOccurrences(), WEEKDAYS_ONLY);
        projector = new ForecastProjector(generator);
    }

    @Test
    void rollsBalancesForwardMonthByMonth() {
        List<BudgetPost> posts = List.of(
                post(BudgetPostDirection.INCOME, "Salary", pattern(30_000, "2024-01-01", new MonthlyFixed(25, 1, BankDayAdjustment.NONE))),
                post(BudgetPostDirection.EXPENSE, "Rent", pattern(10_000, "2024-01-01", new MonthlyFixed(1, 1, BankDayAdjustment.NONE))),
                transfer("Savings", pattern(5_000, "2024-01-01", new MonthlyFixed(28, 1, BankDayAdjustment.NONE))));

        ForecastResult result = projector.project(input(posts, Map.of(checking, 100_000L), List.of(), 3));

        assertThat(result.projections()).hasSize(3);
        ForecastResult.MonthProjection january = result.projections().get(0);
        assertThat(january.month()).isEqualTo(JANUARY);
        assertThat(january.startBalance()).isEqualTo(100_000);
        assertThat(january.expectedIncome()).isEqualTo(30_000);
        assertThat(january.expectedExpenses()).isEqualTo(10_000);
        assertThat(january.endBalance()).isEqualTo(120_000);
        assertThat(january.containerBalances()).containsEntry(checking, 115_000L).containsEntry(savings, 5_000L);

        ForecastResult.MonthProjection february = result.projections().get(1);
        assertThat(february.startBalance()).isEqualTo(january.endBalance());
        assertThat(february.endBalance()).isEqualTo(140_000);
        assertThat(result.projections().get(2).containerBalances())
                .containsEntry(checking, 145_000L)
                .containsEntry(savings, 15_000L);
    }

    @Test
    void reportsLowestPointAndNextLargeExpense() {
        List<BudgetPost> posts = List.of(
                post(BudgetPostDirection.INCOME, "Salary", pattern(30_000, "2024-01-01", new MonthlyFixed(25, 1, BankDayAdjustment.NONE))),
                post(BudgetPostDirection.EXPENSE, "Car repair", pattern(600_000, "2024-02-14", Once.plain())));

        ForecastResult result = projector.project(input(posts, Map.of(checking, 100_000L), List.of(), 4));

        assertThat(result.projections().get(1).expectedExpenses()).isEqualTo(600_000);
        assertThat(result.lowestPoint()).isEqualTo(new ForecastResult.LowestPoint(YearMonth.of(2024, 2), -440_000));
        assertThat(result.nextLargeExpense().name()).isEqualTo("Car repair");
        assertThat(result.nextLargeExpense().amount()).isEqualTo(600_000);
        assertThat(result.nextLargeExpense().date()).isEqualTo(LocalDate.of(2024, 2, 14));
    }

    @Test
    void refundsReduceExpensesInsteadOfAddingToThem() {
        BudgetPost rent = post(BudgetPostDirection.EXPENSE, "Rent",
                pattern(10_000, "2024-01-01", new MonthlyFixed(5, 1, BankDayAdjustment.NONE)),
                pattern(-2_000, "2024-01-01", new MonthlyFixed(10, 1, BankDayAdjustment.NONE)));

        ForecastResult result = projector.project(input(List.of(rent), Map.of(checking, 50_000L), List.of(), 1));

        ForecastResult.MonthProjection january = result.projections().get(0);
        assertThat(january.expectedExpenses()).isEqualTo(8_000);
        assertThat(january.endBalance()).isEqualTo(42_000);
        assertThat(january.containerBalances()).containsEntry(checking, 42_000L);
    }

    @Test
    void ignoresLargeExpensesBeyondLookahead() {
        List<BudgetPost> posts = List.of(
                post(BudgetPostDirection.EXPENSE, "Holiday", pattern(800_000, "2024-04-10", Once.plain())));

        ForecastResult result = projector.project(input(posts, Map.of(checking, 1_000_000L), List.of(), 6));

        assertThat(result.nextLargeExpense()).isNull();
        assertThat(result.lowestPoint().month()).isEqualTo(YearMonth.of(2024, 4));
    }

    @Test
    void lowestPointTiesResolveToEarliestMonth() {
        ForecastResult result = projector.project(input(List.of(), Map.of(checking, 5_000L), List.of(), 3));

        assertThat(result.lowestPoint()).isEqualTo(new ForecastResult.LowestPoint(JANUARY, 5_000));
        assertThat(result.nextLargeExpense()).isNull();
    }

    @Test
    void addsCarryForwardOnlyForAccumulatingExpensePosts() {
        BudgetPost groceries = new BudgetPost(UUID.randomUUID(), budgetId, BudgetPostDirection.EXPENSE, UUID.randomUUID(),
                "Groceries", true, Set.of(checking), null, null,
                List.of(pattern(4_000, "2024-01-01", new PeriodMonthly(1))));
        BudgetPost rent = post(BudgetPostDirection.EXPENSE, "Rent", pattern(10_000, "2024-01-01", new MonthlyFixed(1, 1, BankDayAdjustment.NONE)));
        List<CarryForward> carryForwards = List.of(
                new CarryForward(groceries.id(), YearMonth.of(2024, 2), 1_500),
                new CarryForward(rent.id(), YearMonth.of(2024, 2), 9_999));

        ForecastResult result = projector.project(input(List.of(groceries, rent), Map.of(checking, 0L), carryForwards, 2));

        assertThat(result.projections().get(0).expectedExpenses()).isEqualTo(14_000);
        assertThat(result.projections().get(1).expectedExpenses()).isEqualTo(15_500);
    }

    @Test
    void monthTotalsMatchPreviewOfSameMonth() {
        AmountPattern weekly = pattern(1_250, "2024-01-02", new Weekly(DayOfWeek.FRIDAY, 1, BankDayAdjustment.NONE));
        AmountPattern monthly = pattern(7_000, "2024-01-01", new MonthlyFixed(31, 1, BankDayAdjustment.previous()));
        AmountPattern refund = pattern(-2_000, "2024-01-01", new MonthlyFixed(10, 1, BankDayAdjustment.NONE));
        BudgetPost expenses = post(BudgetPostDirection.EXPENSE, "Living", weekly, monthly, refund);
        TimelinePreviewService preview = new TimelinePreviewService(generator, PocketplanProperties.defaults());

        ForecastResult result = projector.project(input(List.of(expenses), Map.of(), List.of(), 3));

        for (ForecastResult.MonthProjection projection : result.projections()) {
            long previewed = preview.preview(expenses.amountPatterns(), DateWindow.ofMonth(projection.month())).stream()
                    .mapToLong(Occurrence::amount)
                    .sum();
            assertThat(projection.expectedExpenses()).isEqualTo(previewed);
        }
    }

    private ForecastProjector.ProjectionInput input(
            List<BudgetPost> posts,
            Map<UUID, Long> balances,
            List<CarryForward> carryForwards,
            int months
    ) {
        return new ForecastProjector.ProjectionInput(posts, balances, carryForwards, JANUARY, months, 500_000L, 3);
    }

    private BudgetPost post(BudgetPostDirection direction, String name, AmountPattern... patterns) {
        return new BudgetPost(UUID.randomUUID(), budgetId, direction, UUID.randomUUID(), name, false,
                Set.of(checking), null, null, List.of(patterns));
    }

    private BudgetPost transfer(String name, AmountPattern pattern) {
        AmountPattern withoutContainers = pattern.withContainerIds(List.of());
        return new BudgetPost(UUID.randomUUID(), budgetId, BudgetPostDirection.TRANSFER, null, name, false,
                Set.of(), checking, savings, List.of(withoutContainers));
    }

    private AmountPattern pattern(long amount, String start, RecurrencePattern recurrence) {
        return AmountPattern.builder()
                .amount(amount)
                .startDate(LocalDate.parse(start))
                .recurrence(recurrence)
                .containerId(checking)
                .build();
    }
}
