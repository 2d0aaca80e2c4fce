package com.pocketplan.forecast.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ForecastResult(
        List<MonthProjection> projections,
        LowestPoint lowestPoint,
        LargeExpense nextLargeExpense
) {
    public record MonthProjection(
            YearMonth month,
            long startBalance,
            long expectedIncome,
            long expectedExpenses,
            long endBalance,
            Map<UUID, Long> containerBalances
    ) {
    }

    public record LowestPoint(YearMonth month, long balance) {
    }

    public record LargeExpense(UUID budgetPostId, String name, long amount, LocalDate date) {
    }
}
