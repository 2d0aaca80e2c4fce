package com.pocketplan.forecast.controller.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ForecastResponseDto(
        List<Projection> projections,
        LowestPoint lowestPoint,
        LargeExpense nextLargeExpense,
        String traceId
) {
    public record Projection(
            String month,
            long startBalance,
            long expectedIncome,
            long expectedExpenses,
            long endBalance,
            Map<UUID, Long> containerBalances
    ) {
    }

    public record LowestPoint(String month, long balance) {
    }

    public record LargeExpense(UUID budgetPostId, String name, long amount, LocalDate date) {
    }
}
