package com.pocketplan.forecast.controller;

import com.pocketplan.forecast.controller.dto.ForecastResponseDto;
import com.pocketplan.forecast.forecast.ForecastService;
import com.pocketplan.forecast.model.ForecastResult;
import com.pocketplan.forecast.web.RequestContextHolder;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/budgets/{budgetId}")
public class ForecastController {

    private final ForecastService forecastService;

    public ForecastController(ForecastService forecastService) {
        this.forecastService = forecastService;
    }

    @GetMapping("/forecast")
    public ResponseEntity<ForecastResponseDto> getForecast(
            @PathVariable("budgetId") UUID budgetId,
            @RequestParam(value = "months", required = false) Integer months
    ) {
        ForecastResult result = forecastService.forecast(budgetId, months);
        return ResponseEntity.ok(map(result));
    }

    private ForecastResponseDto map(ForecastResult result) {
        return new ForecastResponseDto(
                result.projections().stream()
                        .map(projection -> new ForecastResponseDto.Projection(
                                projection.month().toString(),
                                projection.startBalance(),
                                projection.expectedIncome(),
                                projection.expectedExpenses(),
                                projection.endBalance(),
                                projection.containerBalances()
                        ))
                        .toList(),
                mapLowestPoint(result.lowestPoint()),
                mapLargeExpense(result.nextLargeExpense()),
                RequestContextHolder.traceId().orElse(null)
        );
    }

    private ForecastResponseDto.LowestPoint mapLowestPoint(ForecastResult.LowestPoint lowestPoint) {
        if (lowestPoint == null) {
            return null;
        }
        return new ForecastResponseDto.LowestPoint(lowestPoint.month().toString(), lowestPoint.balance());
    }

    private ForecastResponseDto.LargeExpense mapLargeExpense(ForecastResult.LargeExpense expense) {
        if (expense == null) {
            return null;
        }
        return new ForecastResponseDto.LargeExpense(expense.budgetPostId(), expense.name(), expense.amount(), expense.date());
    }
}
