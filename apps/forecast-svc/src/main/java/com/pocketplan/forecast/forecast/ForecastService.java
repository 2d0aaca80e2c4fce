package com.pocketplan.forecast.forecast;

import com.pocketplan.forecast.config.PocketplanProperties;
import com.pocketplan.forecast.model.BudgetPost;
import com.pocketplan.forecast.model.ForecastResult;
import com.pocketplan.forecast.repository.BudgetPostRepository;
import com.pocketplan.forecast.repository.BudgetRepository;
import com.pocketplan.forecast.repository.CarryForwardRepository;
import com.pocketplan.forecast.repository.ContainerBalanceRepository;
import com.pocketplan.forecast.service.ResourceNotFoundException;
import java.time.Clock;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final BudgetRepository budgetRepository;
    private final BudgetPostRepository budgetPostRepository;
    private final ContainerBalanceRepository containerBalanceRepository;
    private final CarryForwardRepository carryForwardRepository;
    private final ForecastProjector forecastProjector;
    private final PocketplanProperties properties;
    private final Clock clock;

    public ForecastService(
            BudgetRepository budgetRepository,
            BudgetPostRepository budgetPostRepository,
            ContainerBalanceRepository containerBalanceRepository,
            CarryForwardRepository carryForwardRepository,
            ForecastProjector forecastProjector,
            PocketplanProperties properties,
            Clock clock
    ) {
        this.budgetRepository = budgetRepository;
        this.budgetPostRepository = budgetPostRepository;
        this.containerBalanceRepository = containerBalanceRepository;
        this.carryForwardRepository = carryForwardRepository;
        this.forecastProjector = forecastProjector;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Projects {@code months} calendar months starting with the current one. A null month count means the
     * configured default.
     */
    public ForecastResult forecast(UUID budgetId, Integer months) {
        PocketplanProperties.Forecast config = properties.forecast();
        int horizon = months == null ? config.defaultMonths() : months;
        if (horizon < 1 || horizon > config.maxMonths()) {
            throw new IllegalArgumentException("months must be between 1 and " + config.maxMonths());
        }
        if (!budgetRepository.existsById(budgetId)) {
            throw new ResourceNotFoundException("Budget not found: " + budgetId);
        }

        List<BudgetPost> posts = budgetPostRepository.findByBudgetId(budgetId);
        YearMonth firstMonth = YearMonth.now(clock);
        ForecastResult result = forecastProjector.project(new ForecastProjector.ProjectionInput(
                posts,
                containerBalanceRepository.findBalancesByBudgetId(budgetId),
                carryForwardRepository.findByBudgetId(budgetId),
                firstMonth,
                horizon,
                config.largeExpenseThreshold(),
                config.largeExpenseLookaheadMonths()
        ));
        log.info("Forecast computed: budget={} posts={} months={} from={}", budgetId, posts.size(), horizon, firstMonth);
        return result;
    }
}
