package com.pocketplan.forecast.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record AmountPatternDto(
        @NotNull Long amount,
        @NotNull LocalDate startDate,
        LocalDate endDate,
        RecurrencePatternDto recurrencePattern,
        List<UUID> containerIds
) {
}
