package com.pocketplan.forecast.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

public record PreviewOccurrencesRequestDto(
        @NotEmpty List<@Valid AmountPatternDto> amountPatterns,
        @NotNull LocalDate fromDate,
        @NotNull LocalDate toDate
) {
}
