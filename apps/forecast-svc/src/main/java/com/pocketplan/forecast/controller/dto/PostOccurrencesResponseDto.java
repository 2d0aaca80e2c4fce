package com.pocketplan.forecast.controller.dto;

import java.util.List;
import java.util.UUID;

public record PostOccurrencesResponseDto(UUID budgetPostId, List<OccurrenceDto> occurrences) {
}
