package com.pocketplan.forecast.controller.dto;

import java.util.List;

public record OccurrencesResponseDto(List<OccurrenceDto> occurrences, String traceId) {
}
