package com.pocketplan.forecast.controller.dto;

import java.util.List;

public record BulkOccurrencesResponseDto(List<PostOccurrencesResponseDto> data, String traceId) {
}
