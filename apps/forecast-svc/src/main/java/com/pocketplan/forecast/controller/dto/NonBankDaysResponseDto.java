package com.pocketplan.forecast.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record NonBankDaysResponseDto(String country, List<LocalDate> dates, String traceId) {
}
