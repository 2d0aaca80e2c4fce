package com.pocketplan.forecast.controller.dto;

import java.time.LocalDate;

public record OccurrenceDto(int patternIndex, LocalDate date, long amount) {
}
