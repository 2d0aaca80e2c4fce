package com.pocketplan.forecast.controller.dto;

import java.util.List;

/**
 * Flat wire shape of a recurrence. Which fields are meaningful depends on {@code type}.
 *
 * @param weekday 0 = Monday .. 6 = Sunday
 */
public record RecurrencePatternDto(
        String type,
        Integer interval,
        Integer weekday,
        Integer dayOfMonth,
        String relativePosition,
        Integer month,
        List<Integer> months,
        String bankDayAdjustment,
        Boolean bankDayKeepInMonth,
        Boolean bankDayNoDedup,
        Integer bankDayNumber,
        Boolean bankDayFromEnd
) {
}
