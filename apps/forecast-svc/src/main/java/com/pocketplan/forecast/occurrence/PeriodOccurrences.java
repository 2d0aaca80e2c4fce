package com.pocketplan.forecast.occurrence;

import com.pocketplan.forecast.model.AmountPattern;
import com.pocketplan.forecast.model.DateWindow;
import com.pocketplan.forecast.model.Occurrence;
import com.pocketplan.forecast.model.OccurrenceKind;
import com.pocketplan.forecast.model.recurrence.PeriodMonthly;
import com.pocketplan.forecast.model.recurrence.PeriodOnce;
import com.pocketplan.forecast.model.recurrence.PeriodRecurrence;
import com.pocketplan.forecast.model.recurrence.PeriodYearly;
import java.time.Month;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Expands whole-month patterns. A period occurrence is emitted for every selected month that overlaps
 * the window and is positioned at that month's first day.
 */
@Component
public class PeriodOccurrences {

    public List<Occurrence> expand(int patternIndex, AmountPattern pattern, DateWindow window) {
        if (!(pattern.recurrence() instanceof PeriodRecurrence period)) {
            throw new IllegalStateException("not a period recurrence: " + pattern.recurrence());
        }
        YearMonth startMonth = YearMonth.from(pattern.startDate());
        YearMonth endMonth = pattern.end().map(YearMonth::from).orElse(null);
        YearMonth first = window.firstMonth();
        YearMonth last = window.lastMonth();
        if (endMonth != null && endMonth.isBefore(first)) {
            return List.of();
        }

        List<YearMonth> months = new ArrayList<>();
        if (period instanceof PeriodOnce) {
            if (!startMonth.isBefore(first) && !startMonth.isAfter(last)) {
                months.add(startMonth);
            }
        } else if (period instanceof PeriodMonthly monthly) {
            long anchor = MonthDays.monthIndex(startMonth);
            long lastIndex = MonthDays.monthIndex(endMonth == null || last.isBefore(endMonth) ? last : endMonth);
            long k = MonthDays.firstStepAtOrAfter(MonthDays.monthIndex(first) - anchor, monthly.interval());
            for (long cursor = anchor + k * monthly.interval(); cursor <= lastIndex; cursor += monthly.interval()) {
                months.add(MonthDays.fromMonthIndex(cursor));
            }
        } else if (period instanceof PeriodYearly yearly) {
            List<Month> selected = yearly.orderedMonths();
            long k = MonthDays.firstStepAtOrAfter(first.getYear() - (long) startMonth.getYear(), yearly.interval());
            long lastYear = endMonth == null ? last.getYear() : Math.min(last.getYear(), endMonth.getYear());
            for (long year = startMonth.getYear() + k * yearly.interval(); year <= lastYear; year += yearly.interval()) {
                for (Month month : selected) {
                    YearMonth candidate = YearMonth.of((int) year, month);
                    if (candidate.isBefore(startMonth) || candidate.isBefore(first)) {
                        continue;
                    }
                    if (candidate.isAfter(last) || (endMonth != null && candidate.isAfter(endMonth))) {
                        break;
                    }
                    months.add(candidate);
                }
            }
        } else {
            throw new IllegalStateException("unsupported period recurrence: " + period);
        }

        return months.stream()
                .map(month -> new Occurrence(patternIndex, month.atDay(1), pattern.amount(), OccurrenceKind.PERIOD))
                .toList();
    }
}
