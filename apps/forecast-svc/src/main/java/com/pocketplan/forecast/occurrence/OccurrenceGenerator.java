package com.pocketplan.forecast.occurrence;

import com.pocketplan.forecast.bankday.BankDayAdjuster;
import com.pocketplan.forecast.bankday.BankDayCalendar;
import com.pocketplan.forecast.model.AmountPattern;
import com.pocketplan.forecast.model.DateWindow;
import com.pocketplan.forecast.model.Occurrence;
import com.pocketplan.forecast.model.OccurrenceKind;
import com.pocketplan.forecast.model.recurrence.BankDayAdjustment;
import com.pocketplan.forecast.model.recurrence.BankDayRecurrence;
import com.pocketplan.forecast.model.recurrence.Daily;
import com.pocketplan.forecast.model.recurrence.DateRecurrence;
import com.pocketplan.forecast.model.recurrence.MonthlyBankDay;
import com.pocketplan.forecast.model.recurrence.MonthlyFixed;
import com.pocketplan.forecast.model.recurrence.MonthlyRelative;
import com.pocketplan.forecast.model.recurrence.Once;
import com.pocketplan.forecast.model.recurrence.PeriodRecurrence;
import com.pocketplan.forecast.model.recurrence.RecurrencePattern;
import com.pocketplan.forecast.model.recurrence.Weekly;
import com.pocketplan.forecast.model.recurrence.YearlyBankDay;
import com.pocketplan.forecast.model.recurrence.YearlyFixed;
import com.pocketplan.forecast.model.recurrence.YearlyRelative;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Expands amount patterns into dated occurrences inside a window.
 *
 * <p>This is the only place recurrence arithmetic happens; the forecast and the timeline preview both
 * call it, so identical inputs give identical sequences. Calls keep no state between invocations.
 *
 * <p>A candidate is produced for every recurrence date between the pattern's start and end date; bank-day
 * adjustment is applied to the candidate and the adjusted date decides whether it falls inside the window.
 * When an adjustment is active the scan is widened by {@link BankDayAdjuster#MAX_SHIFT_DAYS} on both sides
 * so candidates shifted into the window from just outside it are not lost.
 */
@Component
public class OccurrenceGenerator {

    private final BankDayAdjuster bankDayAdjuster;
    private final PeriodOccurrences periodOccurrences;
    private final BankDayCalendar bankDayCalendar;

    public OccurrenceGenerator(
            BankDayAdjuster bankDayAdjuster,
            PeriodOccurrences periodOccurrences,
            BankDayCalendar bankDayCalendar
    ) {
        this.bankDayAdjuster = bankDayAdjuster;
        this.periodOccurrences = periodOccurrences;
        this.bankDayCalendar = bankDayCalendar;
    }

    public List<Occurrence> generate(AmountPattern pattern, DateWindow window) {
        return generate(0, pattern, window, bankDayCalendar);
    }

    public List<Occurrence> generate(int patternIndex, AmountPattern pattern, DateWindow window) {
        return generate(patternIndex, pattern, window, bankDayCalendar);
    }

    /**
     * Occurrences of one pattern, ascending by date.
     */
    public List<Occurrence> generate(int patternIndex, AmountPattern pattern, DateWindow window, BankDayCalendar calendar) {
        RecurrencePattern recurrence = pattern.recurrence();
        if (recurrence instanceof PeriodRecurrence) {
            return periodOccurrences.expand(patternIndex, pattern, window);
        }
        if (recurrence instanceof DateRecurrence dated) {
            return expandDated(patternIndex, pattern, dated, window, calendar);
        }
        if (recurrence instanceof BankDayRecurrence bankDay) {
            return expandBankDay(patternIndex, pattern, bankDay, window, calendar);
        }
        throw new IllegalStateException("unsupported recurrence: " + recurrence);
    }

    /**
     * Occurrences of several patterns merged into one timeline ordered by date, then pattern index.
     * Pattern indexes are the list positions.
     */
    public List<Occurrence> generateAll(List<AmountPattern> patterns, DateWindow window) {
        List<Occurrence> all = new ArrayList<>();
        for (int index = 0; index < patterns.size(); index++) {
            all.addAll(generate(index, patterns.get(index), window, bankDayCalendar));
        }
        all.sort(Occurrence.TIMELINE_ORDER);
        return List.copyOf(all);
    }

    private List<Occurrence> expandDated(
            int patternIndex,
            AmountPattern pattern,
            DateRecurrence recurrence,
            DateWindow window,
            BankDayCalendar calendar
    ) {
        BankDayAdjustment adjustment = recurrence.adjustment();
        Optional<ScanRange> range = ScanRange.of(pattern, window, adjustment.isActive() ? BankDayAdjuster.MAX_SHIFT_DAYS : 0);
        if (range.isEmpty()) {
            return List.of();
        }
        List<LocalDate> candidates = candidates(recurrence, pattern.startDate(), range.get());
        List<Occurrence> occurrences = new ArrayList<>(candidates.size());
        for (LocalDate candidate : candidates) {
            LocalDate adjusted = bankDayAdjuster.adjust(candidate, adjustment, calendar);
            if (window.contains(adjusted)) {
                occurrences.add(new Occurrence(patternIndex, adjusted, pattern.amount(), OccurrenceKind.DATE));
            }
        }
        occurrences.sort(Comparator.comparing(Occurrence::date));
        return adjustment.noDedup() ? List.copyOf(occurrences) : mergeSameDay(occurrences);
    }

    private List<Occurrence> expandBankDay(
            int patternIndex,
            AmountPattern pattern,
            BankDayRecurrence recurrence,
            DateWindow window,
            BankDayCalendar calendar
    ) {
        Optional<ScanRange> range = ScanRange.of(pattern, window, 0);
        if (range.isEmpty()) {
            return List.of();
        }
        Function<YearMonth, Optional<LocalDate>> resolver =
                month -> MonthDays.nthBankDay(month, recurrence.bankDayNumber(), recurrence.fromEnd(), calendar);
        List<LocalDate> dates;
        if (recurrence instanceof MonthlyBankDay monthly) {
            dates = monthlyCandidates(pattern.startDate(), monthly.interval(), range.get(), resolver);
        } else if (recurrence instanceof YearlyBankDay yearly) {
            dates = yearlyCandidates(pattern.startDate(), yearly.month(), yearly.interval(), range.get(), resolver);
        } else {
            throw new IllegalStateException("unsupported bank day recurrence: " + recurrence);
        }
        return dates.stream()
                .map(date -> new Occurrence(patternIndex, date, pattern.amount(), OccurrenceKind.DATE))
                .toList();
    }

    private static List<LocalDate> candidates(DateRecurrence recurrence, LocalDate start, ScanRange range) {
        if (recurrence instanceof Once) {
            return range.contains(start) ? List.of(start) : List.of();
        }
        if (recurrence instanceof Daily daily) {
            return steppedDays(start, daily.interval(), range);
        }
        if (recurrence instanceof Weekly weekly) {
            LocalDate first = start.with(TemporalAdjusters.nextOrSame(weekly.weekday()));
            return steppedDays(first, 7L * weekly.interval(), range);
        }
        if (recurrence instanceof MonthlyFixed fixed) {
            return monthlyCandidates(start, fixed.interval(), range,
                    month -> Optional.of(MonthDays.clampedDay(month, fixed.dayOfMonth())));
        }
        if (recurrence instanceof MonthlyRelative relative) {
            return monthlyCandidates(start, relative.interval(), range,
                    month -> Optional.of(MonthDays.relativeWeekday(month, relative.weekday(), relative.relativePosition())));
        }
        if (recurrence instanceof YearlyFixed fixed) {
            return yearlyCandidates(start, fixed.month(), fixed.interval(), range,
                    month -> Optional.of(MonthDays.clampedDay(month, fixed.dayOfMonth())));
        }
        if (recurrence instanceof YearlyRelative relative) {
            return yearlyCandidates(start, relative.month(), relative.interval(), range,
                    month -> Optional.of(MonthDays.relativeWeekday(month, relative.weekday(), relative.relativePosition())));
        }
        throw new IllegalStateException("unsupported date recurrence: " + recurrence);
    }

    private static List<LocalDate> steppedDays(LocalDate first, long stepDays, ScanRange range) {
        List<LocalDate> dates = new ArrayList<>();
        long firstDay = first.toEpochDay();
        long lastDay = range.to().toEpochDay();
        long k = MonthDays.firstStepAtOrAfter(range.from().toEpochDay() - firstDay, stepDays);
        // long cursor: a large step lands past the range instead of wrapping
        for (long day = firstDay + k * stepDays; day <= lastDay; day += stepDays) {
            dates.add(LocalDate.ofEpochDay(day));
        }
        return dates;
    }

    private static List<LocalDate> monthlyCandidates(
            LocalDate start,
            int interval,
            ScanRange range,
            Function<YearMonth, Optional<LocalDate>> dayInMonth
    ) {
        List<LocalDate> dates = new ArrayList<>();
        long anchor = MonthDays.monthIndex(YearMonth.from(start));
        long lastMonth = MonthDays.monthIndex(YearMonth.from(range.to()));
        long k = MonthDays.firstStepAtOrAfter(MonthDays.monthIndex(YearMonth.from(range.from())) - anchor, interval);
        for (long cursor = anchor + k * interval; cursor <= lastMonth; cursor += interval) {
            dayInMonth.apply(MonthDays.fromMonthIndex(cursor)).filter(range::contains).ifPresent(dates::add);
        }
        return dates;
    }

    private static List<LocalDate> yearlyCandidates(
            LocalDate start,
            Month month,
            int interval,
            ScanRange range,
            Function<YearMonth, Optional<LocalDate>> dayInMonth
    ) {
        List<LocalDate> dates = new ArrayList<>();
        long k = MonthDays.firstStepAtOrAfter(range.from().getYear() - (long) start.getYear(), interval);
        for (long year = start.getYear() + k * interval; year <= range.to().getYear(); year += interval) {
            dayInMonth.apply(YearMonth.of((int) year, month)).filter(range::contains).ifPresent(dates::add);
        }
        return dates;
    }

    private static List<Occurrence> mergeSameDay(List<Occurrence> sorted) {
        List<Occurrence> merged = new ArrayList<>(sorted.size());
        for (Occurrence occurrence : sorted) {
            int lastIndex = merged.size() - 1;
            if (lastIndex >= 0 && merged.get(lastIndex).date().equals(occurrence.date())) {
                merged.set(lastIndex, merged.get(lastIndex).plusAmount(occurrence.amount()));
            } else {
                merged.add(occurrence);
            }
        }
        return List.copyOf(merged);
    }

    /**
     * Inclusive range of candidate dates: the pattern's own life span intersected with the window,
     * widened by {@code slackDays} on both window edges.
     */
    private record ScanRange(LocalDate from, LocalDate to) {

        static Optional<ScanRange> of(AmountPattern pattern, DateWindow window, int slackDays) {
            LocalDate from = max(pattern.startDate(), window.from().minusDays(slackDays));
            LocalDate to = window.to().plusDays(slackDays);
            if (pattern.endDate() != null && pattern.endDate().isBefore(to)) {
                to = pattern.endDate();
            }
            return to.isBefore(from) ? Optional.empty() : Optional.of(new ScanRange(from, to));
        }

        boolean contains(LocalDate date) {
            return !date.isBefore(from) && !date.isAfter(to);
        }

        private static LocalDate max(LocalDate a, LocalDate b) {
            return a.isAfter(b) ? a : b;
        }
    }
}
