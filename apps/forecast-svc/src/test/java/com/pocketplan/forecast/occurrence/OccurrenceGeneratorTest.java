package com.pocketplan.forecast.occurrence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pocketplan.forecast.bankday.BankDayAdjuster;
import com.pocketplan.forecast.bankday.BankDayCalendar;
import com.pocketplan.forecast.bankday.BankDayCalendars;
import com.pocketplan.forecast.model.AmountPattern;
import com.pocketplan.forecast.model.DateWindow;
import com.pocketplan.forecast.model.Occurrence;
import com.pocketplan.forecast.model.OccurrenceKind;
import com.pocketplan.forecast.model.recurrence.AdjustmentDirection;
import com.pocketplan.forecast.model.recurrence.BankDayAdjustment;
import com.pocketplan.forecast.model.recurrence.Daily;
import com.pocketplan.forecast.model.recurrence.MonthlyBankDay;
import com.pocketplan.forecast.model.recurrence.MonthlyFixed;
import com.pocketplan.forecast.model.recurrence.MonthlyRelative;
import com.pocketplan.forecast.model.recurrence.Once;
import com.pocketplan.forecast.model.recurrence.PeriodMonthly;
import com.pocketplan.forecast.model.recurrence.RecurrencePattern;
import com.pocketplan.forecast.model.recurrence.RelativePosition;
import com.pocketplan.forecast.model.recurrence.Weekly;
import com.pocketplan.forecast.model.recurrence.YearlyBankDay;
import com.pocketplan.forecast.model.recurrence.YearlyFixed;
import com.pocketplan.forecast.model.recurrence.YearlyRelative;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.List;
import org.junit.jupiter.api.Test;

class OccurrenceGeneratorTest {

    private static final BankDayCalendar WEEKDAYS_ONLY = date -> date.getDayOfWeek().getValue() <= 5;

    private final BankDayCalendar danish = BankDayCalendars.defaults().forCountry("DK");
    private final OccurrenceGenerator generator =
            new OccurrenceGenerator(new BankDayAdjuster(), new PeriodOccurrences(), danish);

    @Test
    void clampsDayOfMonthToMonthLengthInLeapYear() {
        AmountPattern pattern = pattern(120_000, "2024-01-01", new MonthlyFixed(31, 1, BankDayAdjustment.NONE));

        List<Occurrence> occurrences = generator.generate(pattern, window("2024-01-01", "2024-04-30"));

        assertThat(dates(occurrences)).containsExactly(
                LocalDate.of(2024, 1, 31),
                LocalDate.of(2024, 2, 29),
                LocalDate.of(2024, 3, 31),
                LocalDate.of(2024, 4, 30));
        assertThat(occurrences).extracting(Occurrence::amount).containsOnly(120_000L);
    }

    @Test
    void clampsDayOfMonthInNonLeapYear() {
        AmountPattern pattern = pattern(1_000, "2023-01-01", new MonthlyFixed(31, 1, BankDayAdjustment.NONE));

        assertThat(dates(generator.generate(pattern, window("2023-01-01", "2023-03-31")))).containsExactly(
                LocalDate.of(2023, 1, 31),
                LocalDate.of(2023, 2, 28),
                LocalDate.of(2023, 3, 31));
    }

    @Test
    void findsLastFridayIncludingMonthsEndingOnFriday() {
        AmountPattern pattern = pattern(1_000, "2024-01-01",
                new MonthlyRelative(DayOfWeek.FRIDAY, RelativePosition.LAST, 1, BankDayAdjustment.NONE));

        assertThat(dates(generator.generate(pattern, window("2024-01-01", "2024-05-31")))).containsExactly(
                LocalDate.of(2024, 1, 26),
                LocalDate.of(2024, 2, 23),
                LocalDate.of(2024, 3, 29),
                LocalDate.of(2024, 4, 26),
                LocalDate.of(2024, 5, 31));
    }

    @Test
    void weeklyStartsOnFirstMatchingWeekdayAndStepsByInterval() {
        AmountPattern pattern = pattern(500, "2024-01-03", new Weekly(DayOfWeek.MONDAY, 2, BankDayAdjustment.NONE));

        assertThat(dates(generator.generate(pattern, window("2024-01-01", "2024-02-10")))).containsExactly(
                LocalDate.of(2024, 1, 8),
                LocalDate.of(2024, 1, 22),
                LocalDate.of(2024, 2, 5));
    }

    @Test
    void keepInMonthPullsNextAdjustmentBackIntoMonth() {
        // 2024-08-31 is a Saturday
        AmountPattern pattern = pattern(1_000, "2024-08-01", new MonthlyFixed(31, 1, BankDayAdjustment.next()));

        assertThat(dates(generator.generate(pattern, window("2024-08-01", "2024-08-31"))))
                .containsExactly(LocalDate.of(2024, 8, 30));
    }

    @Test
    void adjustmentCanMoveCandidateFromOutsideIntoWindow() {
        BankDayAdjustment previousAcrossMonths =
                new BankDayAdjustment(AdjustmentDirection.PREVIOUS, false, false);
        AmountPattern pattern = pattern(1_000, "2024-01-01", new MonthlyFixed(1, 1, previousAcrossMonths));

        // June 1st 2024 is a Saturday and moves back to May 31st
        assertThat(dates(generator.generate(pattern, window("2024-05-01", "2024-05-31")))).containsExactly(
                LocalDate.of(2024, 5, 1),
                LocalDate.of(2024, 5, 31));
    }

    @Test
    void onceOnSaturdayMovesToPreviousFriday() {
        AmountPattern pattern = pattern(-50_000, "2024-06-29", new Once(BankDayAdjustment.previous()));

        List<Occurrence> occurrences = generator.generate(pattern, window("2024-06-01", "2024-06-30"));

        assertThat(occurrences).containsExactly(
                new Occurrence(0, LocalDate.of(2024, 6, 28), -50_000, OccurrenceKind.DATE));
    }

    @Test
    void periodMonthlyCoversMarchThroughDecember() {
        AmountPattern pattern = pattern(2_000, "2024-03-01", new PeriodMonthly(1));

        List<Occurrence> occurrences = generator.generate(pattern, window("2024-01-01", "2024-12-31"));

        assertThat(occurrences).hasSize(10);
        assertThat(occurrences).extracting(Occurrence::kind).containsOnly(OccurrenceKind.PERIOD);
        assertThat(occurrences).allSatisfy(occurrence -> assertThat(occurrence.date().getDayOfMonth()).isEqualTo(1));
        assertThat(occurrences.get(0).date()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(occurrences.get(9).date()).isEqualTo(LocalDate.of(2024, 12, 1));
    }

    @Test
    void bankDayVariantsCountFromStartAndEnd() {
        AmountPattern first = pattern(1, "2026-01-01", new MonthlyBankDay(1, false, 1));
        AmountPattern last = pattern(1, "2026-01-01", new MonthlyBankDay(1, true, 1));
        DateWindow window = window("2026-01-01", "2026-02-28");

        // January 1st is a holiday
        assertThat(dates(generator.generate(first, window)))
                .containsExactly(LocalDate.of(2026, 1, 2), LocalDate.of(2026, 2, 2));
        assertThat(dates(generator.generate(last, window)))
                .containsExactly(LocalDate.of(2026, 1, 30), LocalDate.of(2026, 2, 27));
    }

    @Test
    void yearlyBankDayAnchorsOnMonth() {
        AmountPattern pattern = pattern(1, "2025-01-01", new YearlyBankDay(Month.DECEMBER, 1, true, 1));

        assertThat(dates(generator.generate(pattern, window("2026-01-01", "2026-12-31"))))
                .containsExactly(LocalDate.of(2026, 12, 31));
    }

    @Test
    void mergesSameDayCollisionsUnlessNoDedup() {
        BankDayAdjustment previous = new BankDayAdjustment(AdjustmentDirection.PREVIOUS, true, false);
        AmountPattern merged = pattern(100, "2024-06-03", new Daily(1, previous));
        AmountPattern separate = pattern(100, "2024-06-03", new Daily(1, previous.withNoDedup(true)));
        DateWindow week = window("2024-06-03", "2024-06-09");

        List<Occurrence> mergedOccurrences = generator.generate(0, merged, week, WEEKDAYS_ONLY);
        List<Occurrence> separateOccurrences = generator.generate(0, separate, week, WEEKDAYS_ONLY);

        assertThat(mergedOccurrences).hasSize(5);
        assertThat(mergedOccurrences.get(4)).isEqualTo(
                new Occurrence(0, LocalDate.of(2024, 6, 7), 300, OccurrenceKind.DATE));
        assertThat(separateOccurrences).hasSize(7);
        assertThat(separateOccurrences.subList(4, 7)).extracting(Occurrence::date)
                .containsOnly(LocalDate.of(2024, 6, 7));
    }

    @Test
    void honoursEndDateAndReturnsEmptyOutsideLifespan() {
        AmountPattern pattern = AmountPattern.builder()
                .amount(10)
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 3))
                .recurrence(new Daily(1, BankDayAdjustment.NONE))
                .build();

        assertThat(generator.generate(pattern, window("2024-01-02", "2024-01-31"))).hasSize(2);
        assertThat(generator.generate(pattern, window("2024-02-01", "2024-02-29"))).isEmpty();
    }

    @Test
    void isDeterministic() {
        AmountPattern pattern = pattern(1_000, "2024-01-15",
                new MonthlyRelative(DayOfWeek.MONDAY, RelativePosition.SECOND, 1, BankDayAdjustment.next()));
        DateWindow window = window("2024-01-01", "2025-12-31");

        assertThat(generator.generate(pattern, window)).isEqualTo(generator.generate(pattern, window));
    }

    @Test
    void ordersMergedTimelineByDateThenPatternIndex() {
        AmountPattern a = pattern(1, "2024-01-10", Once.plain());
        AmountPattern b = pattern(2, "2024-01-05", Once.plain());
        AmountPattern c = pattern(3, "2024-01-10", Once.plain());

        List<Occurrence> timeline = generator.generateAll(List.of(a, b, c), window("2024-01-01", "2024-01-31"));

        assertThat(timeline).extracting(Occurrence::patternIndex).containsExactly(1, 0, 2);
    }

    @Test
    void yearlyFixedClampsFebruaryAndSkipsOffYears() {
        AmountPattern pattern = pattern(9_000, "2024-01-01", new YearlyFixed(Month.FEBRUARY, 31, 2, BankDayAdjustment.NONE));

        assertThat(dates(generator.generate(pattern, window("2024-01-01", "2028-12-31")))).containsExactly(
                LocalDate.of(2024, 2, 29),
                LocalDate.of(2026, 2, 28),
                LocalDate.of(2028, 2, 29));
    }

    @Test
    void yearlyRelativeFindsLastMondayOfMay() {
        AmountPattern pattern = pattern(2_500, "2024-01-01",
                new YearlyRelative(Month.MAY, DayOfWeek.MONDAY, RelativePosition.LAST, 1, BankDayAdjustment.NONE));

        assertThat(dates(generator.generate(pattern, window("2024-01-01", "2026-12-31")))).containsExactly(
                LocalDate.of(2024, 5, 27),
                LocalDate.of(2025, 5, 26),
                LocalDate.of(2026, 5, 25));
    }

    @Test
    void dailyIntervalStaysOnGridAnchoredAtStartDate() {
        AmountPattern pattern = pattern(100, "2024-01-01", new Daily(3, BankDayAdjustment.NONE));

        assertThat(dates(generator.generate(pattern, window("2024-01-05", "2024-01-12")))).containsExactly(
                LocalDate.of(2024, 1, 7),
                LocalDate.of(2024, 1, 10));
    }

    @Test
    void monthlyIntervalStaysOnGridAnchoredAtStartMonth() {
        AmountPattern pattern = pattern(100, "2024-01-20", new MonthlyFixed(15, 3, BankDayAdjustment.NONE));

        assertThat(dates(generator.generate(pattern, window("2024-02-01", "2024-12-31")))).containsExactly(
                LocalDate.of(2024, 4, 15),
                LocalDate.of(2024, 7, 15),
                LocalDate.of(2024, 10, 15));
    }

    @Test
    void hugeIntervalsYieldOnlyTheFirstStep() {
        DateWindow january = window("2024-01-01", "2024-01-31");

        assertThat(dates(generator.generate(
                pattern(1, "2024-01-01", new Weekly(DayOfWeek.MONDAY, 400_000_000, BankDayAdjustment.NONE)), january)))
                .containsExactly(LocalDate.of(2024, 1, 1));
        assertThat(dates(generator.generate(
                pattern(1, "2024-01-01", new Daily(Integer.MAX_VALUE, BankDayAdjustment.NONE)), january)))
                .containsExactly(LocalDate.of(2024, 1, 1));
        assertThat(dates(generator.generate(
                pattern(1, "2024-01-10", new MonthlyFixed(10, Integer.MAX_VALUE, BankDayAdjustment.NONE)), january)))
                .containsExactly(LocalDate.of(2024, 1, 10));
        assertThat(dates(generator.generate(
                pattern(1, "2024-01-01", new YearlyFixed(Month.JANUARY, 15, Integer.MAX_VALUE, BankDayAdjustment.NONE)), january)))
                .containsExactly(LocalDate.of(2024, 1, 15));
        assertThat(generator.generate(
                pattern(1, "2020-01-01", new Daily(Integer.MAX_VALUE, BankDayAdjustment.NONE)), january))
                .isEmpty();
    }

    @Test
    void rejectsReversedWindow() {
        assertThatThrownBy(() -> window("2024-02-01", "2024-01-01"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AmountPattern pattern(long amount, String start, RecurrencePattern recurrence) {
        return AmountPattern.builder()
                .amount(amount)
                .startDate(LocalDate.parse(start))
                .recurrence(recurrence)
                .build();
    }

    private static DateWindow window(String from, String to) {
        return new DateWindow(LocalDate.parse(from), LocalDate.parse(to));
    }

    private static List<LocalDate> dates(List<Occurrence> occurrences) {
        return occurrences.stream().map(Occurrence::date).toList();
    }
}
