package com.pocketplan.forecast.controller;

import com.pocketplan.forecast.controller.dto.AmountPatternDto;
import com.pocketplan.forecast.controller.dto.RecurrencePatternDto;
import com.pocketplan.forecast.model.AmountPattern;
import com.pocketplan.forecast.model.recurrence.AdjustmentDirection;
import com.pocketplan.forecast.model.recurrence.BankDayAdjustment;
import com.pocketplan.forecast.model.recurrence.BankDayRecurrence;
import com.pocketplan.forecast.model.recurrence.Daily;
import com.pocketplan.forecast.model.recurrence.MonthlyBankDay;
import com.pocketplan.forecast.model.recurrence.MonthlyFixed;
import com.pocketplan.forecast.model.recurrence.MonthlyRelative;
import com.pocketplan.forecast.model.recurrence.Once;
import com.pocketplan.forecast.model.recurrence.PeriodMonthly;
import com.pocketplan.forecast.model.recurrence.PeriodOnce;
import com.pocketplan.forecast.model.recurrence.PeriodYearly;
import com.pocketplan.forecast.model.recurrence.RecurrencePattern;
import com.pocketplan.forecast.model.recurrence.RelativePosition;
import com.pocketplan.forecast.model.recurrence.Weekly;
import com.pocketplan.forecast.model.recurrence.YearlyBankDay;
import com.pocketplan.forecast.model.recurrence.YearlyFixed;
import com.pocketplan.forecast.model.recurrence.YearlyRelative;
import java.time.DayOfWeek;
import java.time.Month;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns the flat recurrence wire shape into the typed recurrence variants, rejecting fields a variant
 * needs but does not have.
 */
@Component
public class RecurrencePatternMapper {

    public AmountPattern toAmountPattern(AmountPatternDto dto) {
        AmountPattern.Builder builder = AmountPattern.builder();
        if (dto.amount() != null) {
            builder.amount(dto.amount());
        }
        return builder
                .startDate(dto.startDate())
                .endDate(dto.endDate())
                .recurrence(dto.recurrencePattern() == null ? null : toRecurrence(dto.recurrencePattern()))
                .containerIds(dto.containerIds())
                .build();
    }

    public List<AmountPattern> toAmountPatterns(List<AmountPatternDto> dtos) {
        return dtos.stream().map(this::toAmountPattern).toList();
    }

    public RecurrencePattern toRecurrence(RecurrencePatternDto dto) {
        if (dto.type() == null || dto.type().isBlank()) {
            throw new IllegalArgumentException("recurrence type must be provided");
        }
        String type = dto.type().trim().toLowerCase(Locale.ROOT);
        int interval = dto.interval() == null ? 1 : dto.interval();
        return switch (type) {
            case "once" -> new Once(adjustment(dto));
            case "daily" -> new Daily(interval, adjustment(dto));
            case "weekly" -> new Weekly(weekday(dto, type), interval, adjustment(dto));
            case "monthly_fixed" -> new MonthlyFixed(dayOfMonth(dto, type), interval, adjustment(dto));
            case "monthly_relative" -> new MonthlyRelative(
                    weekday(dto, type), relativePosition(dto, type), interval, adjustment(dto));
            case "monthly_bank_day" -> {
                rejectAdjustment(dto, type);
                yield new MonthlyBankDay(bankDayNumber(dto, type), Boolean.TRUE.equals(dto.bankDayFromEnd()), interval);
            }
            case "yearly" -> yearly(dto, interval);
            case "yearly_bank_day" -> {
                rejectAdjustment(dto, type);
                yield new YearlyBankDay(month(dto.month(), type), bankDayNumber(dto, type),
                        Boolean.TRUE.equals(dto.bankDayFromEnd()), interval);
            }
            case "period_once" -> {
                rejectAdjustment(dto, type);
                yield new PeriodOnce();
            }
            case "period_monthly" -> {
                rejectAdjustment(dto, type);
                yield new PeriodMonthly(interval);
            }
            case "period_yearly" -> {
                rejectAdjustment(dto, type);
                yield new PeriodYearly(months(dto), interval);
            }
            default -> throw new IllegalArgumentException("Unsupported recurrence type: " + dto.type());
        };
    }

    private RecurrencePattern yearly(RecurrencePatternDto dto, int interval) {
        Month month = month(dto.month(), "yearly");
        boolean fixed = dto.dayOfMonth() != null;
        boolean relative = dto.relativePosition() != null || dto.weekday() != null;
        if (fixed == relative) {
            throw new IllegalArgumentException("yearly requires either day_of_month or relative_position with weekday");
        }
        if (fixed) {
            return new YearlyFixed(month, dayOfMonth(dto, "yearly"), interval, adjustment(dto));
        }
        return new YearlyRelative(month, weekday(dto, "yearly"), relativePosition(dto, "yearly"), interval, adjustment(dto));
    }

    private static BankDayAdjustment adjustment(RecurrencePatternDto dto) {
        AdjustmentDirection direction = AdjustmentDirection.fromWire(dto.bankDayAdjustment());
        boolean keepInMonth = dto.bankDayKeepInMonth() == null || dto.bankDayKeepInMonth();
        boolean noDedup = Boolean.TRUE.equals(dto.bankDayNoDedup());
        return new BankDayAdjustment(direction, keepInMonth, noDedup);
    }

    private static void rejectAdjustment(RecurrencePatternDto dto, String type) {
        if (AdjustmentDirection.fromWire(dto.bankDayAdjustment()) != AdjustmentDirection.NONE) {
            throw new IllegalArgumentException("bank_day_adjustment is not allowed for " + type);
        }
    }

    private static DayOfWeek weekday(RecurrencePatternDto dto, String type) {
        Integer weekday = dto.weekday();
        if (weekday == null) {
            throw new IllegalArgumentException(type + " requires weekday");
        }
        if (weekday < 0 || weekday > 6) {
            throw new IllegalArgumentException("weekday must be between 0 (Monday) and 6 (Sunday)");
        }
        return DayOfWeek.of(weekday + 1);
    }

    private static int dayOfMonth(RecurrencePatternDto dto, String type) {
        if (dto.dayOfMonth() == null) {
            throw new IllegalArgumentException(type + " requires day_of_month");
        }
        return dto.dayOfMonth();
    }

    private static RelativePosition relativePosition(RecurrencePatternDto dto, String type) {
        RelativePosition position = RelativePosition.fromWire(dto.relativePosition());
        if (position == null) {
            throw new IllegalArgumentException(type + " requires relative_position");
        }
        return position;
    }

    private static int bankDayNumber(RecurrencePatternDto dto, String type) {
        if (dto.bankDayNumber() == null) {
            throw new IllegalArgumentException(type + " requires bank_day_number");
        }
        BankDayRecurrence.requireBankDayNumber(dto.bankDayNumber());
        return dto.bankDayNumber();
    }

    private static Month month(Integer value, String type) {
        if (value == null) {
            throw new IllegalArgumentException(type + " requires month");
        }
        if (value < 1 || value > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12");
        }
        return Month.of(value);
    }

    private static Set<Month> months(RecurrencePatternDto dto) {
        List<Integer> values = dto.months();
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("period_yearly requires months");
        }
        Set<Month> months = EnumSet.noneOf(Month.class);
        for (Integer value : values) {
            if (!months.add(month(value, "period_yearly"))) {
                throw new IllegalArgumentException("months must not contain duplicates");
            }
        }
        return months;
    }
}
