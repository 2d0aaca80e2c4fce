package com.pocketplan.forecast.model;

import com.pocketplan.forecast.model.recurrence.Once;
import com.pocketplan.forecast.model.recurrence.RecurrencePattern;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One payment rule of a budget post. Amounts are integer minor units.
 *
 * @param endDate inclusive, {@code null} when the pattern repeats forever
 * @param containerIds ordered, distinct; the first entry is the container the amount is booked against
 */
public record AmountPattern(
        long amount,
        LocalDate startDate,
        LocalDate endDate,
        RecurrencePattern recurrence,
        List<UUID> containerIds
) {

    public AmountPattern {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(recurrence, "recurrence");
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("end_date must not be before start_date");
        }
        containerIds = containerIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(containerIds));
    }

    public Optional<LocalDate> end() {
        return Optional.ofNullable(endDate);
    }

    public Optional<UUID> primaryContainerId() {
        return containerIds.isEmpty() ? Optional.empty() : Optional.of(containerIds.get(0));
    }

    public AmountPattern withContainerIds(List<UUID> ids) {
        return new AmountPattern(amount, startDate, endDate, recurrence, ids);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects draft values as they arrive from an editor and only emits a pattern once the draft is
     * complete.
     */
    public static final class Builder {
        private Long amount;
        private LocalDate startDate;
        private LocalDate endDate;
        private RecurrencePattern recurrence;
        private final List<UUID> containerIds = new ArrayList<>();

        public Builder amount(long amount) {
            this.amount = amount;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder recurrence(RecurrencePattern recurrence) {
            this.recurrence = recurrence;
            return this;
        }

        public Builder containerId(UUID containerId) {
            this.containerIds.add(Objects.requireNonNull(containerId, "containerId"));
            return this;
        }

        public Builder containerIds(List<UUID> ids) {
            if (ids != null) {
                ids.forEach(this::containerId);
            }
            return this;
        }

        public AmountPattern build() {
            if (amount == null) {
                throw new IllegalArgumentException("amount must be provided");
            }
            if (startDate == null) {
                throw new IllegalArgumentException("start_date must be provided");
            }
            if (endDate != null && endDate.isBefore(startDate)) {
                throw new IllegalArgumentException("end_date must not be before start_date");
            }
            RecurrencePattern effective = recurrence != null ? recurrence : Once.plain();
            return new AmountPattern(amount, startDate, endDate, effective, containerIds);
        }
    }
}
