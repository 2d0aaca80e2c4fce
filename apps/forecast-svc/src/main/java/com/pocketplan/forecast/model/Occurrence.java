package com.pocketplan.forecast.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * One computed instance of an amount pattern. Never persisted.
 */
public record Occurrence(int patternIndex, LocalDate date, long amount, OccurrenceKind kind) {

    public static final Comparator<Occurrence> TIMELINE_ORDER = Comparator
            .comparing(Occurrence::date)
            .thenComparingInt(Occurrence::patternIndex);

    public Occurrence {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(kind, "kind");
    }

    public Occurrence plusAmount(long extra) {
        return new Occurrence(patternIndex, date, Math.addExact(amount, extra), kind);
    }
}
