package com.pocketplan.forecast.model;

public enum OccurrenceKind {
    /** A precise calendar day. */
    DATE,
    /** A whole month, positioned at its first day. */
    PERIOD
}
