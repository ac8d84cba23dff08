package com.postpilot.scheduler.dto;

import java.time.OffsetDateTime;

public enum RecurrenceFrequency {
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * The time {@code units} periods after {@code start}. Months are counted from the start
     * so a series on the 31st lands on the last day of shorter months without drifting.
     */
    public OffsetDateTime occurrence(OffsetDateTime start, int units) {
        return switch (this) {
            case DAILY -> start.plusDays(units);
            case WEEKLY -> start.plusWeeks(units);
            case MONTHLY -> start.plusMonths(units);
        };
    }
}
