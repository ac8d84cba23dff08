package com.postpilot.scheduler.collaborator;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarMonthBillingPeriodResolverTest {

    private final CalendarMonthBillingPeriodResolver resolver = new CalendarMonthBillingPeriodResolver();

    @Test
    void periodIsTheUtcCalendarMonth() {
        BillingPeriod period = resolver.currentPeriod(UUID.randomUUID(), Instant.parse("2026-10-19T12:00:00Z"));

        assertThat(period.getId()).isEqualTo("2026-10");
        assertThat(period.getStart()).isEqualTo(OffsetDateTime.parse("2026-10-01T00:00:00Z"));
        assertThat(period.getEnd()).isEqualTo(OffsetDateTime.parse("2026-11-01T00:00:00Z"));
    }

    @Test
    void decemberRollsIntoNextYear() {
        BillingPeriod period = resolver.currentPeriod(UUID.randomUUID(), Instant.parse("2026-12-31T23:59:59Z"));

        assertThat(period.getId()).isEqualTo("2026-12");
        assertThat(period.getEnd()).isEqualTo(OffsetDateTime.parse("2027-01-01T00:00:00Z"));
    }
}
