package com.postpilot.scheduler.collaborator;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Every tenant bills on UTC calendar months, identified as {@code yyyy-MM}.
 */
@Component
public class CalendarMonthBillingPeriodResolver implements BillingPeriodResolver {

    private static final DateTimeFormatter PERIOD_ID = DateTimeFormatter.ofPattern("yyyy-MM");

    @Override
    public BillingPeriod currentPeriod(UUID tenantId, Instant now) {
        YearMonth month = YearMonth.from(now.atOffset(ZoneOffset.UTC));
        OffsetDateTime start = month.atDay(1).atStartOfDay().atOffset(ZoneOffset.UTC);
        return BillingPeriod.builder()
                .id(month.format(PERIOD_ID))
                .start(start)
                .end(start.plusMonths(1))
                .build();
    }
}
