package com.postpilot.scheduler.quota;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageSummary {
    private UUID tenantId;
    private String planName;
    private String periodId;
    private OffsetDateTime periodStart;
    private OffsetDateTime periodEnd;
    private Map<UsageMetric, Long> usageByMetric;
    private Map<UsageMetric, Long> reservedByMetric;
    /** Null value for an unlimited metric. */
    private Map<UsageMetric, Long> limitsByMetric;
}
