package com.postpilot.scheduler.quota;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Outcome of a quota check. {@code limit} and {@code remaining} are null for an unlimited
 * metric.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaDecision {

    public static final String EXCEEDED = "QUOTA_EXCEEDED";
    public static final String UNAVAILABLE = "QUOTA_UNAVAILABLE";

    private boolean allowed;
    private UsageMetric metric;
    /** Committed plus reserved usage, excluding the amount asked for when denied. */
    private long current;
    private Long limit;
    private Long remaining;
    private String periodId;
    private OffsetDateTime periodEnd;
    /** Set when denied. */
    private String reason;

    static QuotaDecision unavailable(UsageMetric metric) {
        return QuotaDecision.builder()
                .allowed(false)
                .metric(metric)
                .remaining(0L)
                .reason(UNAVAILABLE)
                .build();
    }
}
