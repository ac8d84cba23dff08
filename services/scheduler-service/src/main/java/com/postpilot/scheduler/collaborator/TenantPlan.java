package com.postpilot.scheduler.collaborator;

import com.postpilot.scheduler.quota.UsageMetric;
import com.postpilot.scheduler.ratelimit.RateLimitTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Limits of a tenant's subscription plan. A metric without an entry in {@link #limits} is
 * unlimited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantPlan {

    private UUID tenantId;
    private String planName;

    @Builder.Default
    private Map<UsageMetric, Long> limits = new EnumMap<>(UsageMetric.class);

    @Builder.Default
    private RateLimitTier rateLimitTier = RateLimitTier.FREE;

    /**
     * @return the limit for {@code metric}, or {@code null} when the plan does not cap it
     */
    public Long limitFor(UsageMetric metric) {
        return limits != null ? limits.get(metric) : null;
    }

    /**
     * Plan used for tenants without a subscription: every metric capped at zero.
     */
    public static TenantPlan none(UUID tenantId) {
        Map<UsageMetric, Long> zero = new EnumMap<>(UsageMetric.class);
        for (UsageMetric metric : UsageMetric.values()) {
            zero.put(metric, 0L);
        }
        return TenantPlan.builder()
                .tenantId(tenantId)
                .planName("NONE")
                .limits(zero)
                .rateLimitTier(RateLimitTier.FREE)
                .build();
    }
}
