package com.postpilot.scheduler.quota;

import com.postpilot.scheduler.collaborator.BillingPeriod;
import com.postpilot.scheduler.collaborator.BillingPeriodResolver;
import com.postpilot.scheduler.collaborator.TenantPlan;
import com.postpilot.scheduler.collaborator.TenantPlanSource;
import com.postpilot.scheduler.config.QuotaProperties;
import com.postpilot.scheduler.counter.CounterStore;
import com.postpilot.scheduler.counter.CounterStoreException;
import com.postpilot.scheduler.exception.CollaboratorUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per-tenant usage accounting against plan limits, one pair of counters per metric and
 * billing period: committed usage and in-flight reservations.
 *
 * <p>Checks fail closed: when the counter store or the plan is unavailable the request is
 * denied. Commit and release failures are logged and do not propagate, because the work
 * they account for has already happened.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaService {

    private static final String KEY_PREFIX = "quota:";

    private final CounterStore counterStore;
    private final TenantPlanSource planSource;
    private final BillingPeriodResolver periodResolver;
    private final QuotaProperties properties;
    private final Clock clock;

    /**
     * Reserve {@code amount} units if committed plus reserved usage stays within the limit.
     * A denied reservation is rolled back before returning.
     */
    public QuotaDecision checkAndReserve(UUID tenantId, UsageMetric metric, long amount) {
        try {
            Instant now = clock.instant();
            BillingPeriod period = periodResolver.currentPeriod(tenantId, now);
            Long limit = planSource.getPlan(tenantId).limitFor(metric);
            Duration ttl = ttl(period, now);

            String reservedKey = reservedKey(tenantId, metric, period.getId());
            long reserved = counterStore.incrementAndExpire(reservedKey, amount, ttl);
            long used = counterStore.get(usedKey(tenantId, metric, period.getId()));
            long total = used + reserved;

            if (limit != null && total > limit) {
                counterStore.decrement(reservedKey, amount);
                long current = total - amount;
                log.warn("Quota exceeded for tenant {} on {}: {} of {} used", tenantId, metric, current, limit);
                return QuotaDecision.builder()
                        .allowed(false)
                        .metric(metric)
                        .current(current)
                        .limit(limit)
                        .remaining(Math.max(0, limit - current))
                        .periodId(period.getId())
                        .periodEnd(period.getEnd())
                        .reason(QuotaDecision.EXCEEDED)
                        .build();
            }
            return QuotaDecision.builder()
                    .allowed(true)
                    .metric(metric)
                    .current(total)
                    .limit(limit)
                    .remaining(limit != null ? limit - total : null)
                    .periodId(period.getId())
                    .periodEnd(period.getEnd())
                    .build();
        } catch (CounterStoreException | CollaboratorUnavailableException e) {
            log.error("Quota reservation for tenant {} on {} denied, quota state unavailable: {}",
                    tenantId, metric, e.getMessage());
            return QuotaDecision.unavailable(metric);
        }
    }

    /**
     * Non-reserving check: would {@code amount} more units fit right now.
     */
    public QuotaDecision check(UUID tenantId, UsageMetric metric, long amount) {
        try {
            Instant now = clock.instant();
            BillingPeriod period = periodResolver.currentPeriod(tenantId, now);
            Long limit = planSource.getPlan(tenantId).limitFor(metric);
            long current = counterStore.get(usedKey(tenantId, metric, period.getId()))
                    + counterStore.get(reservedKey(tenantId, metric, period.getId()));
            boolean allowed = limit == null || current + amount <= limit;
            return QuotaDecision.builder()
                    .allowed(allowed)
                    .metric(metric)
                    .current(current)
                    .limit(limit)
                    .remaining(limit != null ? Math.max(0, limit - current) : null)
                    .periodId(period.getId())
                    .periodEnd(period.getEnd())
                    .reason(allowed ? null : QuotaDecision.EXCEEDED)
                    .build();
        } catch (CounterStoreException | CollaboratorUnavailableException e) {
            log.error("Quota check for tenant {} on {} denied, quota state unavailable: {}",
                    tenantId, metric, e.getMessage());
            return QuotaDecision.unavailable(metric);
        }
    }

    /**
     * Turn a reservation made in the current billing period into committed usage.
     */
    public void commit(UUID tenantId, UsageMetric metric, long amount) {
        commit(tenantId, metric, amount, null);
    }

    /**
     * Turn a reservation into committed usage in the period it was reserved in, even when
     * that period has since ended.
     *
     * @param periodId {@link QuotaDecision#getPeriodId()} of the reservation, or null for the
     *                 current period
     */
    public void commit(UUID tenantId, UsageMetric metric, long amount, String periodId) {
        try {
            Instant now = clock.instant();
            BillingPeriod current = periodResolver.currentPeriod(tenantId, now);
            String period = periodId != null ? periodId : current.getId();
            Duration ttl = period.equals(current.getId()) ? ttl(current, now) : properties.getPeriodRetention();
            counterStore.incrementAndExpire(usedKey(tenantId, metric, period), amount, ttl);
            counterStore.decrement(reservedKey(tenantId, metric, period), amount);
        } catch (CounterStoreException | CollaboratorUnavailableException e) {
            log.error("Failed to commit {} {} for tenant {}", amount, metric, tenantId, e);
        }
    }

    /**
     * Drop a reservation made in the current billing period whose work did not happen.
     */
    public void release(UUID tenantId, UsageMetric metric, long amount) {
        release(tenantId, metric, amount, null);
    }

    /**
     * Drop a reservation whose work did not happen, in the period it was reserved in.
     *
     * @param periodId {@link QuotaDecision#getPeriodId()} of the reservation, or null for the
     *                 current period
     */
    public void release(UUID tenantId, UsageMetric metric, long amount, String periodId) {
        try {
            String period = periodId != null
                    ? periodId
                    : periodResolver.currentPeriod(tenantId, clock.instant()).getId();
            counterStore.decrement(reservedKey(tenantId, metric, period), amount);
        } catch (CounterStoreException | CollaboratorUnavailableException e) {
            log.error("Failed to release {} {} for tenant {}", amount, metric, tenantId, e);
        }
    }

    /**
     * Reserve and commit in one call, for work that is recorded after it succeeds.
     */
    public QuotaDecision record(UUID tenantId, UsageMetric metric, long amount) {
        QuotaDecision decision = checkAndReserve(tenantId, metric, amount);
        if (decision.isAllowed()) {
            commit(tenantId, metric, amount, decision.getPeriodId());
        }
        return decision;
    }

    public UsageSummary getUsage(UUID tenantId) {
        BillingPeriod period = periodResolver.currentPeriod(tenantId, clock.instant());
        TenantPlan plan = planSource.getPlan(tenantId);

        Map<UsageMetric, Long> used = new EnumMap<>(UsageMetric.class);
        Map<UsageMetric, Long> reserved = new EnumMap<>(UsageMetric.class);
        Map<UsageMetric, Long> limits = new EnumMap<>(UsageMetric.class);
        for (UsageMetric metric : UsageMetric.values()) {
            used.put(metric, counterStore.get(usedKey(tenantId, metric, period.getId())));
            reserved.put(metric, counterStore.get(reservedKey(tenantId, metric, period.getId())));
            limits.put(metric, plan.limitFor(metric));
        }

        return UsageSummary.builder()
                .tenantId(tenantId)
                .planName(plan.getPlanName())
                .periodId(period.getId())
                .periodStart(period.getStart())
                .periodEnd(period.getEnd())
                .usageByMetric(used)
                .reservedByMetric(reserved)
                .limitsByMetric(limits)
                .build();
    }

    private Duration ttl(BillingPeriod period, Instant now) {
        Duration untilEnd = Duration.between(now, period.getEnd().toInstant());
        return (untilEnd.isNegative() ? Duration.ZERO : untilEnd).plus(properties.getPeriodRetention());
    }

    static String usedKey(UUID tenantId, UsageMetric metric, String periodId) {
        return KEY_PREFIX + tenantId + ":" + metric + ":" + periodId + ":used";
    }

    static String reservedKey(UUID tenantId, UsageMetric metric, String periodId) {
        return KEY_PREFIX + tenantId + ":" + metric + ":" + periodId + ":reserved";
    }
}
