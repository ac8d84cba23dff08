package com.postpilot.scheduler.quota;

import com.postpilot.scheduler.collaborator.CalendarMonthBillingPeriodResolver;
import com.postpilot.scheduler.collaborator.TenantPlan;
import com.postpilot.scheduler.collaborator.TenantPlanSource;
import com.postpilot.scheduler.config.QuotaProperties;
import com.postpilot.scheduler.counter.CounterStore;
import com.postpilot.scheduler.counter.CounterStoreException;
import com.postpilot.scheduler.counter.InMemoryCounterStore;
import com.postpilot.scheduler.exception.CollaboratorUnavailableException;
import com.postpilot.scheduler.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QuotaServiceTest {

    private static final UUID TENANT = UUID.randomUUID();

    private MutableClock clock;
    private TenantPlanSource planSource;
    private InMemoryCounterStore counters;
    private QuotaService quotaService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        planSource = mock(TenantPlanSource.class);
        when(planSource.getPlan(TENANT)).thenReturn(planWithPublishLimit(3L));
        counters = new InMemoryCounterStore(clock);
        quotaService = service(counters);
    }

    private QuotaService service(CounterStore counterStore) {
        return new QuotaService(counterStore, planSource, new CalendarMonthBillingPeriodResolver(),
                new QuotaProperties(), clock);
    }

    private static TenantPlan planWithPublishLimit(Long limit) {
        Map<UsageMetric, Long> limits = new EnumMap<>(UsageMetric.class);
        if (limit != null) {
            limits.put(UsageMetric.POSTS_PUBLISHED, limit);
        }
        return TenantPlan.builder().tenantId(TENANT).planName("pro").limits(limits).build();
    }

    @Test
    void reservationsCountAgainstTheLimitUntilReleased() {
        assertThat(quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1).getRemaining()).isEqualTo(2);
        assertThat(quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1).getRemaining()).isEqualTo(1);
        assertThat(quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1).getRemaining()).isZero();

        QuotaDecision denied = quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getReason()).isEqualTo(QuotaDecision.EXCEEDED);
        assertThat(denied.getCurrent()).isEqualTo(3);
        assertThat(denied.getLimit()).isEqualTo(3);
        assertThat(denied.getRemaining()).isZero();

        quotaService.release(TENANT, UsageMetric.POSTS_PUBLISHED, 1);

        assertThat(quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1).isAllowed()).isTrue();
    }

    @Test
    void commitMovesReservationToUsage() {
        quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
        quotaService.commit(TENANT, UsageMetric.POSTS_PUBLISHED, 1);

        UsageSummary usage = quotaService.getUsage(TENANT);

        assertThat(usage.getUsageByMetric()).containsEntry(UsageMetric.POSTS_PUBLISHED, 1L);
        assertThat(usage.getReservedByMetric()).containsEntry(UsageMetric.POSTS_PUBLISHED, 0L);
        assertThat(usage.getLimitsByMetric()).containsEntry(UsageMetric.POSTS_PUBLISHED, 3L);
        assertThat(usage.getPeriodId()).isEqualTo("2026-10");
        assertThat(usage.getPeriodEnd()).isEqualTo(OffsetDateTime.parse("2026-11-01T00:00:00Z"));
    }

    @Test
    void softCheckDoesNotReserve() {
        QuotaDecision first = quotaService.check(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
        QuotaDecision second = quotaService.check(TENANT, UsageMetric.POSTS_PUBLISHED, 1);

        assertThat(first.isAllowed()).isTrue();
        assertThat(second.getRemaining()).isEqualTo(3);
        assertThat(quotaService.getUsage(TENANT).getReservedByMetric()).containsEntry(UsageMetric.POSTS_PUBLISHED, 0L);
    }

    @Test
    void softCheckSeesInFlightReservations() {
        quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 3);

        QuotaDecision decision = quotaService.check(TENANT, UsageMetric.POSTS_PUBLISHED, 1);

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getRemaining()).isZero();
    }

    @Test
    void recordChecksAndCommits() {
        assertThat(quotaService.record(TENANT, UsageMetric.POSTS_PUBLISHED, 2).isAllowed()).isTrue();
        assertThat(quotaService.record(TENANT, UsageMetric.POSTS_PUBLISHED, 2).isAllowed()).isFalse();

        assertThat(quotaService.getUsage(TENANT).getUsageByMetric()).containsEntry(UsageMetric.POSTS_PUBLISHED, 2L);
    }

    @Test
    void unlimitedMetricIsAlwaysAllowed() {
        QuotaDecision decision = quotaService.checkAndReserve(TENANT, UsageMetric.API_CALLS, 1_000_000);

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getLimit()).isNull();
        assertThat(decision.getRemaining()).isNull();
    }

    @Test
    void tenantWithoutPlanHasNoQuota() {
        UUID stranger = UUID.randomUUID();
        when(planSource.getPlan(stranger)).thenReturn(TenantPlan.none(stranger));

        QuotaDecision decision = quotaService.checkAndReserve(stranger, UsageMetric.POSTS_PUBLISHED, 1);

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getRemaining()).isZero();
    }

    @Test
    void newBillingPeriodStartsFromZero() {
        quotaService.record(TENANT, UsageMetric.POSTS_PUBLISHED, 3);
        assertThat(quotaService.check(TENANT, UsageMetric.POSTS_PUBLISHED, 1).isAllowed()).isFalse();

        clock.set(Instant.parse("2026-11-01T00:00:01Z"));

        assertThat(quotaService.check(TENANT, UsageMetric.POSTS_PUBLISHED, 1).isAllowed()).isTrue();
    }

    @Test
    void reservationCommittedAfterRolloverCountsInItsOwnPeriod() {
        clock.set(Instant.parse("2026-10-31T23:59:59Z"));
        QuotaDecision reserved = quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
        assertThat(reserved.getPeriodId()).isEqualTo("2026-10");

        clock.advance(Duration.ofSeconds(2));
        quotaService.commit(TENANT, UsageMetric.POSTS_PUBLISHED, 1, reserved.getPeriodId());
        for (int i = 0; i < 10; i++) {
            quotaService.record(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
        }

        UsageSummary november = quotaService.getUsage(TENANT);
        assertThat(november.getPeriodId()).isEqualTo("2026-11");
        assertThat(november.getUsageByMetric()).containsEntry(UsageMetric.POSTS_PUBLISHED, 3L);
        assertThat(november.getReservedByMetric()).containsEntry(UsageMetric.POSTS_PUBLISHED, 0L);
        assertThat(counters.get(QuotaService.usedKey(TENANT, UsageMetric.POSTS_PUBLISHED, "2026-10"))).isEqualTo(1);
        assertThat(counters.get(QuotaService.reservedKey(TENANT, UsageMetric.POSTS_PUBLISHED, "2026-10"))).isZero();
    }

    @Test
    void releaseAfterRolloverDoesNotTouchTheNewPeriod() {
        clock.set(Instant.parse("2026-10-31T23:59:59Z"));
        QuotaDecision reserved = quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1);

        clock.advance(Duration.ofSeconds(2));
        quotaService.release(TENANT, UsageMetric.POSTS_PUBLISHED, 1, reserved.getPeriodId());

        assertThat(counters.get(QuotaService.reservedKey(TENANT, UsageMetric.POSTS_PUBLISHED, "2026-10"))).isZero();
        assertThat(quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 3).isAllowed()).isTrue();
        assertThat(quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1).isAllowed()).isFalse();
    }

    @Test
    void releaseWithoutReservationLeavesNoNegativeCounter() {
        quotaService.release(TENANT, UsageMetric.POSTS_PUBLISHED, 1);

        assertThat(quotaService.getUsage(TENANT).getReservedByMetric()).containsEntry(UsageMetric.POSTS_PUBLISHED, 0L);
        assertThat(quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 4).isAllowed()).isFalse();
    }

    @Test
    void counterStoreOutageFailsClosed() {
        CounterStore broken = mock(CounterStore.class);
        when(broken.incrementAndExpire(anyString(), anyLong(), any())).thenThrow(new CounterStoreException("down", null));
        when(broken.get(anyString())).thenThrow(new CounterStoreException("down", null));
        QuotaService degraded = service(broken);

        QuotaDecision reserve = degraded.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
        QuotaDecision check = degraded.check(TENANT, UsageMetric.POSTS_PUBLISHED, 1);

        assertThat(reserve.isAllowed()).isFalse();
        assertThat(reserve.getReason()).isEqualTo(QuotaDecision.UNAVAILABLE);
        assertThat(check.isAllowed()).isFalse();
    }

    @Test
    void unavailablePlanFailsClosed() {
        when(planSource.getPlan(TENANT)).thenThrow(new CollaboratorUnavailableException("down", null));

        assertThat(quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1).isAllowed()).isFalse();
    }

    @Test
    void concurrentReservationsNeverOvershootAndRemainingTracksCommits() throws Exception {
        when(planSource.getPlan(TENANT)).thenReturn(planWithPublishLimit(50L));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            boolean succeeds = i % 3 != 0;
            tasks.add(() -> {
                QuotaDecision decision = quotaService.checkAndReserve(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
                if (!decision.isAllowed()) {
                    return false;
                }
                if (succeeds) {
                    quotaService.commit(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
                    return true;
                }
                quotaService.release(TENANT, UsageMetric.POSTS_PUBLISHED, 1);
                return false;
            });
        }

        long committed = 0;
        try {
            for (Future<Boolean> result : pool.invokeAll(tasks)) {
                if (result.get()) {
                    committed++;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        UsageSummary usage = quotaService.getUsage(TENANT);
        assertThat(committed).isLessThanOrEqualTo(50);
        assertThat(usage.getUsageByMetric().get(UsageMetric.POSTS_PUBLISHED)).isEqualTo(committed);
        assertThat(usage.getReservedByMetric().get(UsageMetric.POSTS_PUBLISHED)).isZero();
        assertThat(quotaService.check(TENANT, UsageMetric.POSTS_PUBLISHED, 1).getRemaining()).isEqualTo(50 - committed);
    }
}
