package com.postpilot.scheduler.ratelimit;

import com.postpilot.connector.model.Platform;
import com.postpilot.scheduler.collaborator.TenantPlan;
import com.postpilot.scheduler.collaborator.TenantPlanSource;
import com.postpilot.scheduler.config.RateLimitProperties;
import com.postpilot.scheduler.counter.CounterStore;
import com.postpilot.scheduler.counter.CounterStoreException;
import com.postpilot.scheduler.counter.InMemoryCounterStore;
import com.postpilot.scheduler.exception.CollaboratorUnavailableException;
import com.postpilot.scheduler.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateLimiterTest {

    private static final UUID TENANT = UUID.randomUUID();

    private MutableClock clock;
    private TenantPlanSource planSource;
    private RateLimitProperties properties;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        // window boundary aligned start
        clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        planSource = mock(TenantPlanSource.class);
        when(planSource.getPlan(TENANT)).thenReturn(plan(RateLimitTier.ENTERPRISE));

        properties = new RateLimitProperties();
        properties.setWindow(Duration.ofSeconds(60));
        properties.getPlatforms().put(Platform.TWITTER, 5);

        rateLimiter = new RateLimiter(new InMemoryCounterStore(clock), planSource, properties, clock);
    }

    private static TenantPlan plan(RateLimitTier tier) {
        return TenantPlan.builder().tenantId(TENANT).planName("test").rateLimitTier(tier).build();
    }

    @Test
    void admitsExactlyMaxCallsPerWindow() {
        for (int i = 0; i < 5; i++) {
            assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).as("call %d", i + 1).isTrue();
        }
        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isFalse();
    }

    @Test
    void nextWindowStartsFresh() {
        for (int i = 0; i < 6; i++) {
            rateLimiter.admit(TENANT, Platform.TWITTER);
        }

        clock.advance(Duration.ofSeconds(60));

        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isTrue();
    }

    @Test
    void platformsAndTenantsHaveSeparateWindows() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.admit(TENANT, Platform.TWITTER);
        }
        UUID other = UUID.randomUUID();
        when(planSource.getPlan(other)).thenReturn(plan(RateLimitTier.ENTERPRISE));

        assertThat(rateLimiter.admit(TENANT, Platform.REDDIT)).isTrue();
        assertThat(rateLimiter.admit(other, Platform.TWITTER)).isTrue();
    }

    @Test
    void tierScalesThePlatformMaximum() {
        properties.getPlatforms().put(Platform.TWITTER, 50);
        when(planSource.getPlan(TENANT)).thenReturn(plan(RateLimitTier.FREE));

        int admitted = 0;
        for (int i = 0; i < 50; i++) {
            if (rateLimiter.admit(TENANT, Platform.TWITTER)) {
                admitted++;
            }
        }

        assertThat(admitted).isEqualTo(10);
    }

    @Test
    void tinyShareStillAdmitsOneCall() {
        properties.getPlatforms().put(Platform.TWITTER, 2);
        when(planSource.getPlan(TENANT)).thenReturn(plan(RateLimitTier.FREE));

        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isTrue();
        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isFalse();
    }

    @Test
    void unavailablePlanFallsBackToFreeTier() {
        properties.getPlatforms().put(Platform.TWITTER, 10);
        when(planSource.getPlan(TENANT)).thenThrow(new CollaboratorUnavailableException("down", null));

        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isTrue();
        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isTrue();
        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isFalse();
    }

    @Test
    void slidingWindowCountsPartOfThePreviousWindow() {
        properties.setAlgorithm(RateLimitAlgorithm.SLIDING_WINDOW);
        for (int i = 0; i < 4; i++) {
            assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isTrue();
        }

        // halfway through the next window: estimate = 4 * 0.5 + current
        clock.advance(Duration.ofSeconds(90));

        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isTrue();  // 2 + 1
        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isTrue();  // 2 + 2
        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isTrue();  // 2 + 3
        assertThat(rateLimiter.admit(TENANT, Platform.TWITTER)).isFalse(); // 2 + 4
    }

    @Test
    void counterStoreOutageFailsOpen() {
        CounterStore broken = mock(CounterStore.class);
        when(broken.incrementAndExpire(anyString(), anyLong(), any()))
                .thenThrow(new CounterStoreException("down", null));
        RateLimiter limiter = new RateLimiter(broken, planSource, properties, clock);

        for (int i = 0; i < 10; i++) {
            assertThat(limiter.admit(TENANT, Platform.TWITTER)).isTrue();
        }
    }
}
