package com.postpilot.scheduler.ratelimit;

import com.postpilot.connector.model.Platform;
import com.postpilot.scheduler.collaborator.TenantPlanSource;
import com.postpilot.scheduler.config.RateLimitProperties;
import com.postpilot.scheduler.counter.CounterStore;
import com.postpilot.scheduler.counter.CounterStoreException;
import com.postpilot.scheduler.exception.CollaboratorUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Caps publish calls per (tenant, platform) over a time window.
 *
 * <p>Every {@link #admit} counts, admitted or not; a denied call is never rolled back, so a
 * burst of denials keeps the window closed until it rolls over. When the counter store is
 * unreachable calls are admitted, since the platforms enforce their own limits and a lost
 * publish is worse than a throttled one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimiter {

    private static final String KEY_PREFIX = "ratelimit:";

    private final CounterStore counterStore;
    private final TenantPlanSource planSource;
    private final RateLimitProperties properties;
    private final Clock clock;

    public boolean admit(UUID tenantId, Platform platform) {
        int max = properties.maxPerWindow(platform, tierOf(tenantId));
        long windowMillis = properties.getWindow().toMillis();
        long nowMillis = clock.millis();
        long windowStart = nowMillis - Math.floorMod(nowMillis, windowMillis);

        try {
            boolean admitted = switch (properties.getAlgorithm()) {
                case FIXED_WINDOW -> admitFixed(tenantId, platform, windowStart, max);
                case SLIDING_WINDOW -> admitSliding(tenantId, platform, windowStart, nowMillis, windowMillis, max);
            };
            if (!admitted) {
                log.debug("Rate limit reached for tenant {} on {} ({} per {})",
                        tenantId, platform, max, properties.getWindow());
            }
            return admitted;
        } catch (CounterStoreException e) {
            log.warn("Counter store unavailable, admitting {} call for tenant {}: {}",
                    platform, tenantId, e.getMessage());
            return true;
        }
    }

    private boolean admitFixed(UUID tenantId, Platform platform, long windowStart, int max) {
        Duration ttl = properties.getWindow().plus(properties.getGrace());
        long count = counterStore.incrementAndExpire(key(tenantId, platform, windowStart), 1, ttl);
        return count <= max;
    }

    private boolean admitSliding(UUID tenantId, Platform platform, long windowStart, long nowMillis,
                                 long windowMillis, int max) {
        // the current counter is read again as "previous" during the next window
        Duration ttl = properties.getWindow().multipliedBy(2).plus(properties.getGrace());
        long current = counterStore.incrementAndExpire(key(tenantId, platform, windowStart), 1, ttl);
        long previous = counterStore.get(key(tenantId, platform, windowStart - windowMillis));
        double elapsed = (double) (nowMillis - windowStart) / windowMillis;
        double estimate = previous * (1.0 - elapsed) + current;
        return estimate <= max;
    }

    private RateLimitTier tierOf(UUID tenantId) {
        try {
            RateLimitTier tier = planSource.getPlan(tenantId).getRateLimitTier();
            return tier != null ? tier : RateLimitTier.FREE;
        } catch (CollaboratorUnavailableException e) {
            log.warn("Plan unavailable for tenant {}, using {} rate limits", tenantId, RateLimitTier.FREE);
            return RateLimitTier.FREE;
        }
    }

    static String key(UUID tenantId, Platform platform, long windowStartMillis) {
        return KEY_PREFIX + tenantId + ":" + platform + ":" + windowStartMillis;
    }
}
