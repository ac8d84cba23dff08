package com.postpilot.scheduler.counter;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-process counter store for local runs and tests. Counters are not shared between
 * instances.
 */
@Component
@ConditionalOnProperty(name = "postpilot.counter-store.type", havingValue = "memory")
public class InMemoryCounterStore implements CounterStore {

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long incrementAndExpire(String key, long delta, Duration ttl) {
        Instant now = clock.instant();
        return counters.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return new Counter(delta, now.plus(ttl));
            }
            return new Counter(existing.value() + delta, existing.expiresAt());
        }).value();
    }

    @Override
    public long decrement(String key, long delta) {
        Instant now = clock.instant();
        Counter updated = counters.computeIfPresent(key, (k, existing) -> existing.isExpired(now)
                ? null
                : new Counter(existing.value() - delta, existing.expiresAt()));
        return updated != null ? updated.value() : 0L;
    }

    @Override
    public long get(String key) {
        Counter counter = counters.get(key);
        if (counter == null || counter.isExpired(clock.instant())) {
            return 0L;
        }
        return counter.value();
    }

    private record Counter(long value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
