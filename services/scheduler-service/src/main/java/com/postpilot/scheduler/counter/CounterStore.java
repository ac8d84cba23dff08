package com.postpilot.scheduler.counter;

import java.time.Duration;

/**
 * Shared atomic counters with per-key expiry. Rate limit windows and usage counters both
 * live here under disjoint key prefixes ({@code ratelimit:} and {@code quota:}).
 *
 * <p>Every method throws {@link CounterStoreException} when the backing store cannot be
 * reached.
 */
public interface CounterStore {

    /**
     * Atomically add {@code delta} to the counter and return the new value. A counter that
     * does not exist yet starts at zero and expires after {@code ttl}; an existing counter
     * keeps its expiry.
     */
    long incrementAndExpire(String key, long delta, Duration ttl);

    /**
     * Atomically subtract {@code delta} from an existing counter and return the new value.
     * A counter that does not exist or has expired is left absent and zero is returned, so a
     * late decrement can never create a key without an expiry.
     */
    long decrement(String key, long delta);

    /**
     * Current value, zero when the counter does not exist or has expired.
     */
    long get(String key);
}
