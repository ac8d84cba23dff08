package com.postpilot.scheduler.counter;

import com.postpilot.scheduler.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCounterStoreTest {

    private MutableClock clock;
    private InMemoryCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        store = new InMemoryCounterStore(clock);
    }

    @Test
    void incrementsFromZero() {
        assertThat(store.get("k")).isZero();
        assertThat(store.incrementAndExpire("k", 1, Duration.ofMinutes(1))).isEqualTo(1);
        assertThat(store.incrementAndExpire("k", 2, Duration.ofMinutes(1))).isEqualTo(3);
        assertThat(store.get("k")).isEqualTo(3);
    }

    @Test
    void expiryIsSetByFirstIncrementOnly() {
        store.incrementAndExpire("k", 1, Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(50));
        store.incrementAndExpire("k", 1, Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(10));

        assertThat(store.get("k")).isZero();
        assertThat(store.incrementAndExpire("k", 1, Duration.ofSeconds(60))).isEqualTo(1);
    }

    @Test
    void decrementKeepsExpiry() {
        store.incrementAndExpire("k", 5, Duration.ofSeconds(60));
        assertThat(store.decrement("k", 2)).isEqualTo(3);

        clock.advance(Duration.ofSeconds(60));

        assertThat(store.get("k")).isZero();
    }

    @Test
    void decrementOfMissingCounterDoesNotCreateIt() {
        assertThat(store.decrement("k", 1)).isZero();
        assertThat(store.get("k")).isZero();

        assertThat(store.incrementAndExpire("k", 1, Duration.ofSeconds(60))).isEqualTo(1);
    }

    @Test
    void decrementOfExpiredCounterDropsIt() {
        store.incrementAndExpire("k", 3, Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(60));

        assertThat(store.decrement("k", 1)).isZero();
        assertThat(store.incrementAndExpire("k", 1, Duration.ofSeconds(60))).isEqualTo(1);
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Long>> tasks = new ArrayList<>();
            for (int i = 0; i < 1000; i++) {
                tasks.add(() -> store.incrementAndExpire("k", 1, Duration.ofMinutes(1)));
            }
            for (Future<Long> future : pool.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get("k")).isEqualTo(1000);
    }
}
