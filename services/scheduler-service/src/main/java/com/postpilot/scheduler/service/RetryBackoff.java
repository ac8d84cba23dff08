package com.postpilot.scheduler.service;

import com.postpilot.scheduler.config.DispatchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with bounded jitter: {@code base * 2^(attempt-1)}, plus up to
 * {@code jitterRatio} of that, capped. Because the jitter is less than the delay itself the
 * delay never shrinks from one attempt to the next.
 */
@Component
public class RetryBackoff {

    private static final double MAX_JITTER_RATIO = 0.99;

    private final DispatchProperties properties;
    private final DoubleSupplier random;

    @Autowired
    public RetryBackoff(DispatchProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryBackoff(DispatchProperties properties, DoubleSupplier random) {
        this.properties = properties;
        this.random = random;
    }

    /**
     * @param attemptCount attempts made so far, at least 1
     */
    public Duration delayFor(int attemptCount) {
        long baseMillis = properties.getBackoffBase().toMillis();
        long capMillis = properties.getBackoffCap().toMillis();
        int exponent = Math.min(Math.max(attemptCount, 1) - 1, 30);

        long exponential = baseMillis << exponent;
        if (exponential <= 0 || exponential > capMillis) {
            return Duration.ofMillis(capMillis);
        }
        double ratio = Math.min(Math.max(properties.getJitterRatio(), 0.0), MAX_JITTER_RATIO);
        long jitter = (long) (exponential * ratio * random.getAsDouble());
        return Duration.ofMillis(Math.min(capMillis, exponential + jitter));
    }
}
