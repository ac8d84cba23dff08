package com.postpilot.scheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Dispatch loop and retry settings, bound from {@code postpilot.dispatch}.
 */
@Data
@ConfigurationProperties(prefix = "postpilot.dispatch")
public class DispatchProperties {

    /**
     * Jobs selected per scan.
     */
    private int batchSize = 100;

    /**
     * Publish calls in flight at once on this instance.
     */
    private int maxConcurrency = 8;

    /**
     * Hard timeout for one platform publish call.
     */
    private Duration publishTimeout = Duration.ofSeconds(30);

    /**
     * A job left in PUBLISHING longer than this is reclaimed by the next scan.
     * Defaults to twice the publish timeout.
     */
    private Duration staleLockTimeout;

    private int maxAttempts = 5;

    private Duration backoffBase = Duration.ofMinutes(1);

    private Duration backoffCap = Duration.ofHours(1);

    /**
     * Upper bound of the random jitter, as a fraction of the exponential delay. Kept below 1
     * so consecutive delays never shrink.
     */
    private double jitterRatio = 0.2;

    /**
     * How far in the past a requested publish time may be and still be accepted.
     */
    private Duration scheduleGrace = Duration.ofMinutes(1);

    public Duration getStaleLockTimeout() {
        return staleLockTimeout != null ? staleLockTimeout : publishTimeout.multipliedBy(2);
    }
}
