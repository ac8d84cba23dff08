package com.postpilot.scheduler.config;

import com.postpilot.connector.model.Platform;
import com.postpilot.scheduler.ratelimit.RateLimitAlgorithm;
import com.postpilot.scheduler.ratelimit.RateLimitTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-platform publish call limits, bound from {@code postpilot.rate-limit}.
 */
@Data
@ConfigurationProperties(prefix = "postpilot.rate-limit")
public class RateLimitProperties {

    private RateLimitAlgorithm algorithm = RateLimitAlgorithm.FIXED_WINDOW;

    private Duration window = Duration.ofSeconds(60);

    /**
     * Extra lifetime of a window counter after the window closes.
     */
    private Duration grace = Duration.ofSeconds(5);

    /**
     * Calls per window for platforms without an entry in {@link #platforms}.
     */
    private int defaultMaxPerWindow = 10;

    private Map<Platform, Integer> platforms = new EnumMap<>(Platform.class);

    /**
     * Overrides of {@link RateLimitTier#getDefaultShare()}.
     */
    private Map<RateLimitTier, Double> tierShares = new EnumMap<>(RateLimitTier.class);

    public int maxPerWindow(Platform platform) {
        return platforms.getOrDefault(platform, defaultMaxPerWindow);
    }

    public double shareFor(RateLimitTier tier) {
        return tierShares.getOrDefault(tier, tier.getDefaultShare());
    }

    /**
     * Calls a tenant on {@code tier} may make to {@code platform} per window, never below one.
     */
    public int maxPerWindow(Platform platform, RateLimitTier tier) {
        return Math.max(1, (int) Math.floor(maxPerWindow(platform) * shareFor(tier)));
    }
}
