package com.postpilot.scheduler.ratelimit;

public enum RateLimitAlgorithm {
    FIXED_WINDOW,
    /**
     * Fixed window counters, with the previous window weighted by the part of it that still
     * overlaps a window ending now.
     */
    SLIDING_WINDOW
}
