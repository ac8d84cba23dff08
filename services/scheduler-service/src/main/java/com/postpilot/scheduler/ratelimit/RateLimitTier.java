package com.postpilot.scheduler.ratelimit;

/**
 * Share of a platform's call budget a tenant on this tier may use.
 */
public enum RateLimitTier {
    FREE(0.2),
    PRO(0.5),
    ENTERPRISE(1.0);

    private final double defaultShare;

    RateLimitTier(double defaultShare) {
        this.defaultShare = defaultShare;
    }

    public double getDefaultShare() {
        return defaultShare;
    }
}
