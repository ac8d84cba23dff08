package com.postpilot.scheduler.quota;

public enum UsageMetric {
    POSTS_PUBLISHED,
    POSTS_GENERATED,
    STRATEGIES_GENERATED,
    API_CALLS,
    ANALYTICS_REQUESTS
}
