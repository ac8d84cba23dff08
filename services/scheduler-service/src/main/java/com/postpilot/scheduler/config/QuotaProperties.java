package com.postpilot.scheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "postpilot.quota")
public class QuotaProperties {

    /**
     * How long usage counters outlive their billing period, for reconciliation.
     */
    private Duration periodRetention = Duration.ofDays(7);
}
