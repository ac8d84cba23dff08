package com.postpilot.connector.dto;

import com.postpilot.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {
    private UUID jobId;
    private UUID tenantId;
    private Platform platform;

    // Destination
    private UUID destinationAccountId;
    private String externalAccountId;
    private String handle;

    // Content
    private String title;
    private String body;
    private List<String> hashtags;
    private List<String> mediaUrls;

    // Same value on every attempt of the job
    private String idempotencyKey;

    // 1 on the job's first try
    @Builder.Default
    private int attempt = 1;

    // When the job's first attempt started, null if unknown
    private Instant firstAttemptAt;

    @Builder.Default
    private Duration timeout = Duration.ofSeconds(30);

    public boolean isRetry() {
        return attempt > 1;
    }
}
