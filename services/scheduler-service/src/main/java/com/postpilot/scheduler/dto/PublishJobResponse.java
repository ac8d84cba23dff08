package com.postpilot.scheduler.dto;

import com.postpilot.connector.model.Platform;
import com.postpilot.scheduler.entity.PublishJobStatus;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishJobResponse {
    private UUID id;
    private UUID tenantId;
    private UUID contentPieceId;
    private UUID destinationAccountId;
    private Platform platform;
    private PublishJobStatus status;
    private OffsetDateTime scheduledAt;
    private OffsetDateTime originalScheduledAt;
    private OffsetDateTime publishedAt;
    private Integer attemptCount;
    private Integer maxAttempts;
    private OffsetDateTime lastAttemptAt;
    private String idempotencyKey;
    private String platformPostId;
    private String platformUrl;
    private String errorMessage;
    private OffsetDateTime createdAt;
    private OffsetDateTime cancelledAt;
}
