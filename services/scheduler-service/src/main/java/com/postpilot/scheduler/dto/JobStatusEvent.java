package com.postpilot.scheduler.dto;

import com.postpilot.connector.model.Platform;
import com.postpilot.scheduler.entity.PublishJobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusEvent {
    private UUID jobId;
    private UUID tenantId;
    private UUID contentPieceId;
    private UUID destinationAccountId;
    private Platform platform;
    private PublishJobStatus status;
    private Integer attemptCount;
    private String platformPostId;
    private String platformUrl;
    private String errorMessage;
    private OffsetDateTime occurredAt;
}
