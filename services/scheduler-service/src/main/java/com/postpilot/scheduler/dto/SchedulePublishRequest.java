package com.postpilot.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulePublishRequest {
    private UUID contentPieceId;
    private UUID destinationAccountId;
    private OffsetDateTime scheduledAt;
}
