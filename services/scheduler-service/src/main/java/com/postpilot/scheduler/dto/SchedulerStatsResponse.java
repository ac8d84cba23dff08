package com.postpilot.scheduler.dto;

import com.postpilot.scheduler.entity.PublishJobStatus;
import lombok.*;

import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatsResponse {
    private UUID tenantId;
    private Long total;
    private Map<PublishJobStatus, Long> countsByStatus;
}
