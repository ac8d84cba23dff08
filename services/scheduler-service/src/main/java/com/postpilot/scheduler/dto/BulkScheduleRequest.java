package com.postpilot.scheduler.dto;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkScheduleRequest {
    private List<SchedulePublishRequest> jobs;
}
