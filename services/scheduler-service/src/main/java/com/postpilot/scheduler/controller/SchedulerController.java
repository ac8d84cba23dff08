package com.postpilot.scheduler.controller;

import com.postpilot.scheduler.dto.BulkScheduleRequest;
import com.postpilot.scheduler.dto.PublishJobResponse;
import com.postpilot.scheduler.dto.RecurringScheduleRequest;
import com.postpilot.scheduler.dto.SchedulePublishRequest;
import com.postpilot.scheduler.dto.SchedulerStatsResponse;
import com.postpilot.scheduler.entity.PublishJobStatus;
import com.postpilot.scheduler.service.PublishJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final PublishJobService publishJobService;

    @PostMapping("/jobs")
    public ResponseEntity<PublishJobResponse> schedulePublish(
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @RequestHeader(value = "X-Tenant-Id", required = false) UUID tenantId,
            @RequestBody SchedulePublishRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(publishJobService.schedulePublish(
                        request.getContentPieceId(),
                        request.getDestinationAccountId(),
                        request.getScheduledAt(),
                        idempotencyKey,
                        tenantId));
    }

    @PostMapping("/jobs/bulk")
    public ResponseEntity<List<PublishJobResponse>> scheduleBulk(
            @RequestHeader(value = "X-Tenant-Id", required = false) UUID tenantId,
            @RequestBody BulkScheduleRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(publishJobService.schedulePublishBulk(request.getJobs(), tenantId));
    }

    @PostMapping("/jobs/recurring")
    public ResponseEntity<List<PublishJobResponse>> scheduleRecurring(
            @RequestHeader(value = "X-Tenant-Id", required = false) UUID tenantId,
            @RequestBody RecurringScheduleRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(publishJobService.scheduleRecurring(request, tenantId));
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<PublishJobResponse>> listJobs(
            @RequestHeader("X-Tenant-Id") UUID tenantId,
            @RequestParam(required = false) PublishJobStatus status
    ) {
        return ResponseEntity.ok(publishJobService.listJobs(tenantId, status));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<PublishJobResponse> getJob(
            @RequestHeader(value = "X-Tenant-Id", required = false) UUID tenantId,
            @PathVariable UUID jobId
    ) {
        return ResponseEntity.ok(publishJobService.getJobStatus(jobId, tenantId));
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<Void> cancelJob(
            @RequestHeader(value = "X-Tenant-Id", required = false) UUID tenantId,
            @PathVariable UUID jobId
    ) {
        publishJobService.cancelPublish(jobId, tenantId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public ResponseEntity<SchedulerStatsResponse> getStats(
            @RequestHeader("X-Tenant-Id") UUID tenantId
    ) {
        return ResponseEntity.ok(publishJobService.getStats(tenantId));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Scheduler Service is healthy");
    }
}
