package com.postpilot.scheduler.service;

import com.postpilot.scheduler.dto.JobStatusEvent;
import com.postpilot.scheduler.entity.PublishJob;
import com.postpilot.scheduler.entity.PublishJobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Announces terminal job transitions to the notification service. Delivery is best effort:
 * the job row stays the source of truth.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobStatusNotifier {

    public static final String EXCHANGE = "postpilot.publishing";
    private static final String ROUTING_KEY_PREFIX = "job.status.";

    private final RabbitTemplate rabbitTemplate;

    public void notify(PublishJob job, PublishJobStatus status, OffsetDateTime occurredAt) {
        JobStatusEvent event = JobStatusEvent.builder()
                .jobId(job.getId())
                .tenantId(job.getTenantId())
                .contentPieceId(job.getContentPieceId())
                .destinationAccountId(job.getDestinationAccountId())
                .platform(job.getPlatform())
                .status(status)
                .attemptCount(job.getAttemptCount())
                .platformPostId(job.getPlatformPostId())
                .platformUrl(job.getPlatformUrl())
                .errorMessage(job.getErrorMessage())
                .occurredAt(occurredAt)
                .build();
        try {
            rabbitTemplate.convertAndSend(EXCHANGE, ROUTING_KEY_PREFIX + status.name().toLowerCase(), event);
        } catch (AmqpException e) {
            log.warn("Failed to send {} event for job {}: {}", status, job.getId(), e.getMessage());
        }
    }
}
