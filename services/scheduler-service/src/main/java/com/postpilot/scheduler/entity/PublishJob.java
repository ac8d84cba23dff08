package com.postpilot.scheduler.entity;

import com.postpilot.connector.model.Platform;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "publish_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uk_publish_jobs_account_idempotency",
                columnNames = {"destination_account_id", "idempotency_key"}),
        indexes = {
                @Index(name = "idx_publish_jobs_status_scheduled", columnList = "status, scheduled_at"),
                @Index(name = "idx_publish_jobs_tenant", columnList = "tenant_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "content_piece_id", nullable = false)
    private UUID contentPieceId;

    @Column(name = "destination_account_id", nullable = false)
    private UUID destinationAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private Platform platform;

    /**
     * Next time the job is eligible for dispatch. Moved forward by retry backoff.
     */
    @Column(name = "scheduled_at", nullable = false)
    private OffsetDateTime scheduledAt;

    @Column(name = "original_scheduled_at", nullable = false)
    private OffsetDateTime originalScheduledAt;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PublishJobStatus status = PublishJobStatus.SCHEDULED;

    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    @Column(name = "max_attempts", nullable = false)
    @Builder.Default
    private Integer maxAttempts = 5;

    @Column(name = "last_attempt_at")
    private OffsetDateTime lastAttemptAt;

    @Column(name = "first_attempt_at")
    private OffsetDateTime firstAttemptAt;

    // billing period the current attempt reserved publish quota in
    @Column(name = "quota_period_id", length = 32)
    private String quotaPeriodId;

    // sent to the platform on every attempt, never regenerated
    @Column(name = "idempotency_key", nullable = false, updatable = false, length = 100)
    private String idempotencyKey;

    @Column(name = "platform_post_id")
    private String platformPostId;

    @Column(name = "platform_url", length = 500)
    private String platformUrl;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;
}
