package com.postpilot.scheduler.repository;

import com.postpilot.scheduler.entity.PublishJob;
import com.postpilot.scheduler.entity.PublishJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every state change is a conditional update: it only applies while the row is still in the
 * state the caller observed, and the returned row count tells the caller whether it won.
 */
public interface PublishJobRepository extends JpaRepository<PublishJob, UUID> {

    @Query("SELECT j FROM PublishJob j WHERE j.status IN :statuses AND j.scheduledAt <= :now ORDER BY j.scheduledAt ASC")
    List<PublishJob> findDue(@Param("statuses") Collection<PublishJobStatus> statuses,
                             @Param("now") OffsetDateTime now,
                             Pageable pageable);

    @Query("SELECT j FROM PublishJob j WHERE j.status = com.postpilot.scheduler.entity.PublishJobStatus.PUBLISHING AND j.lastAttemptAt < :cutoff")
    List<PublishJob> findStale(@Param("cutoff") OffsetDateTime cutoff, Pageable pageable);

    Optional<PublishJob> findByDestinationAccountIdAndIdempotencyKey(UUID destinationAccountId, String idempotencyKey);

    List<PublishJob> findByTenantIdOrderByScheduledAtDesc(UUID tenantId);

    List<PublishJob> findByTenantIdAndStatusOrderByScheduledAtAsc(UUID tenantId, PublishJobStatus status);

    @Query("SELECT j.status, COUNT(j) FROM PublishJob j WHERE j.tenantId = :tenantId GROUP BY j.status")
    List<Object[]> countByStatus(@Param("tenantId") UUID tenantId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PublishJob j SET j.status = com.postpilot.scheduler.entity.PublishJobStatus.PUBLISHING, " +
            "j.attemptCount = j.attemptCount + 1, j.lastAttemptAt = :now, j.updatedAt = :now, " +
            "j.firstAttemptAt = COALESCE(j.firstAttemptAt, :now), j.quotaPeriodId = :periodId " +
            "WHERE j.id = :id AND j.status IN :statuses AND j.attemptCount = :attempt " +
            "AND j.attemptCount < j.maxAttempts AND j.scheduledAt <= :now")
    int claim(@Param("id") UUID id,
              @Param("attempt") int observedAttempt,
              @Param("statuses") Collection<PublishJobStatus> statuses,
              @Param("periodId") String quotaPeriodId,
              @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PublishJob j SET j.status = com.postpilot.scheduler.entity.PublishJobStatus.PUBLISHED, " +
            "j.platformPostId = :postId, j.platformUrl = :url, j.publishedAt = :now, j.errorMessage = NULL, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.postpilot.scheduler.entity.PublishJobStatus.PUBLISHING AND j.attemptCount = :attempt")
    int markPublished(@Param("id") UUID id,
                      @Param("attempt") int attempt,
                      @Param("postId") String postId,
                      @Param("url") String url,
                      @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PublishJob j SET j.status = com.postpilot.scheduler.entity.PublishJobStatus.RETRYING, " +
            "j.scheduledAt = :nextAt, j.errorMessage = :error, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.postpilot.scheduler.entity.PublishJobStatus.PUBLISHING AND j.attemptCount = :attempt")
    int markRetrying(@Param("id") UUID id,
                     @Param("attempt") int attempt,
                     @Param("nextAt") OffsetDateTime nextAt,
                     @Param("error") String error,
                     @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PublishJob j SET j.status = com.postpilot.scheduler.entity.PublishJobStatus.FAILED, " +
            "j.errorMessage = :error, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.postpilot.scheduler.entity.PublishJobStatus.PUBLISHING AND j.attemptCount = :attempt")
    int markFailed(@Param("id") UUID id,
                   @Param("attempt") int attempt,
                   @Param("error") String error,
                   @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PublishJob j SET j.status = com.postpilot.scheduler.entity.PublishJobStatus.RETRYING, " +
            "j.errorMessage = :error, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.postpilot.scheduler.entity.PublishJobStatus.PUBLISHING " +
            "AND j.attemptCount = :attempt AND j.lastAttemptAt < :cutoff")
    int reclaimStale(@Param("id") UUID id,
                     @Param("attempt") int attempt,
                     @Param("cutoff") OffsetDateTime cutoff,
                     @Param("error") String error,
                     @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PublishJob j SET j.status = com.postpilot.scheduler.entity.PublishJobStatus.FAILED, " +
            "j.errorMessage = :error, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.postpilot.scheduler.entity.PublishJobStatus.PUBLISHING " +
            "AND j.attemptCount = :attempt AND j.lastAttemptAt < :cutoff")
    int failStale(@Param("id") UUID id,
                  @Param("attempt") int attempt,
                  @Param("cutoff") OffsetDateTime cutoff,
                  @Param("error") String error,
                  @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PublishJob j SET j.status = com.postpilot.scheduler.entity.PublishJobStatus.CANCELLED, " +
            "j.cancelledAt = :now, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status IN :statuses")
    int cancel(@Param("id") UUID id,
               @Param("statuses") Collection<PublishJobStatus> statuses,
               @Param("now") OffsetDateTime now);
}
