package com.postpilot.scheduler.service;

import com.postpilot.connector.dto.PublishResult;
import com.postpilot.scheduler.entity.PublishJob;
import com.postpilot.scheduler.entity.PublishJobStatus;
import com.postpilot.scheduler.repository.PublishJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable publish jobs. Each transition runs in its own transaction and reports whether this
 * caller's conditional update won; a {@code false} means another worker or a cancel got
 * there first and the caller must back off.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PublishJobStore {

    private final PublishJobRepository repository;
    private final Clock clock;

    /**
     * Current time at the precision the database keeps.
     */
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Insert a new job. When a job with the same destination account and idempotency key was
     * inserted concurrently, that job is returned instead. Not transactional itself: the
     * lookup after a failed insert needs a fresh transaction.
     */
    public PublishJob create(PublishJob job) {
        job.setUpdatedAt(now());
        try {
            return repository.saveAndFlush(job);
        } catch (DataIntegrityViolationException e) {
            log.info("Publish job for account {} with key {} already exists",
                    job.getDestinationAccountId(), job.getIdempotencyKey());
            return repository.findByDestinationAccountIdAndIdempotencyKey(
                            job.getDestinationAccountId(), job.getIdempotencyKey())
                    .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<PublishJob> find(UUID jobId) {
        return repository.findById(jobId);
    }

    @Transactional(readOnly = true)
    public Optional<PublishJob> findByRequestKey(UUID destinationAccountId, String idempotencyKey) {
        return repository.findByDestinationAccountIdAndIdempotencyKey(destinationAccountId, idempotencyKey);
    }

    @Transactional(readOnly = true)
    public List<PublishJob> findForTenant(UUID tenantId, PublishJobStatus status) {
        return status == null
                ? repository.findByTenantIdOrderByScheduledAtDesc(tenantId)
                : repository.findByTenantIdAndStatusOrderByScheduledAtAsc(tenantId, status);
    }

    @Transactional(readOnly = true)
    public Map<PublishJobStatus, Long> countByStatus(UUID tenantId) {
        Map<PublishJobStatus, Long> counts = new EnumMap<>(PublishJobStatus.class);
        for (PublishJobStatus status : PublishJobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : repository.countByStatus(tenantId)) {
            counts.put((PublishJobStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Transactional(readOnly = true)
    public List<PublishJob> findDue(OffsetDateTime now, int limit) {
        return repository.findDue(PublishJobStatus.CLAIMABLE, now, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<PublishJob> findStale(OffsetDateTime cutoff, int limit) {
        return repository.findStale(cutoff, PageRequest.of(0, limit));
    }

    /**
     * SCHEDULED|RETRYING to PUBLISHING, counting the attempt. Only succeeds while the job still
     * has the attempt count the caller read, so the caller knows which attempt it owns:
     * {@code observedAttempt + 1}.
     *
     * @param quotaPeriodId billing period of the publish quota reserved for this attempt, kept
     *                      on the job so whoever finishes or reclaims the attempt settles it there
     */
    @Transactional
    public boolean claim(UUID jobId, int observedAttempt, String quotaPeriodId, OffsetDateTime now) {
        return repository.claim(jobId, observedAttempt, PublishJobStatus.CLAIMABLE, quotaPeriodId, now) == 1;
    }

    @Transactional
    public boolean markPublished(UUID jobId, int attempt, PublishResult result, OffsetDateTime now) {
        return repository.markPublished(jobId, attempt, result.getPlatformPostId(), result.getPlatformUrl(), now) == 1;
    }

    @Transactional
    public boolean markRetrying(UUID jobId, int attempt, OffsetDateTime nextAt, String error, OffsetDateTime now) {
        return repository.markRetrying(jobId, attempt, nextAt, truncate(error), now) == 1;
    }

    @Transactional
    public boolean markFailed(UUID jobId, int attempt, String error, OffsetDateTime now) {
        return repository.markFailed(jobId, attempt, truncate(error), now) == 1;
    }

    /**
     * Release a PUBLISHING lock left behind by a worker that died mid-call. The attempt it
     * made stays counted; the job fails instead when that was its last one.
     *
     * @return the status the job moved to, or empty when it is no longer stale
     */
    @Transactional
    public Optional<PublishJobStatus> reclaimStale(PublishJob job, OffsetDateTime cutoff, OffsetDateTime now) {
        String error = "Publish attempt " + job.getAttemptCount() + " did not finish before "
                + cutoff + " and was abandoned";
        if (job.getAttemptCount() >= job.getMaxAttempts()) {
            return repository.failStale(job.getId(), job.getAttemptCount(), cutoff, error, now) == 1
                    ? Optional.of(PublishJobStatus.FAILED) : Optional.empty();
        }
        return repository.reclaimStale(job.getId(), job.getAttemptCount(), cutoff, error, now) == 1
                ? Optional.of(PublishJobStatus.RETRYING) : Optional.empty();
    }

    @Transactional
    public boolean cancel(UUID jobId, OffsetDateTime now) {
        return repository.cancel(jobId, PublishJobStatus.CLAIMABLE, now) == 1;
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 2000) {
            return error;
        }
        return error.substring(0, 2000);
    }
}
