package com.postpilot.scheduler.service;

import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.publisher.PlatformPublishers;
import com.postpilot.scheduler.collaborator.ContentPiece;
import com.postpilot.scheduler.collaborator.ContentSource;
import com.postpilot.scheduler.collaborator.DestinationAccount;
import com.postpilot.scheduler.collaborator.DestinationAccountSource;
import com.postpilot.scheduler.config.DispatchProperties;
import com.postpilot.scheduler.entity.PublishJob;
import com.postpilot.scheduler.entity.PublishJobStatus;
import com.postpilot.scheduler.quota.QuotaDecision;
import com.postpilot.scheduler.quota.QuotaService;
import com.postpilot.scheduler.quota.UsageMetric;
import com.postpilot.scheduler.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Periodically moves due jobs into publishing.
 *
 * <p>A job is handed to the worker pool only after the rate limiter admitted it, publish quota
 * was reserved and this instance won the claim. Losing any of those leaves the job for a
 * later scan without counting an attempt. Several instances may scan the same table; the
 * claim is what keeps a job from being published twice.
 */
@Component
@Slf4j
public class DispatchLoop {

    private final PublishJobStore store;
    private final RateLimiter rateLimiter;
    private final QuotaService quotaService;
    private final ContentSource contentSource;
    private final DestinationAccountSource accountSource;
    private final PlatformPublishers publishers;
    private final RetryBackoff backoff;
    private final JobStatusNotifier notifier;
    private final DispatchProperties properties;
    private final Executor publishExecutor;
    private final Semaphore slots;

    public DispatchLoop(PublishJobStore store,
                        RateLimiter rateLimiter,
                        QuotaService quotaService,
                        ContentSource contentSource,
                        DestinationAccountSource accountSource,
                        PlatformPublishers publishers,
                        RetryBackoff backoff,
                        JobStatusNotifier notifier,
                        DispatchProperties properties,
                        @Qualifier("publishExecutor") Executor publishExecutor) {
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.quotaService = quotaService;
        this.contentSource = contentSource;
        this.accountSource = accountSource;
        this.publishers = publishers;
        this.backoff = backoff;
        this.notifier = notifier;
        this.properties = properties;
        this.publishExecutor = publishExecutor;
        this.slots = new Semaphore(properties.getMaxConcurrency());
    }

    @Scheduled(fixedDelayString = "${postpilot.dispatch.scan-interval-ms:10000}")
    public void scheduledScan() {
        try {
            int dispatched = runScan();
            if (dispatched > 0) {
                log.info("Dispatched {} publish jobs", dispatched);
            }
        } catch (Exception e) {
            log.error("Dispatch scan failed", e);
        }
    }

    /**
     * One scan: reclaim stale locks, then hand due jobs to the worker pool until the batch is
     * exhausted or every publish slot is taken.
     *
     * @return number of jobs handed to the worker pool
     */
    public int runScan() {
        OffsetDateTime now = store.now();
        reclaimStale(now);

        List<PublishJob> due = store.findDue(now, properties.getBatchSize());
        int dispatched = 0;
        for (PublishJob job : due) {
            if (!slots.tryAcquire()) {
                log.debug("All {} publish slots busy, leaving remaining jobs for the next scan",
                        properties.getMaxConcurrency());
                break;
            }
            boolean handedOff = false;
            try {
                handedOff = dispatch(job, now);
                if (handedOff) {
                    dispatched++;
                }
            } catch (Exception e) {
                log.error("Failed to dispatch job {}", job.getId(), e);
            } finally {
                if (!handedOff) {
                    slots.release();
                }
            }
        }
        return dispatched;
    }

    private boolean dispatch(PublishJob job, OffsetDateTime now) {
        if (!rateLimiter.admit(job.getTenantId(), job.getPlatform())) {
            log.debug("Job {} deferred, {} rate limit reached for tenant {}",
                    job.getId(), job.getPlatform(), job.getTenantId());
            return false;
        }

        QuotaDecision quota = quotaService.checkAndReserve(job.getTenantId(), UsageMetric.POSTS_PUBLISHED, 1);
        if (!quota.isAllowed()) {
            log.warn("Job {} deferred, publish quota denied for tenant {} ({})",
                    job.getId(), job.getTenantId(), quota.getReason());
            return false;
        }

        boolean claimed;
        try {
            claimed = store.claim(job.getId(), job.getAttemptCount(), quota.getPeriodId(), now);
        } catch (RuntimeException e) {
            quotaService.release(job.getTenantId(), UsageMetric.POSTS_PUBLISHED, 1, quota.getPeriodId());
            throw e;
        }
        if (!claimed) {
            quotaService.release(job.getTenantId(), UsageMetric.POSTS_PUBLISHED, 1, quota.getPeriodId());
            log.debug("Job {} claimed elsewhere", job.getId());
            return false;
        }

        int attempt = job.getAttemptCount() + 1;
        job.setAttemptCount(attempt);
        job.setStatus(PublishJobStatus.PUBLISHING);
        job.setLastAttemptAt(now);
        job.setQuotaPeriodId(quota.getPeriodId());
        if (job.getFirstAttemptAt() == null) {
            job.setFirstAttemptAt(now);
        }
        log.info("Publishing job {} to {} (attempt {}/{})",
                job.getId(), job.getPlatform(), attempt, job.getMaxAttempts());
        try {
            publishExecutor.execute(() -> publishClaimed(job, attempt));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected job {}", job.getId());
            apply(job, attempt, PublishResult.retryable(job.getPlatform(), "WORKER_REJECTED",
                    "Publish worker pool was full"));
            return false;
        }
    }

    void publishClaimed(PublishJob job, int attempt) {
        try {
            PublishResult result;
            try {
                result = publish(job, attempt);
            } catch (Exception e) {
                log.error("Unexpected error publishing job {}", job.getId(), e);
                result = PublishResult.retryable(job.getPlatform(), "INTERNAL_ERROR", e.getMessage());
            }
            apply(job, attempt, result);
        } finally {
            slots.release();
        }
    }

    private PublishResult publish(PublishJob job, int attempt) {
        Optional<ContentPiece> content = contentSource.getContent(job.getContentPieceId());
        if (content.isEmpty()) {
            return PublishResult.permanent(job.getPlatform(), "CONTENT_NOT_FOUND",
                    "Content piece " + job.getContentPieceId() + " no longer exists");
        }
        Optional<DestinationAccount> account = accountSource.getAccount(job.getDestinationAccountId());
        if (account.isEmpty() || !account.get().isValid()) {
            return PublishResult.permanent(job.getPlatform(), "ACCOUNT_INVALID",
                    "Destination account " + job.getDestinationAccountId() + " is missing or disconnected");
        }

        ContentPiece piece = content.get();
        DestinationAccount destination = account.get();
        PublishRequest request = PublishRequest.builder()
                .jobId(job.getId())
                .tenantId(job.getTenantId())
                .platform(job.getPlatform())
                .destinationAccountId(destination.getId())
                .externalAccountId(destination.getExternalAccountId())
                .handle(destination.getHandle())
                .title(piece.getTitle())
                .body(piece.getBody())
                .hashtags(piece.getHashtags())
                .mediaUrls(piece.getMediaUrls())
                .idempotencyKey(job.getIdempotencyKey())
                .attempt(attempt)
                .firstAttemptAt(job.getFirstAttemptAt() != null ? job.getFirstAttemptAt().toInstant() : null)
                .timeout(properties.getPublishTimeout())
                .build();
        return publishers.publish(request);
    }

    private void apply(PublishJob job, int attempt, PublishResult result) {
        OffsetDateTime now = store.now();
        if (result.isSuccess()) {
            onSuccess(job, attempt, result, now);
        } else if (result.isRetryable() && attempt < job.getMaxAttempts()) {
            onRetry(job, attempt, result, now);
        } else {
            onFailure(job, attempt, result, now);
        }
    }

    private void onSuccess(PublishJob job, int attempt, PublishResult result, OffsetDateTime now) {
        if (!store.markPublished(job.getId(), attempt, result, now)) {
            // the stale reclaim took this attempt and released its quota
            log.warn("Job {} published as {} but was no longer PUBLISHING, result discarded",
                    job.getId(), result.getPlatformPostId());
            return;
        }
        quotaService.commit(job.getTenantId(), UsageMetric.POSTS_PUBLISHED, 1, job.getQuotaPeriodId());
        job.setStatus(PublishJobStatus.PUBLISHED);
        job.setPublishedAt(now);
        job.setPlatformPostId(result.getPlatformPostId());
        job.setPlatformUrl(result.getPlatformUrl());
        job.setErrorMessage(null);
        log.info("Job {} published to {} as {}", job.getId(), job.getPlatform(), result.getPlatformPostId());
        notifier.notify(job, PublishJobStatus.PUBLISHED, now);
    }

    private void onRetry(PublishJob job, int attempt, PublishResult result, OffsetDateTime now) {
        OffsetDateTime nextAt = now.plus(backoff.delayFor(attempt));
        String error = result.describeError();
        if (store.markRetrying(job.getId(), attempt, nextAt, error, now)) {
            quotaService.release(job.getTenantId(), UsageMetric.POSTS_PUBLISHED, 1, job.getQuotaPeriodId());
            log.warn("Job {} attempt {}/{} failed, retrying at {}: {}",
                    job.getId(), attempt, job.getMaxAttempts(), nextAt, error);
        } else {
            log.warn("Job {} was no longer PUBLISHING, retry not recorded", job.getId());
        }
    }

    private void onFailure(PublishJob job, int attempt, PublishResult result, OffsetDateTime now) {
        String error = result.describeError();
        if (!store.markFailed(job.getId(), attempt, error, now)) {
            log.warn("Job {} was no longer PUBLISHING, failure not recorded", job.getId());
            return;
        }
        quotaService.release(job.getTenantId(), UsageMetric.POSTS_PUBLISHED, 1, job.getQuotaPeriodId());
        job.setStatus(PublishJobStatus.FAILED);
        job.setErrorMessage(error);
        log.error("Job {} failed after {} attempt(s): {}", job.getId(), attempt, error);
        notifier.notify(job, PublishJobStatus.FAILED, now);
    }

    private void reclaimStale(OffsetDateTime now) {
        OffsetDateTime cutoff = now.minus(properties.getStaleLockTimeout());
        for (PublishJob job : store.findStale(cutoff, properties.getBatchSize())) {
            try {
                store.reclaimStale(job, cutoff, now).ifPresent(status -> {
                    quotaService.release(job.getTenantId(), UsageMetric.POSTS_PUBLISHED, 1, job.getQuotaPeriodId());
                    log.warn("Reclaimed stale publish lock on job {} (attempt {}), now {}",
                            job.getId(), job.getAttemptCount(), status);
                    if (status == PublishJobStatus.FAILED) {
                        job.setStatus(status);
                        notifier.notify(job, status, now);
                    }
                });
            } catch (Exception e) {
                log.error("Failed to reclaim stale job {}", job.getId(), e);
            }
        }
    }
}
