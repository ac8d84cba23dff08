package com.postpilot.scheduler.service;

import com.postpilot.scheduler.collaborator.ContentPiece;
import com.postpilot.scheduler.collaborator.ContentSource;
import com.postpilot.scheduler.collaborator.DestinationAccount;
import com.postpilot.scheduler.collaborator.DestinationAccountSource;
import com.postpilot.scheduler.config.DispatchProperties;
import com.postpilot.scheduler.dto.PublishJobResponse;
import com.postpilot.scheduler.dto.RecurringScheduleRequest;
import com.postpilot.scheduler.dto.SchedulePublishRequest;
import com.postpilot.scheduler.dto.SchedulerStatsResponse;
import com.postpilot.scheduler.entity.PublishJob;
import com.postpilot.scheduler.entity.PublishJobStatus;
import com.postpilot.scheduler.exception.JobNotFoundException;
import com.postpilot.scheduler.exception.NotCancellableException;
import com.postpilot.scheduler.exception.QuotaExceededException;
import com.postpilot.scheduler.exception.ValidationException;
import com.postpilot.scheduler.quota.QuotaDecision;
import com.postpilot.scheduler.quota.QuotaService;
import com.postpilot.scheduler.quota.UsageMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PublishJobService {

    private static final int MAX_REQUEST_KEY_LENGTH = 100;
    private static final int MAX_JOBS_PER_REQUEST = 100;

    private final PublishJobStore store;
    private final ContentSource contentSource;
    private final DestinationAccountSource accountSource;
    private final QuotaService quotaService;
    private final JobStatusNotifier notifier;
    private final DispatchProperties properties;

    public PublishJobResponse schedulePublish(UUID contentPieceId, UUID destinationAccountId, OffsetDateTime scheduledAt) {
        return schedulePublish(contentPieceId, destinationAccountId, scheduledAt, null, null);
    }

    public PublishJobResponse schedulePublish(UUID contentPieceId, UUID destinationAccountId,
                                              OffsetDateTime scheduledAt, String requestKey) {
        return schedulePublish(contentPieceId, destinationAccountId, scheduledAt, requestKey, null);
    }

    /**
     * Create a publish job for one content piece on one destination account.
     *
     * @param requestKey optional caller key; a repeated request with the same key for the same
     *                   account returns the job the first request created, provided it asks for
     *                   the same content and time
     * @param tenantId   when non-null, the destination account must belong to this tenant
     */
    public PublishJobResponse schedulePublish(UUID contentPieceId, UUID destinationAccountId,
                                              OffsetDateTime scheduledAt, String requestKey, UUID tenantId) {
        if (requestKey != null && (requestKey.isBlank() || requestKey.length() > MAX_REQUEST_KEY_LENGTH)) {
            throw new ValidationException("Idempotency key must be 1 to " + MAX_REQUEST_KEY_LENGTH + " characters");
        }
        OffsetDateTime now = store.now();
        checkRequest(contentPieceId, destinationAccountId, scheduledAt, now);

        if (requestKey != null) {
            Optional<PublishJob> existing = store.findByRequestKey(destinationAccountId, requestKey);
            if (existing.isPresent()) {
                PublishJob job = existing.get();
                checkOwner(tenantId, job.getTenantId(), destinationAccountId);
                if (!job.getContentPieceId().equals(contentPieceId)
                        || !job.getOriginalScheduledAt().isEqual(scheduledAt.truncatedTo(ChronoUnit.MICROS))) {
                    throw new ValidationException("Idempotency key " + requestKey
                            + " was already used for a different content piece or time");
                }
                log.info("Returning existing publish job {} for request key {}", job.getId(), requestKey);
                return mapToResponse(job);
            }
        }

        PublishJob job = prepare(contentPieceId, destinationAccountId, scheduledAt, tenantId);
        checkQuota(job.getTenantId(), 1);
        job.setIdempotencyKey(requestKey != null ? requestKey : UUID.randomUUID().toString());
        return mapToResponse(create(job));
    }

    /**
     * Schedule several publish jobs at once, each for its own content piece, account and time.
     * Every entry is validated and the tenant's quota checked for the whole batch before any
     * job is created.
     */
    public List<PublishJobResponse> schedulePublishBulk(List<SchedulePublishRequest> requests, UUID tenantId) {
        if (requests == null || requests.isEmpty()) {
            throw new ValidationException("At least one job is required");
        }
        if (requests.size() > MAX_JOBS_PER_REQUEST) {
            throw new ValidationException("At most " + MAX_JOBS_PER_REQUEST + " jobs can be scheduled at once");
        }

        OffsetDateTime now = store.now();
        List<PublishJob> jobs = new ArrayList<>(requests.size());
        for (SchedulePublishRequest request : requests) {
            if (request == null) {
                throw new ValidationException("Job entries must not be null");
            }
            checkRequest(request.getContentPieceId(), request.getDestinationAccountId(), request.getScheduledAt(), now);
            jobs.add(prepare(request.getContentPieceId(), request.getDestinationAccountId(),
                    request.getScheduledAt(), tenantId));
        }

        Map<UUID, Long> perTenant = jobs.stream()
                .collect(Collectors.groupingBy(PublishJob::getTenantId, Collectors.counting()));
        perTenant.forEach(this::checkQuota);

        List<PublishJobResponse> created = new ArrayList<>(jobs.size());
        for (PublishJob job : jobs) {
            job.setIdempotencyKey(UUID.randomUUID().toString());
            created.add(mapToResponse(create(job)));
        }
        log.info("Scheduled {} publish jobs in bulk", created.size());
        return created;
    }

    /**
     * Schedule the same cadence on every listed account: one job per account at
     * {@code startAt} and at each later occurrence, rotating through the content pieces one
     * occurrence at a time. The series ends after {@code occurrences} or at {@code until},
     * whichever is given.
     */
    public List<PublishJobResponse> scheduleRecurring(RecurringScheduleRequest request, UUID tenantId) {
        if (request == null || request.getContentPieceIds() == null || request.getContentPieceIds().isEmpty()) {
            throw new ValidationException("At least one content piece is required");
        }
        if (request.getDestinationAccountIds() == null || request.getDestinationAccountIds().isEmpty()) {
            throw new ValidationException("At least one destination account is required");
        }
        if (request.getStartAt() == null || request.getFrequency() == null) {
            throw new ValidationException("startAt and frequency are required");
        }
        int interval = request.getInterval() != null ? request.getInterval() : 1;
        if (interval < 1) {
            throw new ValidationException("interval must be at least 1");
        }
        if ((request.getOccurrences() == null) == (request.getUntil() == null)) {
            throw new ValidationException("Exactly one of occurrences and until is required");
        }
        if (request.getOccurrences() != null && request.getOccurrences() < 1) {
            throw new ValidationException("occurrences must be at least 1");
        }

        int accounts = request.getDestinationAccountIds().size();
        int maxOccurrences = MAX_JOBS_PER_REQUEST / accounts;
        List<OffsetDateTime> times = new ArrayList<>();
        for (int i = 0; ; i++) {
            OffsetDateTime at = request.getFrequency().occurrence(request.getStartAt(), i * interval);
            boolean done = request.getOccurrences() != null
                    ? i >= request.getOccurrences()
                    : at.isAfter(request.getUntil());
            if (done) {
                break;
            }
            if (times.size() >= maxOccurrences) {
                throw new ValidationException("Recurring schedule would create more than "
                        + MAX_JOBS_PER_REQUEST + " jobs");
            }
            times.add(at);
        }
        if (times.isEmpty()) {
            throw new ValidationException("until is before startAt");
        }

        List<SchedulePublishRequest> jobs = new ArrayList<>(times.size() * accounts);
        List<UUID> contentPieceIds = request.getContentPieceIds();
        for (int i = 0; i < times.size(); i++) {
            UUID contentPieceId = contentPieceIds.get(i % contentPieceIds.size());
            for (UUID accountId : request.getDestinationAccountIds()) {
                jobs.add(new SchedulePublishRequest(contentPieceId, accountId, times.get(i)));
            }
        }
        return schedulePublishBulk(jobs, tenantId);
    }

    private void checkRequest(UUID contentPieceId, UUID destinationAccountId,
                              OffsetDateTime scheduledAt, OffsetDateTime now) {
        if (contentPieceId == null || destinationAccountId == null) {
            throw new ValidationException("contentPieceId and destinationAccountId are required");
        }
        if (scheduledAt == null) {
            throw new ValidationException("scheduledAt is required");
        }
        if (scheduledAt.isBefore(now.minus(properties.getScheduleGrace()))) {
            throw new ValidationException("scheduledAt " + scheduledAt + " is in the past");
        }
    }

    /**
     * Resolve and validate the content piece and account, returning an unsaved job without an
     * idempotency key.
     */
    private PublishJob prepare(UUID contentPieceId, UUID destinationAccountId,
                               OffsetDateTime scheduledAt, UUID tenantId) {
        ContentPiece content = contentSource.getContent(contentPieceId)
                .orElseThrow(() -> new ValidationException("Unknown content piece " + contentPieceId));
        DestinationAccount account = accountSource.getAccount(destinationAccountId)
                .orElseThrow(() -> new ValidationException("Unknown destination account " + destinationAccountId));
        checkOwner(tenantId, account.getTenantId(), destinationAccountId);
        if (!account.isValid()) {
            throw new ValidationException("Destination account " + destinationAccountId + " is disconnected");
        }
        if (content.getTenantId() == null || !content.getTenantId().equals(account.getTenantId())) {
            throw new ValidationException("Content piece and destination account belong to different tenants");
        }

        OffsetDateTime publishAt = scheduledAt.truncatedTo(ChronoUnit.MICROS);
        return PublishJob.builder()
                .tenantId(account.getTenantId())
                .contentPieceId(contentPieceId)
                .destinationAccountId(destinationAccountId)
                .platform(account.getPlatform())
                .scheduledAt(publishAt)
                .originalScheduledAt(publishAt)
                .status(PublishJobStatus.SCHEDULED)
                .attemptCount(0)
                .maxAttempts(properties.getMaxAttempts())
                .build();
    }

    private static void checkOwner(UUID callerTenantId, UUID ownerTenantId, UUID destinationAccountId) {
        if (callerTenantId != null && !callerTenantId.equals(ownerTenantId)) {
            throw new ValidationException("Destination account " + destinationAccountId
                    + " does not belong to tenant " + callerTenantId);
        }
    }

    private void checkQuota(UUID tenantId, long jobs) {
        QuotaDecision quota = quotaService.check(tenantId, UsageMetric.POSTS_PUBLISHED, jobs);
        if (!quota.isAllowed()) {
            throw new QuotaExceededException(quota);
        }
    }

    private PublishJob create(PublishJob job) {
        PublishJob created = store.create(job);
        log.info("Scheduled publish job {} for tenant {} on {} at {}",
                created.getId(), created.getTenantId(), created.getPlatform(), created.getScheduledAt());
        return created;
    }

    public void cancelPublish(UUID jobId) {
        cancelPublish(jobId, null);
    }

    /**
     * @param tenantId when non-null, the job must belong to this tenant
     */
    public void cancelPublish(UUID jobId, UUID tenantId) {
        PublishJob job = findOwned(jobId, tenantId);
        OffsetDateTime now = store.now();
        if (!store.cancel(jobId, now)) {
            PublishJobStatus current = store.find(jobId).map(PublishJob::getStatus).orElse(job.getStatus());
            throw new NotCancellableException(jobId, current);
        }
        job.setStatus(PublishJobStatus.CANCELLED);
        job.setCancelledAt(now);
        log.info("Cancelled publish job {}", jobId);
        notifier.notify(job, PublishJobStatus.CANCELLED, now);
    }

    public PublishJobResponse getJobStatus(UUID jobId) {
        return getJobStatus(jobId, null);
    }

    public PublishJobResponse getJobStatus(UUID jobId, UUID tenantId) {
        return mapToResponse(findOwned(jobId, tenantId));
    }

    public List<PublishJobResponse> listJobs(UUID tenantId, PublishJobStatus status) {
        return store.findForTenant(tenantId, status).stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public SchedulerStatsResponse getStats(UUID tenantId) {
        Map<PublishJobStatus, Long> counts = store.countByStatus(tenantId);
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return SchedulerStatsResponse.builder()
                .tenantId(tenantId)
                .total(total)
                .countsByStatus(counts)
                .build();
    }

    private PublishJob findOwned(UUID jobId, UUID tenantId) {
        PublishJob job = store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (tenantId != null && !tenantId.equals(job.getTenantId())) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private PublishJobResponse mapToResponse(PublishJob job) {
        return PublishJobResponse.builder()
                .id(job.getId())
                .tenantId(job.getTenantId())
                .contentPieceId(job.getContentPieceId())
                .destinationAccountId(job.getDestinationAccountId())
                .platform(job.getPlatform())
                .status(job.getStatus())
                .scheduledAt(job.getScheduledAt())
                .originalScheduledAt(job.getOriginalScheduledAt())
                .publishedAt(job.getPublishedAt())
                .attemptCount(job.getAttemptCount())
                .maxAttempts(job.getMaxAttempts())
                .lastAttemptAt(job.getLastAttemptAt())
                .idempotencyKey(job.getIdempotencyKey())
                .platformPostId(job.getPlatformPostId())
                .platformUrl(job.getPlatformUrl())
                .errorMessage(job.getErrorMessage())
                .createdAt(job.getCreatedAt())
                .cancelledAt(job.getCancelledAt())
                .build();
    }
}
