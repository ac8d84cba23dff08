package com.postpilot.scheduler.service;

import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.model.Platform;
import com.postpilot.scheduler.entity.PublishJob;
import com.postpilot.scheduler.entity.PublishJobStatus;
import com.postpilot.scheduler.repository.PublishJobRepository;
import com.postpilot.scheduler.support.JobFixtures;
import com.postpilot.scheduler.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({PublishJobStore.class, PublishJobStoreTest.ClockConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class PublishJobStoreTest {

    private static final String PERIOD = "2026-10";

    @TestConfiguration
    static class ClockConfig {
        @Bean
        MutableClock clock() {
            return new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        }
    }

    @Autowired
    private PublishJobStore store;

    @Autowired
    private PublishJobRepository repository;

    @Autowired
    private MutableClock clock;

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
        clock.set(Instant.parse("2026-10-19T12:00:00Z"));
    }

    private PublishJob createDue() {
        return store.create(JobFixtures.dueJob(store.now().minusSeconds(1)).build());
    }

    private PublishJob reload(UUID id) {
        return repository.findById(id).orElseThrow();
    }

    @Test
    void onlyOneClaimWinsForTheSameAttempt() {
        PublishJob job = createDue();
        OffsetDateTime now = store.now();

        assertThat(store.claim(job.getId(), 0, PERIOD, now)).isTrue();
        assertThat(store.claim(job.getId(), 0, PERIOD, now)).isFalse();

        PublishJob claimed = reload(job.getId());
        assertThat(claimed.getStatus()).isEqualTo(PublishJobStatus.PUBLISHING);
        assertThat(claimed.getAttemptCount()).isEqualTo(1);
        assertThat(claimed.getLastAttemptAt()).isNotNull();
        assertThat(claimed.getQuotaPeriodId()).isEqualTo(PERIOD);
    }

    @Test
    void laterClaimsKeepTheFirstAttemptTime() {
        PublishJob job = createDue();
        OffsetDateTime firstAt = store.now();
        store.claim(job.getId(), 0, PERIOD, firstAt);
        store.markRetrying(job.getId(), 1, firstAt, "[TIMEOUT] slow", firstAt);

        clock.advance(Duration.ofDays(13).plusHours(12));
        assertThat(store.claim(job.getId(), 1, "2026-11", store.now())).isTrue();

        PublishJob retried = reload(job.getId());
        assertThat(retried.getFirstAttemptAt()).isAtSameInstantAs(firstAt);
        assertThat(retried.getLastAttemptAt()).isAtSameInstantAs(store.now());
        assertThat(retried.getQuotaPeriodId()).isEqualTo("2026-11");
    }

    @Test
    void jobsScheduledLaterAreNotDueOrClaimable() {
        PublishJob job = store.create(JobFixtures.dueJob(store.now().plusHours(1)).build());

        assertThat(store.findDue(store.now(), 10)).isEmpty();
        assertThat(store.claim(job.getId(), 0, PERIOD, store.now())).isFalse();
    }

    @Test
    void dueJobsComeOldestFirst() {
        PublishJob later = store.create(JobFixtures.dueJob(store.now().minusMinutes(1)).build());
        PublishJob earlier = store.create(JobFixtures.dueJob(store.now().minusMinutes(5)).build());

        assertThat(store.findDue(store.now(), 10))
                .extracting(PublishJob::getId)
                .containsExactly(earlier.getId(), later.getId());
    }

    @Test
    void cancelAfterClaimIsRejectedAndPublishStillLands() {
        PublishJob job = createDue();
        store.claim(job.getId(), 0, PERIOD, store.now());

        assertThat(store.cancel(job.getId(), store.now())).isFalse();
        assertThat(store.markPublished(job.getId(), 1,
                PublishResult.success(Platform.TWITTER, "42", "https://twitter.com/x/status/42"), store.now())).isTrue();

        PublishJob published = reload(job.getId());
        assertThat(published.getStatus()).isEqualTo(PublishJobStatus.PUBLISHED);
        assertThat(published.getPlatformPostId()).isEqualTo("42");
        assertThat(published.getPublishedAt()).isNotNull();
        assertThat(published.getCancelledAt()).isNull();
    }

    @Test
    void cancelledJobIsNeverClaimed() {
        PublishJob job = createDue();

        assertThat(store.cancel(job.getId(), store.now())).isTrue();
        assertThat(store.claim(job.getId(), 0, PERIOD, store.now())).isFalse();

        PublishJob cancelled = reload(job.getId());
        assertThat(cancelled.getStatus()).isEqualTo(PublishJobStatus.CANCELLED);
        assertThat(cancelled.getCancelledAt()).isNotNull();
    }

    @Test
    void resultWritesNeedTheOwningAttempt() {
        PublishJob job = createDue();

        assertThat(store.markFailed(job.getId(), 0, "no", store.now())).isFalse();

        store.claim(job.getId(), 0, PERIOD, store.now());

        assertThat(store.markRetrying(job.getId(), 2, store.now().plusMinutes(1), "late", store.now())).isFalse();
        assertThat(store.markRetrying(job.getId(), 1, store.now().plusMinutes(1), "[TIMEOUT] slow", store.now())).isTrue();

        PublishJob retrying = reload(job.getId());
        assertThat(retrying.getStatus()).isEqualTo(PublishJobStatus.RETRYING);
        assertThat(retrying.getErrorMessage()).isEqualTo("[TIMEOUT] slow");
        assertThat(retrying.getOriginalScheduledAt()).isAtSameInstantAs(job.getOriginalScheduledAt());
    }

    @Test
    void exhaustedJobIsNotClaimable() {
        PublishJob job = store.create(JobFixtures.dueJob(store.now().minusSeconds(1))
                .status(PublishJobStatus.RETRYING)
                .attemptCount(5)
                .maxAttempts(5)
                .build());

        assertThat(store.claim(job.getId(), 5, PERIOD, store.now())).isFalse();
    }

    @Test
    void staleLockIsReclaimedOnce() {
        PublishJob job = createDue();
        store.claim(job.getId(), 0, PERIOD, store.now());

        clock.advance(Duration.ofMinutes(5));
        OffsetDateTime cutoff = store.now().minusMinutes(1);

        assertThat(store.findStale(cutoff, 10)).extracting(PublishJob::getId).containsExactly(job.getId());
        PublishJob stale = store.findStale(cutoff, 10).get(0);

        assertThat(store.reclaimStale(stale, cutoff, store.now())).contains(PublishJobStatus.RETRYING);
        assertThat(store.reclaimStale(stale, cutoff, store.now())).isEmpty();

        PublishJob reclaimed = reload(job.getId());
        assertThat(reclaimed.getStatus()).isEqualTo(PublishJobStatus.RETRYING);
        assertThat(reclaimed.getAttemptCount()).isEqualTo(1);
    }

    @Test
    void recentLockIsNotStale() {
        PublishJob job = createDue();
        store.claim(job.getId(), 0, PERIOD, store.now());

        assertThat(store.findStale(store.now().minusMinutes(1), 10)).isEmpty();
    }

    @Test
    void duplicateRequestKeyReturnsExistingJob() {
        PublishJob first = store.create(JobFixtures.dueJob(store.now()).idempotencyKey("req-1").build());
        PublishJob second = store.create(JobFixtures.dueJob(store.now()).idempotencyKey("req-1").build());

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void statsCountEveryStatus() {
        createDue();
        PublishJob cancelled = createDue();
        store.cancel(cancelled.getId(), store.now());

        assertThat(store.countByStatus(JobFixtures.TENANT))
                .containsEntry(PublishJobStatus.SCHEDULED, 1L)
                .containsEntry(PublishJobStatus.CANCELLED, 1L)
                .containsEntry(PublishJobStatus.PUBLISHED, 0L);
    }
}
