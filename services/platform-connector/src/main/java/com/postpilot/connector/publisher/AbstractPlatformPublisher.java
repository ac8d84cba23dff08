package com.postpilot.connector.publisher;

import com.fasterxml.jackson.databind.JsonNode;
import com.postpilot.connector.dto.AdaptedContent;
import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.model.Platform;
import com.postpilot.connector.service.AccessTokenStore;
import com.postpilot.connector.service.ContentAdapterService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Shared publish flow: token lookup, content adaptation, one reactive call chain under a hard
 * timeout, and classification of whatever goes wrong.
 */
@Slf4j
public abstract sealed class AbstractPlatformPublisher implements PlatformPublisher
        permits TwitterPublisher, ThreadsPublisher, LinkedInPublisher, InstagramPublisher,
                FacebookPublisher, TikTokPublisher, YouTubeShortsPublisher, RedditPublisher {

    protected static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    // Allowed difference between our clock and the platform's
    private static final Duration CLOCK_SKEW = Duration.ofSeconds(5);

    private final WebClient.Builder webClientBuilder;
    private final AccessTokenStore accessTokenStore;
    private final ContentAdapterService contentAdapterService;

    protected AbstractPlatformPublisher(WebClient.Builder webClientBuilder,
                                        AccessTokenStore accessTokenStore,
                                        ContentAdapterService contentAdapterService) {
        this.webClientBuilder = webClientBuilder;
        this.accessTokenStore = accessTokenStore;
        this.contentAdapterService = contentAdapterService;
    }

    @Override
    public final PublishResult publish(PublishRequest request) {
        Platform platform = getPlatform();
        log.info("Publishing job {} to {} account {}", request.getJobId(), platform, request.getDestinationAccountId());

        try {
            String accessToken = accessTokenStore.findToken(platform, request.getDestinationAccountId())
                    .orElseThrow(() -> new PublishRejectedException("AUTH_REVOKED",
                            "No valid " + platform.getDisplayName() + " access token for account "
                                    + request.getDestinationAccountId()));

            AdaptedContent content = contentAdapterService.adaptForPlatform(request);
            if (content.isContentWasModified()) {
                log.debug("Content for job {} adapted: {}", request.getJobId(), content.getAdaptationNotes());
            }

            WebClient client = webClientBuilder.clone()
                    .baseUrl(apiBaseUrl())
                    .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .build();

            PublishResult result = publish(client, request, content)
                    .timeout(request.getTimeout())
                    .block();

            if (result == null) {
                return PublishResult.retryable(platform, "EMPTY_RESPONSE",
                        platform.getDisplayName() + " returned no response body");
            }
            return result;

        } catch (Exception e) {
            PublishResult result = PublishErrorClassifier.classify(platform, e);
            log.warn("Publishing job {} to {} failed ({}): {}",
                    request.getJobId(), platform, result.getOutcome(), result.getErrorMessage());
            return result;
        }
    }

    /**
     * Base URL of the platform API
     */
    protected abstract String apiBaseUrl();

    /**
     * Build the call chain for one attempt. The chain must attach the idempotency key and may
     * look up an earlier post made with the same key before creating a new one.
     */
    protected abstract Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content);

    /**
     * Whether a post the platform reports as created at {@code createdAt} can belong to an
     * earlier attempt of this job. Only retries have earlier attempts, and nothing created
     * before the first attempt started qualifies.
     */
    protected static boolean mayBeEarlierAttempt(PublishRequest request, Instant createdAt) {
        if (!request.isRetry() || request.getFirstAttemptAt() == null || createdAt == null) {
            return false;
        }
        return !createdAt.isBefore(request.getFirstAttemptAt().minus(CLOCK_SKEW));
    }

    protected static String requireId(JsonNode node, String field) {
        String id = node.path(field).asText(null);
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("Platform response did not contain '" + field + "'");
        }
        return id;
    }
}
