package com.postpilot.connector.publisher;

import com.fasterxml.jackson.databind.JsonNode;
import com.postpilot.connector.dto.AdaptedContent;
import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.model.Platform;
import com.postpilot.connector.service.AccessTokenStore;
import com.postpilot.connector.service.ContentAdapterService;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Objects;

/**
 * Reddit submission API. Reddit has no idempotency support. On a retry the account's newest
 * submissions are searched for one this job may already have made: same subreddit, title and
 * body, created after the job's first attempt started. A first attempt always submits.
 */
@Component
public final class RedditPublisher extends AbstractPlatformPublisher {

    private static final String OAUTH_API_BASE = "https://oauth.reddit.com";
    private static final int RECENT_SUBMISSIONS_TO_CHECK = 25;

    public RedditPublisher(WebClient.Builder webClientBuilder, AccessTokenStore accessTokenStore,
                           ContentAdapterService contentAdapterService) {
        super(webClientBuilder, accessTokenStore, contentAdapterService);
    }

    @Override
    public Platform getPlatform() {
        return Platform.REDDIT;
    }

    @Override
    protected String apiBaseUrl() {
        return OAUTH_API_BASE;
    }

    @Override
    protected Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content) {
        if (!request.isRetry()) {
            return submit(client, request, content);
        }
        return findEarlierSubmission(client, request, content)
                .switchIfEmpty(Mono.defer(() -> submit(client, request, content)));
    }

    private Mono<PublishResult> findEarlierSubmission(WebClient client, PublishRequest request, AdaptedContent content) {
        String subreddit = subredditName(request.getExternalAccountId());
        return client.get()
                .uri("/user/{handle}/submitted?sort=new&limit={limit}", request.getHandle(), RECENT_SUBMISSIONS_TO_CHECK)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(response -> {
                    for (JsonNode child : response.path("data").path("children")) {
                        JsonNode post = child.path("data");
                        if (subreddit.equalsIgnoreCase(post.path("subreddit").asText(""))
                                && mayBeEarlierAttempt(request, createdAt(post))
                                && Objects.equals(content.getTitle(), post.path("title").asText(null))
                                && Objects.equals(nullToEmpty(content.getText()), post.path("selftext").asText(""))) {
                            return Mono.just(PublishResult.success(Platform.REDDIT, requireId(post, "name"),
                                    "https://www.reddit.com" + post.path("permalink").asText("")));
                        }
                    }
                    return Mono.empty();
                });
    }

    private Mono<PublishResult> submit(WebClient client, PublishRequest request, AdaptedContent content) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("api_type", "json");
        form.add("sr", subredditName(request.getExternalAccountId()));
        form.add("title", content.getTitle());
        if (content.firstMediaUrl() != null && (content.getText() == null || content.getText().isBlank())) {
            form.add("kind", "link");
            form.add("url", content.firstMediaUrl());
        } else {
            form.add("kind", "self");
            form.add("text", nullToEmpty(content.getText()));
        }

        return client.post()
                .uri("/api/submit")
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::toResult);
    }

    private PublishResult toResult(JsonNode response) {
        JsonNode json = response.path("json");
        JsonNode errors = json.path("errors");

        if (errors.isArray() && errors.size() > 0) {
            JsonNode first = errors.get(0);
            String code = first.path(0).asText("UNKNOWN");
            String message = first.path(1).asText(code);
            if ("RATELIMIT".equals(code)) {
                return PublishResult.retryable(Platform.REDDIT, "RATE_LIMITED", message);
            }
            return PublishResult.permanent(Platform.REDDIT, "CONTENT_REJECTED", "[" + code + "] " + message);
        }

        JsonNode data = json.path("data");
        return PublishResult.success(Platform.REDDIT, requireId(data, "name"), data.path("url").asText(null));
    }

    private static Instant createdAt(JsonNode post) {
        JsonNode created = post.path("created_utc");
        return created.isNumber() ? Instant.ofEpochSecond(created.asLong()) : null;
    }

    private static String subredditName(String externalAccountId) {
        return externalAccountId.startsWith("r/") ? externalAccountId.substring(2) : externalAccountId;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
