package com.postpilot.connector.publisher;

import com.fasterxml.jackson.databind.JsonNode;
import com.postpilot.connector.dto.AdaptedContent;
import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.model.Platform;
import com.postpilot.connector.service.AccessTokenStore;
import com.postpilot.connector.service.ContentAdapterService;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * LinkedIn Posts API. LinkedIn has no idempotency header. On a retry the author's recent posts
 * are searched for identical commentary created after the job's first attempt started; a
 * first attempt always creates the post.
 */
@Component
public final class LinkedInPublisher extends AbstractPlatformPublisher {

    private static final String API_BASE = "https://api.linkedin.com/rest";
    private static final String API_VERSION = "202401";
    private static final int RECENT_POSTS_TO_CHECK = 10;

    public LinkedInPublisher(WebClient.Builder webClientBuilder, AccessTokenStore accessTokenStore,
                             ContentAdapterService contentAdapterService) {
        super(webClientBuilder, accessTokenStore, contentAdapterService);
    }

    @Override
    public Platform getPlatform() {
        return Platform.LINKEDIN;
    }

    @Override
    protected String apiBaseUrl() {
        return API_BASE;
    }

    @Override
    protected Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content) {
        String author = authorUrn(request.getExternalAccountId());
        String commentary = content.getTextWithHashtags();

        Mono<String> post = request.isRetry()
                ? findEarlierPost(client, request, author, commentary)
                        .switchIfEmpty(Mono.defer(() -> createPost(client, author, commentary)))
                : createPost(client, author, commentary);
        return post.map(urn -> PublishResult.success(Platform.LINKEDIN, urn,
                "https://www.linkedin.com/feed/update/" + urn + "/"));
    }

    private Mono<String> findEarlierPost(WebClient client, PublishRequest request, String author, String commentary) {
        return client.get()
                .uri(uri -> uri.path("/posts")
                        .queryParam("q", "author")
                        .queryParam("author", author)
                        .queryParam("count", RECENT_POSTS_TO_CHECK)
                        .build())
                .header("LinkedIn-Version", API_VERSION)
                .header("X-Restli-Protocol-Version", "2.0.0")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(response -> {
                    for (JsonNode element : response.path("elements")) {
                        if (Objects.equals(commentary, element.path("commentary").asText(null))
                                && mayBeEarlierAttempt(request, createdAt(element))) {
                            return Mono.just(requireId(element, "id"));
                        }
                    }
                    return Mono.empty();
                });
    }

    private Mono<String> createPost(WebClient client, String author, String commentary) {
        Map<String, Object> body = Map.of(
                "author", author,
                "commentary", commentary != null ? commentary : "",
                "visibility", "PUBLIC",
                "distribution", Map.of("feedDistribution", "MAIN_FEED"),
                "lifecycleState", "PUBLISHED"
        );

        return client.post()
                .uri("/posts")
                .header("LinkedIn-Version", API_VERSION)
                .header("X-Restli-Protocol-Version", "2.0.0")
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .map(response -> {
                    String urn = response.getHeaders().getFirst("x-restli-id");
                    if (urn == null || urn.isBlank()) {
                        throw new IllegalStateException("LinkedIn response did not contain x-restli-id");
                    }
                    return urn;
                });
    }

    private static Instant createdAt(JsonNode element) {
        JsonNode created = element.path("createdAt");
        return created.isNumber() ? Instant.ofEpochMilli(created.asLong()) : null;
    }

    private String authorUrn(String externalAccountId) {
        return externalAccountId.startsWith("urn:") ? externalAccountId : "urn:li:person:" + externalAccountId;
    }
}
