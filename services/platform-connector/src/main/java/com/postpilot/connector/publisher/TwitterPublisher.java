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

import java.util.HashMap;
import java.util.Map;

/**
 * X (Twitter) API v2. The idempotency key travels in the {@code Idempotency-Key} header.
 */
@Component
public final class TwitterPublisher extends AbstractPlatformPublisher {

    private static final String API_BASE = "https://api.twitter.com/2";

    public TwitterPublisher(WebClient.Builder webClientBuilder, AccessTokenStore accessTokenStore,
                            ContentAdapterService contentAdapterService) {
        super(webClientBuilder, accessTokenStore, contentAdapterService);
    }

    @Override
    public Platform getPlatform() {
        return Platform.TWITTER;
    }

    @Override
    protected String apiBaseUrl() {
        return API_BASE;
    }

    @Override
    protected Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content) {
        Map<String, Object> body = new HashMap<>();
        body.put("text", content.getTextWithHashtags());

        if (content.getMediaUrls() != null && !content.getMediaUrls().isEmpty()) {
            body.put("media", Map.of("media_urls", content.getMediaUrls()));
        }

        return client.post()
                .uri("/tweets")
                .header(IDEMPOTENCY_HEADER, request.getIdempotencyKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    String tweetId = requireId(response.path("data"), "id");
                    return PublishResult.success(Platform.TWITTER, tweetId,
                            "https://twitter.com/" + request.getHandle() + "/status/" + tweetId);
                });
    }
}
