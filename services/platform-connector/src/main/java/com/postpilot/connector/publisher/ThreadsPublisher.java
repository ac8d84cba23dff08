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
 * Threads API. Two-step flow (create container, then publish it); both steps carry the
 * {@code Idempotency-Key} header.
 */
@Component
public final class ThreadsPublisher extends AbstractPlatformPublisher {

    private static final String API_BASE = "https://graph.threads.net/v1.0";

    public ThreadsPublisher(WebClient.Builder webClientBuilder, AccessTokenStore accessTokenStore,
                            ContentAdapterService contentAdapterService) {
        super(webClientBuilder, accessTokenStore, contentAdapterService);
    }

    @Override
    public Platform getPlatform() {
        return Platform.THREADS;
    }

    @Override
    protected String apiBaseUrl() {
        return API_BASE;
    }

    @Override
    protected Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content) {
        String userId = request.getExternalAccountId();

        Map<String, Object> container = new HashMap<>();
        container.put("text", content.getTextWithHashtags());
        if (content.firstMediaUrl() != null) {
            container.put("media_type", "IMAGE");
            container.put("image_url", content.firstMediaUrl());
        } else {
            container.put("media_type", "TEXT");
        }

        return client.post()
                .uri("/{userId}/threads", userId)
                .header(IDEMPOTENCY_HEADER, request.getIdempotencyKey())
                .bodyValue(container)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(created -> client.post()
                        .uri("/{userId}/threads_publish?creation_id={creationId}", userId, requireId(created, "id"))
                        .header(IDEMPOTENCY_HEADER, request.getIdempotencyKey())
                        .retrieve()
                        .bodyToMono(JsonNode.class))
                .map(published -> {
                    String postId = requireId(published, "id");
                    return PublishResult.success(Platform.THREADS, postId,
                            "https://www.threads.net/@" + request.getHandle() + "/post/" + postId);
                });
    }
}
