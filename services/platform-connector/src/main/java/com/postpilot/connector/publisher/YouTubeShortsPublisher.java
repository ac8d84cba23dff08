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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * YouTube Data API v3 for Shorts. The idempotency key is stored as a private video tag; the
 * channel's recent uploads are searched for that tag before a new upload is created.
 */
@Component
public final class YouTubeShortsPublisher extends AbstractPlatformPublisher {

    private static final String YOUTUBE_API_BASE = "https://www.googleapis.com/youtube/v3";
    private static final String KEY_TAG_PREFIX = "pp-";

    public YouTubeShortsPublisher(WebClient.Builder webClientBuilder, AccessTokenStore accessTokenStore,
                                  ContentAdapterService contentAdapterService) {
        super(webClientBuilder, accessTokenStore, contentAdapterService);
    }

    @Override
    public Platform getPlatform() {
        return Platform.YOUTUBE_SHORTS;
    }

    @Override
    protected String apiBaseUrl() {
        return YOUTUBE_API_BASE;
    }

    @Override
    protected Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content) {
        String keyTag = KEY_TAG_PREFIX + request.getIdempotencyKey();

        return findExistingUpload(client, keyTag)
                .switchIfEmpty(Mono.defer(() -> upload(client, content, keyTag)))
                .map(videoId -> PublishResult.success(Platform.YOUTUBE_SHORTS, videoId,
                        "https://www.youtube.com/shorts/" + videoId));
    }

    private Mono<String> findExistingUpload(WebClient client, String keyTag) {
        return client.get()
                .uri(uri -> uri.path("/search")
                        .queryParam("part", "id")
                        .queryParam("forMine", true)
                        .queryParam("type", "video")
                        .queryParam("q", keyTag)
                        .queryParam("maxResults", 5)
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(response -> {
                    JsonNode items = response.path("items");
                    if (items.isArray() && items.size() > 0) {
                        return Mono.just(requireId(items.get(0).path("id"), "videoId"));
                    }
                    return Mono.empty();
                });
    }

    private Mono<String> upload(WebClient client, AdaptedContent content, String keyTag) {
        List<String> tags = new ArrayList<>(content.getTags() != null ? content.getTags() : List.of());
        tags.add(keyTag);

        Map<String, Object> body = Map.of(
                "snippet", Map.of(
                        "title", content.getTitle(),
                        "description", content.getText() != null ? content.getText() : "",
                        "tags", tags,
                        "categoryId", "22"
                ),
                "status", Map.of(
                        "privacyStatus", "public",
                        "selfDeclaredMadeForKids", false
                ),
                "sourceUrl", content.firstMediaUrl()
        );

        return client.post()
                .uri("/videos?part=snippet,status")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> requireId(response, "id"));
    }
}
