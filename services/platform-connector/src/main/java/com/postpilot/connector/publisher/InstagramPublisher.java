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
 * Instagram Graph API content publishing.
 * Two-step process: create a media container, then publish it. The idempotency key is sent
 * as the container's client dedupe id.
 */
@Component
public final class InstagramPublisher extends AbstractPlatformPublisher {

    private static final String GRAPH_API_BASE = "https://graph.facebook.com/v18.0";

    public InstagramPublisher(WebClient.Builder webClientBuilder, AccessTokenStore accessTokenStore,
                              ContentAdapterService contentAdapterService) {
        super(webClientBuilder, accessTokenStore, contentAdapterService);
    }

    @Override
    public Platform getPlatform() {
        return Platform.INSTAGRAM;
    }

    @Override
    protected String apiBaseUrl() {
        return GRAPH_API_BASE;
    }

    @Override
    protected Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content) {
        String igUserId = request.getExternalAccountId();
        String mediaUrl = content.firstMediaUrl();

        Map<String, Object> params = new HashMap<>();
        params.put("caption", content.getTextWithHashtags());
        params.put("client_request_id", request.getIdempotencyKey());

        if (isVideo(mediaUrl)) {
            params.put("media_type", "REELS");
            params.put("video_url", mediaUrl);
            params.put("share_to_feed", true);
        } else {
            params.put("image_url", mediaUrl);
        }

        return client.post()
                .uri("/{igUserId}/media", igUserId)
                .bodyValue(params)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(container -> client.post()
                        .uri("/{igUserId}/media_publish?creation_id={containerId}", igUserId, requireId(container, "id"))
                        .retrieve()
                        .bodyToMono(JsonNode.class))
                .map(published -> {
                    String mediaId = requireId(published, "id");
                    return PublishResult.success(Platform.INSTAGRAM, mediaId,
                            "https://www.instagram.com/p/" + mediaId + "/");
                });
    }

    private boolean isVideo(String mediaUrl) {
        String lower = mediaUrl.toLowerCase();
        return lower.endsWith(".mp4") || lower.endsWith(".mov");
    }
}
