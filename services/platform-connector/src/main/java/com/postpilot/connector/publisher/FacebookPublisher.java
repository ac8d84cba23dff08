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
 * Facebook Page feed publishing. Photo posts go to {@code /photos}, everything else to
 * {@code /feed}; the idempotency key is sent as {@code client_ref}.
 */
@Component
public final class FacebookPublisher extends AbstractPlatformPublisher {

    private static final String GRAPH_API_BASE = "https://graph.facebook.com/v18.0";

    public FacebookPublisher(WebClient.Builder webClientBuilder, AccessTokenStore accessTokenStore,
                             ContentAdapterService contentAdapterService) {
        super(webClientBuilder, accessTokenStore, contentAdapterService);
    }

    @Override
    public Platform getPlatform() {
        return Platform.FACEBOOK;
    }

    @Override
    protected String apiBaseUrl() {
        return GRAPH_API_BASE;
    }

    @Override
    protected Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content) {
        String pageId = request.getExternalAccountId();
        String photoUrl = content.firstMediaUrl();

        Map<String, Object> params = new HashMap<>();
        params.put("client_ref", request.getIdempotencyKey());
        params.put("published", true);

        String path;
        if (photoUrl != null) {
            path = "/{pageId}/photos";
            params.put("url", photoUrl);
            params.put("caption", content.getTextWithHashtags());
        } else {
            path = "/{pageId}/feed";
            params.put("message", content.getTextWithHashtags());
        }

        return client.post()
                .uri(path, pageId)
                .bodyValue(params)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    String postId = response.hasNonNull("post_id")
                            ? response.get("post_id").asText()
                            : requireId(response, "id");
                    return PublishResult.success(Platform.FACEBOOK, postId,
                            "https://www.facebook.com/" + postId);
                });
    }
}
