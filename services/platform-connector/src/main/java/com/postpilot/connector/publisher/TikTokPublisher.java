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
import java.util.Set;

/**
 * TikTok Content Posting API, PULL_FROM_URL direct post. The idempotency key is sent as
 * {@code client_request_id}. TikTok reports most failures as an error object inside a 200
 * response, so those codes are classified here.
 */
@Component
public final class TikTokPublisher extends AbstractPlatformPublisher {

    private static final String TIKTOK_API_BASE = "https://open.tiktokapis.com/v2";

    private static final Set<String> RETRYABLE_ERRORS = Set.of(
            "rate_limit_exceeded", "spam_risk_too_many_posts", "internal_error");
    private static final Set<String> AUTH_ERRORS = Set.of(
            "access_token_invalid", "scope_not_authorized", "token_expired");

    public TikTokPublisher(WebClient.Builder webClientBuilder, AccessTokenStore accessTokenStore,
                           ContentAdapterService contentAdapterService) {
        super(webClientBuilder, accessTokenStore, contentAdapterService);
    }

    @Override
    public Platform getPlatform() {
        return Platform.TIKTOK;
    }

    @Override
    protected String apiBaseUrl() {
        return TIKTOK_API_BASE;
    }

    @Override
    protected Mono<PublishResult> publish(WebClient client, PublishRequest request, AdaptedContent content) {
        String mediaUrl = content.firstMediaUrl();
        boolean video = mediaUrl.toLowerCase().endsWith(".mp4");

        Map<String, Object> postInfo = new HashMap<>();
        postInfo.put("description", content.getTextWithHashtags());
        postInfo.put("privacy_level", "PUBLIC_TO_EVERYONE");
        postInfo.put("disable_comment", false);
        if (content.getTitle() != null) {
            postInfo.put("title", content.getTitle());
        }

        Map<String, Object> sourceInfo = new HashMap<>();
        sourceInfo.put("source", "PULL_FROM_URL");
        if (video) {
            sourceInfo.put("video_url", mediaUrl);
        } else {
            sourceInfo.put("photo_images", content.getMediaUrls());
            sourceInfo.put("photo_cover_index", 0);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("post_info", postInfo);
        body.put("source_info", sourceInfo);
        body.put("post_mode", "DIRECT_POST");
        body.put("media_type", video ? "VIDEO" : "PHOTO");
        body.put("client_request_id", request.getIdempotencyKey());

        return client.post()
                .uri("/post/publish/content/init/")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> toResult(request, response));
    }

    private PublishResult toResult(PublishRequest request, JsonNode response) {
        JsonNode error = response.path("error");
        String code = error.path("code").asText("ok");

        if (!"ok".equals(code)) {
            String message = error.path("message").asText(code);
            if (RETRYABLE_ERRORS.contains(code)) {
                return PublishResult.retryable(Platform.TIKTOK, code.toUpperCase(), message);
            }
            if (AUTH_ERRORS.contains(code)) {
                return PublishResult.permanent(Platform.TIKTOK, "AUTH_REVOKED", message);
            }
            return PublishResult.permanent(Platform.TIKTOK, "CONTENT_REJECTED", "[" + code + "] " + message);
        }

        String publishId = requireId(response.path("data"), "publish_id");
        return PublishResult.success(Platform.TIKTOK, publishId,
                "https://www.tiktok.com/@" + request.getHandle());
    }
}
