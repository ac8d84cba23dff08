package com.postpilot.connector.publisher;

import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.model.Platform;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Selects the publisher for a platform. The switch is exhaustive over {@link Platform}, so
 * adding a platform without a publisher does not compile.
 */
@Component
@RequiredArgsConstructor
public class PlatformPublishers {

    private final TwitterPublisher twitterPublisher;
    private final ThreadsPublisher threadsPublisher;
    private final LinkedInPublisher linkedInPublisher;
    private final InstagramPublisher instagramPublisher;
    private final FacebookPublisher facebookPublisher;
    private final TikTokPublisher tikTokPublisher;
    private final YouTubeShortsPublisher youTubeShortsPublisher;
    private final RedditPublisher redditPublisher;

    public PlatformPublisher forPlatform(Platform platform) {
        return switch (platform) {
            case TWITTER -> twitterPublisher;
            case THREADS -> threadsPublisher;
            case LINKEDIN -> linkedInPublisher;
            case INSTAGRAM -> instagramPublisher;
            case FACEBOOK -> facebookPublisher;
            case TIKTOK -> tikTokPublisher;
            case YOUTUBE_SHORTS -> youTubeShortsPublisher;
            case REDDIT -> redditPublisher;
        };
    }

    public PublishResult publish(PublishRequest request) {
        return forPlatform(request.getPlatform()).publish(request);
    }
}
