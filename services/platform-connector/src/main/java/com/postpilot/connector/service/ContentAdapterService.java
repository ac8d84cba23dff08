package com.postpilot.connector.service;

import com.postpilot.connector.dto.AdaptedContent;
import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.model.ContentLimits;
import com.postpilot.connector.model.Platform;
import com.postpilot.connector.publisher.PublishRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service responsible for adapting a content piece to meet platform-specific requirements.
 * Handles text limits, hashtag placement, titles and required media.
 */
@Service
@Slf4j
public class ContentAdapterService {

    /**
     * Adapt content for the request's platform.
     *
     * @throws PublishRejectedException when the platform cannot accept the content at all
     */
    public AdaptedContent adaptForPlatform(PublishRequest request) {
        Platform platform = request.getPlatform();
        ContentLimits limits = platform.toContentLimits();

        if (!limits.hasRequiredMedia(request.getMediaUrls())) {
            throw new PublishRejectedException("MEDIA_REQUIRED",
                    platform.getDisplayName() + " posts require at least one media item");
        }

        log.debug("Adapting content for platform: {}", platform.getDisplayName());

        return switch (platform) {
            case YOUTUBE_SHORTS -> adaptForYouTube(request, limits);
            case REDDIT -> adaptForReddit(request, limits);
            case TWITTER, THREADS, LINKEDIN, INSTAGRAM, FACEBOOK, TIKTOK -> adaptInline(request, limits);
        };
    }

    /**
     * Platforms that carry hashtags inside the post text
     * - hashtag count capped per platform
     * - text truncated so text plus hashtags fit
     */
    private AdaptedContent adaptInline(PublishRequest request, ContentLimits limits) {
        AdaptedContent adapted = AdaptedContent.builder()
                .platform(limits.getPlatform())
                .title(limits.getMaxTitleLength() > 0 ? truncateTitle(request.getTitle(), limits.getMaxTitleLength()) : null)
                .text(request.getBody())
                .hashtags(request.getHashtags() != null ? new ArrayList<>(request.getHashtags()) : new ArrayList<>())
                .mediaUrls(request.getMediaUrls() != null ? List.copyOf(request.getMediaUrls()) : List.of())
                .contentWasModified(false)
                .build();

        if (!limits.isValidHashtagCount(adapted.getHashtags().size())) {
            adapted.addNote(String.format("Reduced hashtags from %d to %d",
                    adapted.getHashtags().size(), limits.getMaxHashtags()));
            adapted.setHashtags(new ArrayList<>(adapted.getHashtags().subList(0, limits.getMaxHashtags())));
            adapted.setContentWasModified(true);
        }

        String fullText = adapted.getTextWithHashtags();
        if (!limits.isValidTextLength(fullText)) {
            adapted.setText(truncateText(request.getBody(), adapted.getHashtags(), limits.getMaxTextLength()));
            adapted.addNote("Text truncated to fit " + limits.getPlatform().getDisplayName() + " limit");
            adapted.setContentWasModified(true);
        }

        return adapted;
    }

    /**
     * Adapt content for YouTube Shorts
     * - Title required (max 100 chars), must include #Shorts
     * - Hashtags become tags, separate from the description
     */
    private AdaptedContent adaptForYouTube(PublishRequest request, ContentLimits limits) {
        String title = request.getTitle() != null ? request.getTitle() : firstLine(request.getBody());
        List<String> hashtags = request.getHashtags() != null ? request.getHashtags() : List.of();

        AdaptedContent adapted = AdaptedContent.builder()
                .platform(Platform.YOUTUBE_SHORTS)
                .title(ensureShortsTag(title, limits.getMaxTitleLength()))
                .text(truncateText(request.getBody(), List.of(), limits.getMaxTextLength()))
                .hashtags(new ArrayList<>())
                .tags(convertToYouTubeTags(hashtags, limits.getMaxHashtags()))
                .mediaUrls(List.copyOf(request.getMediaUrls()))
                .contentWasModified(!hashtags.isEmpty())
                .build();

        if (!hashtags.isEmpty()) {
            adapted.addNote("Hashtags converted to YouTube tags");
        }
        return adapted;
    }

    /**
     * Adapt content for a Reddit self post
     * - Title required, derived from the first line of the body when missing
     * - Hashtags dropped
     */
    private AdaptedContent adaptForReddit(PublishRequest request, ContentLimits limits) {
        String title = request.getTitle() != null && !request.getTitle().isBlank()
                ? request.getTitle()
                : firstLine(request.getBody());

        if (title == null || title.isBlank()) {
            throw new PublishRejectedException("TITLE_REQUIRED", "Reddit posts require a title");
        }

        AdaptedContent adapted = AdaptedContent.builder()
                .platform(Platform.REDDIT)
                .title(truncateTitle(title, limits.getMaxTitleLength()))
                .text(truncateText(request.getBody(), List.of(), limits.getMaxTextLength()))
                .hashtags(new ArrayList<>())
                .mediaUrls(request.getMediaUrls() != null ? List.copyOf(request.getMediaUrls()) : List.of())
                .contentWasModified(request.getHashtags() != null && !request.getHashtags().isEmpty())
                .build();

        if (adapted.isContentWasModified()) {
            adapted.addNote("Hashtags removed for Reddit");
        }
        return adapted;
    }

    /**
     * Ensure YouTube title contains #Shorts for proper categorization
     */
    private String ensureShortsTag(String title, int maxLength) {
        if (title == null || title.isEmpty()) {
            return "#Shorts";
        }

        if (title.toLowerCase().contains("#shorts")) {
            return truncateTitle(title, maxLength);
        }

        String withShorts = title + " #Shorts";
        if (withShorts.length() <= maxLength) {
            return withShorts;
        }

        int availableLength = maxLength - " #Shorts".length();
        return truncateTitle(title, availableLength) + " #Shorts";
    }

    /**
     * Convert hashtags to YouTube tags format
     * YouTube tags are without # prefix and have a total character limit
     */
    private List<String> convertToYouTubeTags(List<String> hashtags, int maxTotalChars) {
        List<String> tags = new ArrayList<>();
        int totalChars = 0;

        for (String hashtag : hashtags) {
            String tag = hashtag.startsWith("#") ? hashtag.substring(1) : hashtag;

            if (totalChars + tag.length() + 1 > maxTotalChars) { // +1 for separator
                break;
            }

            tags.add(tag);
            totalChars += tag.length() + 1;
        }

        return tags;
    }

    private String firstLine(String body) {
        if (body == null) {
            return null;
        }
        int newline = body.indexOf('\n');
        return (newline >= 0 ? body.substring(0, newline) : body).trim();
    }

    /**
     * Truncate title to max length, trying to preserve whole words
     */
    private String truncateTitle(String title, int maxLength) {
        if (title == null || title.isEmpty() || maxLength <= 0 || title.length() <= maxLength) {
            return title;
        }

        String truncated = title.substring(0, maxLength);
        int lastSpace = truncated.lastIndexOf(' ');

        if (lastSpace > maxLength * 0.7) { // Only cut at space if it's not too far back
            return truncated.substring(0, lastSpace).trim();
        }

        return truncated.trim();
    }

    /**
     * Truncate text while preserving space for inline hashtags
     */
    private String truncateText(String text, List<String> hashtags, int maxLength) {
        if (text == null) return null;

        int hashtagsLength = hashtags.stream()
                .mapToInt(h -> h.length() + 2) // +2 for # and space
                .sum();
        int reserved = hashtags.isEmpty() ? 0 : hashtagsLength + 2; // \n\n separator
        int available = Math.max(maxLength - reserved, Math.min(maxLength, 20));

        if (text.length() <= available) {
            return text;
        }
        return text.substring(0, available - 3) + "...";
    }
}
