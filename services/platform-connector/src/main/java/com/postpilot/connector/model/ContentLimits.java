package com.postpilot.connector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentLimits {
    private Platform platform;
    private int maxTextLength;
    private int maxHashtags;
    private int maxTitleLength;
    private boolean hashtagsInText;
    private boolean mediaRequired;

    /**
     * Check if text length is valid
     */
    public boolean isValidTextLength(String text) {
        return text == null || text.length() <= maxTextLength;
    }

    /**
     * Check if number of hashtags is valid
     */
    public boolean isValidHashtagCount(int count) {
        return count >= 0 && count <= maxHashtags;
    }

    public boolean hasRequiredMedia(List<String> mediaUrls) {
        return !mediaRequired || (mediaUrls != null && !mediaUrls.isEmpty());
    }
}
