package com.postpilot.connector.dto;

import com.postpilot.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A content piece after it was fitted to one platform's limits, ready to be sent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdaptedContent {
    private Platform platform;
    private String title;
    private String text;
    private List<String> hashtags;
    private List<String> mediaUrls;

    /** Video tags, used instead of inline hashtags where the platform has them. */
    private List<String> tags;

    private boolean contentWasModified;

    @Builder.Default
    private List<String> adaptationNotes = new ArrayList<>();

    public void addNote(String note) {
        if (adaptationNotes == null) {
            adaptationNotes = new ArrayList<>();
        }
        adaptationNotes.add(note);
    }

    public String firstMediaUrl() {
        return mediaUrls == null || mediaUrls.isEmpty() ? null : mediaUrls.get(0);
    }

    /**
     * The post text as the platform will show it, with hashtags appended on their own
     * paragraph when the platform renders them inline.
     */
    public String getTextWithHashtags() {
        if (hashtags == null || hashtags.isEmpty() || !platform.isHashtagsInText()) {
            return text;
        }
        String tagLine = hashtags.stream()
                .map(tag -> tag.startsWith("#") ? tag : "#" + tag)
                .collect(Collectors.joining(" "));
        if (text == null || text.isEmpty()) {
            return tagLine;
        }
        String separator = text.endsWith("\n") ? "" : "\n\n";
        return (text + separator + tagLine).trim();
    }
}
