package com.postpilot.connector.model;

import lombok.Getter;

@Getter
public enum Platform {
    TWITTER(
        "X (Twitter)",
        280,        // post length
        5,          // hashtags before the post reads as spam
        0,          // no title
        true,       // hashtags in text
        false       // media optional
    ),
    THREADS(
        "Threads",
        500,
        5,
        0,
        true,
        false
    ),
    LINKEDIN(
        "LinkedIn",
        3000,       // commentary length
        10,
        0,
        true,
        false
    ),
    INSTAGRAM(
        "Instagram",
        2200,       // caption length
        30,         // hard limit enforced by the API
        0,
        true,
        true        // image required
    ),
    FACEBOOK(
        "Facebook Page",
        63206,
        10,
        0,
        true,
        false
    ),
    TIKTOK(
        "TikTok",
        2200,
        30,
        90,         // photo post title
        true,
        true        // photo or video required
    ),
    YOUTUBE_SHORTS(
        "YouTube Shorts",
        5000,       // description length
        500,        // tags total chars (not count)
        100,        // title length
        false,      // tags separate from description
        true        // video required
    ),
    REDDIT(
        "Reddit",
        40000,      // self post body
        0,          // hashtags are noise on forums
        300,        // title length, required
        false,
        false
    );

    private final String displayName;
    private final int maxTextLength;
    private final int maxHashtags;
    private final int maxTitleLength;
    private final boolean hashtagsInText;
    private final boolean mediaRequired;

    Platform(String displayName, int maxTextLength, int maxHashtags, int maxTitleLength,
             boolean hashtagsInText, boolean mediaRequired) {
        this.displayName = displayName;
        this.maxTextLength = maxTextLength;
        this.maxHashtags = maxHashtags;
        this.maxTitleLength = maxTitleLength;
        this.hashtagsInText = hashtagsInText;
        this.mediaRequired = mediaRequired;
    }

    public ContentLimits toContentLimits() {
        return ContentLimits.builder()
                .platform(this)
                .maxTextLength(maxTextLength)
                .maxHashtags(maxHashtags)
                .maxTitleLength(maxTitleLength)
                .hashtagsInText(hashtagsInText)
                .mediaRequired(mediaRequired)
                .build();
    }
}
