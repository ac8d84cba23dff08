package com.postpilot.connector.dto;

import com.postpilot.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a single publish attempt. Publishers never throw; every error is folded into
 * one of the three outcomes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {
    private Platform platform;
    private Outcome outcome;
    private String platformPostId;
    private String platformUrl;
    private String errorCode;
    private String errorMessage;

    public enum Outcome {
        SUCCESS,
        RETRYABLE_FAILURE,
        PERMANENT_FAILURE
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isRetryable() {
        return outcome == Outcome.RETRYABLE_FAILURE;
    }

    /**
     * Error message in the {@code [CODE] message} form stored on the job
     */
    public String describeError() {
        return String.format("[%s] %s", errorCode, errorMessage);
    }

    public static PublishResult success(Platform platform, String platformPostId, String platformUrl) {
        return PublishResult.builder()
                .platform(platform)
                .outcome(Outcome.SUCCESS)
                .platformPostId(platformPostId)
                .platformUrl(platformUrl)
                .build();
    }

    public static PublishResult retryable(Platform platform, String errorCode, String errorMessage) {
        return PublishResult.builder()
                .platform(platform)
                .outcome(Outcome.RETRYABLE_FAILURE)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }

    public static PublishResult permanent(Platform platform, String errorCode, String errorMessage) {
        return PublishResult.builder()
                .platform(platform)
                .outcome(Outcome.PERMANENT_FAILURE)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }
}
