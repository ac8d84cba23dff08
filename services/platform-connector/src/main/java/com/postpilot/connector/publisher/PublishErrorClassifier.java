package com.postpilot.connector.publisher;

import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.model.Platform;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps anything thrown during a publish call onto the retryable/permanent split.
 * Timeouts, network errors, 5xx and throttling are retryable; auth failures, rejected
 * content and missing resources are permanent.
 */
public final class PublishErrorClassifier {

    private PublishErrorClassifier() {
    }

    public static PublishResult classify(Platform platform, Throwable error) {
        Throwable current = Exceptions.unwrap(error);
        while (current != null) {
            if (current instanceof PublishRejectedException rejected) {
                return PublishResult.permanent(platform, rejected.getErrorCode(), rejected.getMessage());
            }
            if (current instanceof WebClientResponseException response) {
                return classifyStatus(platform, response.getStatusCode().value(), response.getMessage());
            }
            if (current instanceof TimeoutException) {
                return PublishResult.retryable(platform, "TIMEOUT",
                        platform.getDisplayName() + " did not respond in time");
            }
            if (current instanceof WebClientRequestException || current instanceof IOException) {
                return PublishResult.retryable(platform, "NETWORK_ERROR", current.getMessage());
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return PublishResult.retryable(platform, "INTERNAL_ERROR", error.getMessage());
    }

    public static PublishResult classifyStatus(Platform platform, int status, String message) {
        if (status == 429) {
            return PublishResult.retryable(platform, "RATE_LIMITED", message);
        }
        if (status == 408) {
            return PublishResult.retryable(platform, "TIMEOUT", message);
        }
        if (status >= 500) {
            return PublishResult.retryable(platform, "SERVER_ERROR_" + status, message);
        }
        return switch (status) {
            case 401, 403 -> PublishResult.permanent(platform, "AUTH_REVOKED", message);
            case 404, 410 -> PublishResult.permanent(platform, "NOT_FOUND", message);
            case 400, 422 -> PublishResult.permanent(platform, "CONTENT_REJECTED", message);
            default -> PublishResult.permanent(platform, "HTTP_" + status, message);
        };
    }
}
