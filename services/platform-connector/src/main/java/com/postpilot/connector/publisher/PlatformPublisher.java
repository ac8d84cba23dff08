package com.postpilot.connector.publisher;

import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.model.Platform;

/**
 * Publishing capability shared by every supported platform. The set of variants is closed;
 * use {@link PlatformPublishers} to select one.
 */
public sealed interface PlatformPublisher permits AbstractPlatformPublisher {

    /**
     * Get the platform this publisher handles
     */
    Platform getPlatform();

    /**
     * Publish the content under the request's idempotency key. Never throws: every failure is
     * reported as a retryable or permanent {@link PublishResult}.
     */
    PublishResult publish(PublishRequest request);
}
