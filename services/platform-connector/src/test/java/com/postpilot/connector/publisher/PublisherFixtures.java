package com.postpilot.connector.publisher;

import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.model.Platform;

import java.util.List;
import java.util.UUID;

final class PublisherFixtures {

    static final UUID ACCOUNT_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");

    private PublisherFixtures() {
    }

    static PublishRequest.PublishRequestBuilder request(Platform platform) {
        return PublishRequest.builder()
                .jobId(UUID.randomUUID())
                .tenantId(UUID.randomUUID())
                .platform(platform)
                .destinationAccountId(ACCOUNT_ID)
                .externalAccountId("ext-1")
                .handle("postpilot")
                .title("Launch day")
                .body("We are live")
                .hashtags(List.of("launch"))
                .mediaUrls(List.of())
                .idempotencyKey("key-123");
    }
}
