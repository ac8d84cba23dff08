package com.postpilot.connector.publisher;

import com.postpilot.connector.dto.PublishRequest;
import com.postpilot.connector.dto.PublishResult;
import com.postpilot.connector.model.Platform;
import com.postpilot.connector.service.AccessTokenStore;
import com.postpilot.connector.service.ContentAdapterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LinkedInPublisherTest {

    private static final Instant FIRST_ATTEMPT = Instant.parse("2026-10-19T12:00:00Z");

    private final ContentAdapterService adapter = new ContentAdapterService();
    private StubExchange exchange;
    private LinkedInPublisher publisher;

    @BeforeEach
    void setUp() {
        exchange = new StubExchange();
        AccessTokenStore tokens = mock(AccessTokenStore.class);
        when(tokens.findToken(Platform.LINKEDIN, PublisherFixtures.ACCOUNT_ID)).thenReturn(Optional.of("tok"));
        publisher = new LinkedInPublisher(exchange.builder(), tokens, adapter);
    }

    private static PublishRequest retry() {
        return PublisherFixtures.request(Platform.LINKEDIN).attempt(3).firstAttemptAt(FIRST_ATTEMPT).build();
    }

    private String postsListing(String id, Instant created) {
        String commentary = adapter.adaptForPlatform(retry()).getTextWithHashtags().replace("\n", "\\n");
        return "{\"elements\":[{\"id\":\"" + id + "\",\"commentary\":\"" + commentary + "\"," +
                "\"createdAt\":" + created.toEpochMilli() + "}]}";
    }

    @Test
    void firstAttemptCreatesThePost() {
        exchange.respondWithHeader(HttpStatus.CREATED, "x-restli-id", "urn:li:share:1");

        PublishResult result = publisher.publish(PublisherFixtures.request(Platform.LINKEDIN).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPlatformPostId()).isEqualTo("urn:li:share:1");
        assertThat(exchange.requests()).hasSize(1);
        assertThat(exchange.requests().get(0).method()).isEqualTo(HttpMethod.POST);
    }

    @Test
    void retryReusesPostFromAnEarlierAttempt() {
        exchange.respond(HttpStatus.OK, postsListing("urn:li:share:9", FIRST_ATTEMPT.plusSeconds(20)));

        PublishResult result = publisher.publish(retry());

        assertThat(result.getPlatformPostId()).isEqualTo("urn:li:share:9");
        assertThat(result.getPlatformUrl()).isEqualTo("https://www.linkedin.com/feed/update/urn:li:share:9/");
        assertThat(exchange.requests()).hasSize(1);
        assertThat(exchange.requests().get(0).method()).isEqualTo(HttpMethod.GET);
    }

    @Test
    void identicalOlderPostIsARepeatNotThisJob() {
        exchange.respond(HttpStatus.OK, postsListing("urn:li:share:9", FIRST_ATTEMPT.minus(Duration.ofDays(7))))
                .respondWithHeader(HttpStatus.CREATED, "x-restli-id", "urn:li:share:10");

        PublishResult result = publisher.publish(retry());

        assertThat(result.getPlatformPostId()).isEqualTo("urn:li:share:10");
        assertThat(exchange.requests()).hasSize(2);
        assertThat(exchange.requests().get(1).method()).isEqualTo(HttpMethod.POST);
    }
}
