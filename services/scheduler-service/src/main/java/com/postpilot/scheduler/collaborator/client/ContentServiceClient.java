package com.postpilot.scheduler.collaborator.client;

import com.postpilot.scheduler.collaborator.ContentPiece;
import com.postpilot.scheduler.collaborator.ContentSource;
import com.postpilot.scheduler.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

@Component
@Slf4j
public class ContentServiceClient implements ContentSource {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient client;

    public ContentServiceClient(WebClient.Builder webClientBuilder,
                                @Value("${content-service.url:http://localhost:8083}") String contentServiceUrl) {
        this.client = webClientBuilder.clone().baseUrl(contentServiceUrl).build();
    }

    @Override
    public Optional<ContentPiece> getContent(UUID contentPieceId) {
        try {
            return client.get()
                    .uri("/api/v1/content/{id}", contentPieceId)
                    .retrieve()
                    .bodyToMono(ContentPiece.class)
                    .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                    .timeout(TIMEOUT)
                    .blockOptional();
        } catch (Exception e) {
            log.warn("Content lookup for {} failed: {}", contentPieceId, e.getMessage());
            throw new CollaboratorUnavailableException("Content service unavailable", e);
        }
    }
}
