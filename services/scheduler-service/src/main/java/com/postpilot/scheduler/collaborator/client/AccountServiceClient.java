package com.postpilot.scheduler.collaborator.client;

import com.postpilot.scheduler.collaborator.DestinationAccount;
import com.postpilot.scheduler.collaborator.DestinationAccountSource;
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
public class AccountServiceClient implements DestinationAccountSource {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient client;

    public AccountServiceClient(WebClient.Builder webClientBuilder,
                                @Value("${account-service.url:http://localhost:8081}") String accountServiceUrl) {
        this.client = webClientBuilder.clone().baseUrl(accountServiceUrl).build();
    }

    @Override
    public Optional<DestinationAccount> getAccount(UUID destinationAccountId) {
        try {
            return client.get()
                    .uri("/api/v1/accounts/{id}", destinationAccountId)
                    .retrieve()
                    .bodyToMono(DestinationAccount.class)
                    .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                    .timeout(TIMEOUT)
                    .blockOptional();
        } catch (Exception e) {
            log.warn("Account lookup for {} failed: {}", destinationAccountId, e.getMessage());
            throw new CollaboratorUnavailableException("Account service unavailable", e);
        }
    }
}
