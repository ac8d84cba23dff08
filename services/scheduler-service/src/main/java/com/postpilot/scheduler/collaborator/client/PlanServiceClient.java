package com.postpilot.scheduler.collaborator.client;

import com.postpilot.scheduler.collaborator.TenantPlan;
import com.postpilot.scheduler.collaborator.TenantPlanSource;
import com.postpilot.scheduler.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

@Component
@Slf4j
public class PlanServiceClient implements TenantPlanSource {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient client;

    public PlanServiceClient(WebClient.Builder webClientBuilder,
                             @Value("${billing-service.url:http://localhost:8089}") String billingServiceUrl) {
        this.client = webClientBuilder.clone().baseUrl(billingServiceUrl).build();
    }

    @Override
    public TenantPlan getPlan(UUID tenantId) {
        try {
            return client.get()
                    .uri("/api/v1/subscriptions/{tenantId}/plan", tenantId)
                    .retrieve()
                    .bodyToMono(TenantPlan.class)
                    .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                    .timeout(TIMEOUT)
                    .blockOptional()
                    .orElseGet(() -> TenantPlan.none(tenantId));
        } catch (Exception e) {
            log.warn("Plan lookup for tenant {} failed: {}", tenantId, e.getMessage());
            throw new CollaboratorUnavailableException("Billing service unavailable", e);
        }
    }
}
