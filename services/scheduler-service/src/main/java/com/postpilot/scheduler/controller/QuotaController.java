package com.postpilot.scheduler.controller;

import com.postpilot.scheduler.dto.QuotaAmountRequest;
import com.postpilot.scheduler.exception.ValidationException;
import com.postpilot.scheduler.quota.QuotaDecision;
import com.postpilot.scheduler.quota.QuotaService;
import com.postpilot.scheduler.quota.UsageMetric;
import com.postpilot.scheduler.quota.UsageSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Quota access for the content generation path, which accounts its own metrics against the
 * same counters the dispatcher uses.
 */
@RestController
@RequestMapping("/api/v1/quota/{tenantId}")
@RequiredArgsConstructor
public class QuotaController {

    private final QuotaService quotaService;

    @GetMapping("/usage")
    public ResponseEntity<UsageSummary> getUsage(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(quotaService.getUsage(tenantId));
    }

    @PostMapping("/{metric}/check")
    public ResponseEntity<QuotaDecision> check(
            @PathVariable UUID tenantId,
            @PathVariable UsageMetric metric,
            @RequestBody(required = false) QuotaAmountRequest request
    ) {
        return toResponse(quotaService.check(tenantId, metric, amount(request)));
    }

    @PostMapping("/{metric}/reserve")
    public ResponseEntity<QuotaDecision> reserve(
            @PathVariable UUID tenantId,
            @PathVariable UsageMetric metric,
            @RequestBody(required = false) QuotaAmountRequest request
    ) {
        return toResponse(quotaService.checkAndReserve(tenantId, metric, amount(request)));
    }

    @PostMapping("/{metric}/commit")
    public ResponseEntity<Void> commit(
            @PathVariable UUID tenantId,
            @PathVariable UsageMetric metric,
            @RequestBody(required = false) QuotaAmountRequest request
    ) {
        quotaService.commit(tenantId, metric, amount(request), periodId(request));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{metric}/release")
    public ResponseEntity<Void> release(
            @PathVariable UUID tenantId,
            @PathVariable UsageMetric metric,
            @RequestBody(required = false) QuotaAmountRequest request
    ) {
        quotaService.release(tenantId, metric, amount(request), periodId(request));
        return ResponseEntity.noContent().build();
    }

    private static long amount(QuotaAmountRequest request) {
        long amount = request != null && request.getAmount() != null ? request.getAmount() : 1L;
        if (amount <= 0) {
            throw new ValidationException("amount must be positive");
        }
        return amount;
    }

    private static String periodId(QuotaAmountRequest request) {
        return request != null ? request.getPeriodId() : null;
    }

    private static ResponseEntity<QuotaDecision> toResponse(QuotaDecision decision) {
        if (decision.isAllowed()) {
            return ResponseEntity.ok(decision);
        }
        HttpStatus status = QuotaDecision.UNAVAILABLE.equals(decision.getReason())
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.TOO_MANY_REQUESTS;
        return ResponseEntity.status(status).body(decision);
    }
}
