package com.postpilot.scheduler.exception;

import com.postpilot.scheduler.quota.QuotaDecision;

public class QuotaExceededException extends RuntimeException {

    private final QuotaDecision decision;

    public QuotaExceededException(QuotaDecision decision) {
        super(QuotaDecision.UNAVAILABLE.equals(decision.getReason())
                ? "Quota for " + decision.getMetric() + " cannot be checked right now"
                : "Quota for " + decision.getMetric() + " exhausted: " + decision.getCurrent()
                        + " of " + decision.getLimit() + " used");
        this.decision = decision;
    }

    public QuotaDecision getDecision() {
        return decision;
    }
}
