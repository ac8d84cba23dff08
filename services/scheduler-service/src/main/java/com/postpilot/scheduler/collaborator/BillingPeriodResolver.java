package com.postpilot.scheduler.collaborator;

import java.time.Instant;
import java.util.UUID;

public interface BillingPeriodResolver {

    BillingPeriod currentPeriod(UUID tenantId, Instant now);
}
