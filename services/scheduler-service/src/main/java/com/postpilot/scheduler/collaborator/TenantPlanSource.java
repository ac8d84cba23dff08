package com.postpilot.scheduler.collaborator;

import java.util.UUID;

public interface TenantPlanSource {

    /**
     * @return the tenant's plan, or {@link TenantPlan#none(UUID)} when the tenant has none
     */
    TenantPlan getPlan(UUID tenantId);
}
