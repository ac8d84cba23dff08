package com.postpilot.scheduler.collaborator;

import com.postpilot.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A tenant's connected account on one platform.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DestinationAccount {
    private UUID id;
    private UUID tenantId;
    private Platform platform;
    private String externalAccountId;
    private String handle;
    /** False once the platform connection has been revoked or has expired. */
    private boolean valid;
}
