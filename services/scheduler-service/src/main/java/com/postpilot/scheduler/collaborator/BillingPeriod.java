package com.postpilot.scheduler.collaborator;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingPeriod {
    /** Stable identifier, part of every usage counter key. */
    private String id;
    private OffsetDateTime start;
    /** Exclusive. */
    private OffsetDateTime end;
}
