package com.postpilot.scheduler.entity;

import java.util.EnumSet;
import java.util.Set;

public enum PublishJobStatus {
    SCHEDULED,
    PUBLISHING,
    PUBLISHED,
    RETRYING,
    FAILED,
    CANCELLED;

    /** States a dispatch scan may claim from, and the only ones a cancel is accepted in. */
    public static final Set<PublishJobStatus> CLAIMABLE = EnumSet.of(SCHEDULED, RETRYING);

    public boolean isTerminal() {
        return this == PUBLISHED || this == FAILED || this == CANCELLED;
    }
}
