package com.postpilot.scheduler.exception;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(UUID jobId) {
        super("Publish job not found: " + jobId);
    }
}
