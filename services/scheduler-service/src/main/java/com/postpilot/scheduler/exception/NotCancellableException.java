package com.postpilot.scheduler.exception;

import com.postpilot.scheduler.entity.PublishJobStatus;

import java.util.UUID;

/**
 * Thrown when a cancel arrives after the job has been claimed or has finished.
 */
public class NotCancellableException extends RuntimeException {

    private final PublishJobStatus status;

    public NotCancellableException(UUID jobId, PublishJobStatus status) {
        super("Publish job " + jobId + " cannot be cancelled in status " + status);
        this.status = status;
    }

    public PublishJobStatus getStatus() {
        return status;
    }
}
