package com.postpilot.scheduler.exception;

/**
 * A content, account or plan lookup failed for a reason other than "not found".
 */
public class CollaboratorUnavailableException extends RuntimeException {

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
