package com.postpilot.connector.publisher;

import lombok.Getter;

/**
 * Raised inside a publisher when the post can never succeed as-is: missing credentials,
 * content the platform cannot accept, a destination that no longer exists.
 */
@Getter
public class PublishRejectedException extends RuntimeException {

    private final String errorCode;

    public PublishRejectedException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
