package com.postpilot.scheduler.counter;

public class CounterStoreException extends RuntimeException {

    public CounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
