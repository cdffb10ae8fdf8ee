package com.example.pulsemonitor.exception;

/**
 * An OS or runtime probe failed while sampling metrics.
 */
public class CollectionException extends RuntimeException {

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
