package com.example.pulsemonitor.exception;

import lombok.Getter;

/**
 * Training was attempted with fewer usable points than the configured minimum.
 */
@Getter
public class InsufficientDataException extends RuntimeException {

    private final String metric;
    private final int available;
    private final int required;

    public InsufficientDataException(String metric, int available, int required) {
        super(String.format("Insufficient training data for %s: %d < %d", metric, available, required));
        this.metric = metric;
        this.available = available;
        this.required = required;
    }
}
