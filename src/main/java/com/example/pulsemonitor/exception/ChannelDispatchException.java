package com.example.pulsemonitor.exception;

import lombok.Getter;

/**
 * A notification channel could not deliver, either immediately or after
 * exhausting its retries.
 */
@Getter
public class ChannelDispatchException extends RuntimeException {

    private final String channel;
    private final int attempts;

    public ChannelDispatchException(String channel, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
        this.attempts = attempts;
    }

    public ChannelDispatchException(String channel, String message) {
        this(channel, 0, message, null);
    }
}
