package com.example.pulsemonitor.event;

import com.example.pulsemonitor.exception.ChannelDispatchException;

import java.time.Instant;

/**
 * A channel gave up on an alert after exhausting its retries. {@code failure}
 * carries the last delivery error as its cause.
 */
public record ChannelDispatchFailedEvent(String alertId, String channel, int attempts, String error, Instant timestamp,
                                         ChannelDispatchException failure) {
}
