package com.example.pulsemonitor.notification;

/**
 * Result of delivering one alert to one channel.
 *
 * @param attempts 0 when the channel was rejected before any delivery attempt
 */
public record NotificationOutcome(String channel, boolean success, int attempts, String error) {

    public static NotificationOutcome delivered(String channel, int attempts) {
        return new NotificationOutcome(channel, true, attempts, null);
    }

    public static NotificationOutcome failed(String channel, int attempts, String error) {
        return new NotificationOutcome(channel, false, attempts, error);
    }
}
