package com.example.pulsemonitor.notification;

import com.example.pulsemonitor.domain.Alert;

import java.io.IOException;
import java.util.Set;

/**
 * Delivers an alert over one kind of channel. A send that returns normally
 * counts as delivered; any exception counts as a failed attempt.
 */
public interface ChannelSender {

    Set<NotificationChannel.ChannelType> supportedTypes();

    void send(NotificationChannel channel, Alert alert, int escalationLevel) throws IOException;
}
