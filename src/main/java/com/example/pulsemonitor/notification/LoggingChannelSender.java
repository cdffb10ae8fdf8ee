package com.example.pulsemonitor.notification;

import com.example.pulsemonitor.domain.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Writes email, pager and SMS notifications to the log. Provider
 * integrations plug in as further {@link ChannelSender}s.
 */
@Slf4j
@Component
public class LoggingChannelSender implements ChannelSender {

    @Override
    public Set<NotificationChannel.ChannelType> supportedTypes() {
        return Set.of(NotificationChannel.ChannelType.EMAIL,
                NotificationChannel.ChannelType.PAGER,
                NotificationChannel.ChannelType.SMS);
    }

    @Override
    public void send(NotificationChannel channel, Alert alert, int escalationLevel) {
        String target;
        if (channel instanceof NotificationChannel.Email email) {
            target = String.join(", ", email.recipients());
        } else if (channel instanceof NotificationChannel.Pager pager) {
            target = "routing key " + pager.routingKey();
        } else if (channel instanceof NotificationChannel.Sms sms) {
            target = String.join(", ", sms.phoneNumbers());
        } else {
            target = channel.name();
        }
        log.info("[{}] -> {}: [{}] {} (level {}, alert {})", channel.type(), target,
                alert.getSeverity(), alert.getMessage(), escalationLevel, alert.getId());
    }
}
