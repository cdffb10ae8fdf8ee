package com.example.pulsemonitor.notification;

import com.example.pulsemonitor.config.MonitorProperties.NotificationConfig.ChannelConfig;
import com.example.pulsemonitor.exception.ConfigurationException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A configured notification target. Each variant carries only the fields
 * its delivery mechanism needs.
 */
public sealed interface NotificationChannel {

    enum ChannelType {
        EMAIL, SLACK, WEBHOOK, PAGER, SMS
    }

    String name();

    boolean enabled();

    ChannelType type();

    record Email(String name, boolean enabled, String from, List<String> recipients) implements NotificationChannel {
        public ChannelType type() {
            return ChannelType.EMAIL;
        }
    }

    record Slack(String name, boolean enabled, String webhookUrl, String channel) implements NotificationChannel {
        public ChannelType type() {
            return ChannelType.SLACK;
        }
    }

    record Webhook(String name, boolean enabled, String url, Map<String, String> headers) implements NotificationChannel {
        public ChannelType type() {
            return ChannelType.WEBHOOK;
        }
    }

    record Pager(String name, boolean enabled, String routingKey) implements NotificationChannel {
        public ChannelType type() {
            return ChannelType.PAGER;
        }
    }

    record Sms(String name, boolean enabled, List<String> phoneNumbers) implements NotificationChannel {
        public ChannelType type() {
            return ChannelType.SMS;
        }
    }

    /**
     * Build a typed channel from its flat configuration.
     *
     * @throws ConfigurationException if the type is unknown or a required field is missing
     */
    static NotificationChannel from(String name, ChannelConfig config) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Channel name is required");
        }
        if (config == null || config.getType() == null || config.getType().isBlank()) {
            throw new ConfigurationException("Channel " + name + " has no type");
        }

        ChannelType type;
        try {
            type = ChannelType.valueOf(config.getType().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Channel " + name + " has unsupported type: " + config.getType());
        }

        boolean enabled = config.isEnabled();
        return switch (type) {
            case EMAIL -> new Email(name, enabled, config.getFrom(),
                    List.copyOf(nonEmpty(name, "recipients", config.getRecipients())));
            case SLACK -> new Slack(name, enabled, required(name, "webhook-url", config.getWebhookUrl()),
                    config.getChannel());
            case WEBHOOK -> new Webhook(name, enabled, required(name, "url", config.getUrl()),
                    Map.copyOf(config.getHeaders() == null ? Map.of() : config.getHeaders()));
            case PAGER -> new Pager(name, enabled, required(name, "routing-key", config.getRoutingKey()));
            case SMS -> new Sms(name, enabled,
                    List.copyOf(nonEmpty(name, "phone-numbers", config.getPhoneNumbers())));
        };
    }

    private static String required(String channel, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Channel " + channel + " requires " + field);
        }
        return value;
    }

    private static List<String> nonEmpty(String channel, String field, List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new ConfigurationException("Channel " + channel + " requires at least one entry in " + field);
        }
        return values;
    }
}
