package com.example.pulsemonitor.notification;

import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.exception.ChannelDispatchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Posts alerts as JSON to Slack incoming webhooks and generic HTTP webhooks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookChannelSender implements ChannelSender {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public Set<NotificationChannel.ChannelType> supportedTypes() {
        return Set.of(NotificationChannel.ChannelType.SLACK, NotificationChannel.ChannelType.WEBHOOK);
    }

    @Override
    public void send(NotificationChannel channel, Alert alert, int escalationLevel) throws IOException {
        if (channel instanceof NotificationChannel.Slack slack) {
            post(channel.name(), slack.webhookUrl(), Map.of(), slackPayload(slack, alert, escalationLevel));
        } else if (channel instanceof NotificationChannel.Webhook webhook) {
            post(channel.name(), webhook.url(), webhook.headers(), webhookPayload(alert, escalationLevel));
        } else {
            throw new ChannelDispatchException(channel.name(), "Unsupported channel type: " + channel.type());
        }
    }

    private void post(String channelName, String url, Map<String, String> headers, Map<String, Object> payload)
            throws IOException {
        Request.Builder request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON));
        headers.forEach(request::header);

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + channelName);
            }
            log.debug("Notification delivered to {} ({})", channelName, response.code());
        }
    }

    private Map<String, Object> slackPayload(NotificationChannel.Slack slack, Alert alert, int level) {
        String emoji = switch (alert.getSeverity()) {
            case CRITICAL -> ":rotating_light:";
            case HIGH -> ":warning:";
            case MEDIUM -> ":large_orange_diamond:";
            case LOW -> ":information_source:";
        };
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", String.format("%s *[%s] %s* (escalation level %d)\n%s\nMetric: %s = %.2f (threshold %.2f)\nID: %s",
                emoji, alert.getSeverity(), alert.getRuleName(), level, alert.getMessage(),
                alert.getMetric(), alert.getValue(), alert.getThreshold(), alert.getId()));
        payload.put("username", "Pulse Monitor");
        if (slack.channel() != null && !slack.channel().isBlank()) {
            payload.put("channel", slack.channel());
        }
        return payload;
    }

    private Map<String, Object> webhookPayload(Alert alert, int level) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert", alert);
        payload.put("escalation_level", level);
        payload.put("source", "pulse-monitor");
        return payload;
    }
}
