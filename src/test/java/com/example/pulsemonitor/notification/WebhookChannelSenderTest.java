package com.example.pulsemonitor.notification;

import com.example.pulsemonitor.config.AppConfig;
import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.domain.Severity;
import com.example.pulsemonitor.exception.ChannelDispatchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookChannelSenderTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private final List<Request> requests = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();
    private int responseCode;
    private WebhookChannelSender sender;

    @BeforeEach
    void setUp() {
        responseCode = 200;
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Request request = chain.request();
                    Buffer buffer = new Buffer();
                    request.body().writeTo(buffer);
                    requests.add(request);
                    bodies.add(buffer.readUtf8());
                    return new Response.Builder()
                            .request(request)
                            .protocol(Protocol.HTTP_1_1)
                            .code(responseCode)
                            .message(responseCode == 200 ? "OK" : "Error")
                            .body(ResponseBody.create("ok", MediaType.get("text/plain")))
                            .build();
                })
                .build();
        sender = new WebhookChannelSender(client, objectMapper);
    }

    private static Alert alert() {
        return Alert.builder()
                .id("alert-42")
                .ruleId("high-cpu")
                .ruleName("High CPU usage")
                .severity(Severity.CRITICAL)
                .message("cpu above 90 for 3 samples")
                .metric("cpu")
                .value(97.5)
                .threshold(90)
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @Test
    void slackPayloadCarriesSeverityAndChannel() throws Exception {
        sender.send(new NotificationChannel.Slack("slack", true, "https://hooks.example.com/slack", "#ops"),
                alert(), 2);

        assertEquals(1, requests.size());
        assertEquals("POST", requests.get(0).method());
        assertEquals("https://hooks.example.com/slack", requests.get(0).url().toString());

        JsonNode payload = objectMapper.readTree(bodies.get(0));
        String text = payload.get("text").asText();
        assertTrue(text.startsWith(":rotating_light: *[CRITICAL] High CPU usage* (escalation level 2)"));
        assertTrue(text.contains("Metric: cpu = 97.50 (threshold 90.00)"));
        assertTrue(text.contains("ID: alert-42"));
        assertEquals("Pulse Monitor", payload.get("username").asText());
        assertEquals("#ops", payload.get("channel").asText());
    }

    @Test
    void webhookSendsHeadersAndAlertDocument() throws Exception {
        sender.send(new NotificationChannel.Webhook("hook", true, "https://example.com/alerts",
                Map.of("X-Source", "pulse")), alert(), 1);

        assertEquals("pulse", requests.get(0).header("X-Source"));
        JsonNode payload = objectMapper.readTree(bodies.get(0));
        assertEquals("alert-42", payload.get("alert").get("id").asText());
        assertEquals("2024-05-01T10:00:00Z", payload.get("alert").get("timestamp").asText());
        assertEquals(1, payload.get("escalation_level").asInt());
        assertEquals("pulse-monitor", payload.get("source").asText());
    }

    @Test
    void nonSuccessStatusIsAnError() {
        responseCode = 503;

        IOException e = assertThrows(IOException.class, () -> sender.send(
                new NotificationChannel.Webhook("hook", true, "https://example.com/alerts", Map.of()), alert(), 1));
        assertEquals("HTTP 503 from hook", e.getMessage());
    }

    @Test
    void rejectsChannelsItDoesNotServe() {
        assertThrows(ChannelDispatchException.class, () -> sender.send(
                new NotificationChannel.Pager("pager", true, "key"), alert(), 1));
        assertTrue(requests.isEmpty());
    }
}
