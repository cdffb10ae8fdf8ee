package com.example.pulsemonitor.notification;

import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.domain.Severity;
import com.example.pulsemonitor.event.ChannelDispatchFailedEvent;
import com.example.pulsemonitor.event.ConfigurationRejectedEvent;
import com.example.pulsemonitor.exception.ChannelDispatchException;
import com.example.pulsemonitor.exception.ConfigurationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Notification Service - delivers alerts to named channels.
 *
 * Channels are sent to in parallel and each one retries independently with
 * a linear backoff; one failing channel never affects the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    /** Pause between attempts; replaced in tests. */
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final MonitorProperties properties;
    private final List<ChannelSender> senders;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    @Qualifier("notificationExecutor")
    private final Executor notificationExecutor;

    private final Map<String, NotificationChannel> channels = new ConcurrentHashMap<>();
    private Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

    @PostConstruct
    public void loadConfiguredChannels() {
        properties.getNotifications().getChannels().forEach((name, config) -> {
            try {
                registerChannel(NotificationChannel.from(name, config));
            } catch (ConfigurationException e) {
                log.error("Notification channel {} rejected: {}", name, e.getMessage());
                eventPublisher.publishEvent(new ConfigurationRejectedEvent("channel", name, e.getMessage()));
            }
        });
        log.info("Loaded {} notification channels", channels.size());
    }

    public void registerChannel(NotificationChannel channel) {
        if (channel == null || channel.name() == null || channel.name().isBlank()) {
            throw new ConfigurationException("Channel name is required");
        }
        channels.put(channel.name(), channel);
        log.debug("Registered {} channel {}", channel.type(), channel.name());
    }

    public boolean removeChannel(String name) {
        return channels.remove(name) != null;
    }

    public Map<String, NotificationChannel> getChannels() {
        return Map.copyOf(channels);
    }

    /**
     * Deliver an alert to every named channel and wait for all of them.
     * Failures are reported per channel, never thrown.
     */
    public List<NotificationOutcome> send(Alert alert, int escalationLevel, List<String> channelNames) {
        return sendAsync(alert, escalationLevel, channelNames).join();
    }

    public CompletableFuture<List<NotificationOutcome>> sendAsync(Alert alert, int escalationLevel,
                                                                  List<String> channelNames) {
        List<CompletableFuture<NotificationOutcome>> pending = channelNames.stream()
                .map(name -> dispatch(name, alert, escalationLevel))
                .toList();

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(v -> pending.stream().map(CompletableFuture::join).toList())
                .whenComplete((outcomes, e) -> {
                    if (outcomes != null) {
                        long delivered = outcomes.stream().filter(NotificationOutcome::success).count();
                        log.info("Alert {} level {}: delivered to {}/{} channels",
                                alert.getId(), escalationLevel, delivered, outcomes.size());
                    }
                });
    }

    private CompletableFuture<NotificationOutcome> dispatch(String channelName, Alert alert, int escalationLevel) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> deliver(channelName, alert, escalationLevel), notificationExecutor)
                    .exceptionally(e -> NotificationOutcome.failed(channelName, 0, e.getMessage()));
        } catch (RejectedExecutionException e) {
            log.error("Notification executor rejected delivery to {} for alert {}: {}", channelName, alert.getId(),
                    e.getMessage());
            record(channelName, "rejected");
            return CompletableFuture.completedFuture(
                    NotificationOutcome.failed(channelName, 0, "Notification executor saturated"));
        }
    }

    /**
     * Send a synthetic alert through the named channel.
     */
    public boolean testChannel(String name) {
        Alert probe = Alert.builder()
                .id("test-" + UUID.randomUUID())
                .ruleId("channel-test")
                .ruleName("Channel test")
                .severity(Severity.LOW)
                .message("Test notification from Pulse Monitor")
                .metric("test")
                .timestamp(clock.instant())
                .build();
        return deliver(name, probe, 0).success();
    }

    NotificationOutcome deliver(String channelName, Alert alert, int escalationLevel) {
        NotificationChannel channel = channels.get(channelName);
        if (channel == null) {
            return rejected(channelName, "Unknown channel");
        }
        if (!channel.enabled()) {
            return rejected(channelName, "Channel disabled");
        }
        Optional<ChannelSender> sender = senders.stream()
                .filter(s -> s.supportedTypes().contains(channel.type()))
                .findFirst();
        if (sender.isEmpty()) {
            return rejected(channelName, "No sender for channel type " + channel.type());
        }

        MonitorProperties.NotificationConfig config = properties.getNotifications();
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sender.get().send(channel, alert, escalationLevel);
                record(channelName, "delivered");
                return NotificationOutcome.delivered(channelName, attempt);
            } catch (Exception e) {
                lastError = e;
                log.warn("Delivery to {} failed (attempt {}/{}): {}", channelName, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(config.getRetryBaseDelay().multipliedBy(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return exhausted(channelName, alert, attempt, "Interrupted during retry backoff", e);
                }
            }
        }
        return exhausted(channelName, alert, maxAttempts, lastError.getMessage(), lastError);
    }

    private NotificationOutcome rejected(String channelName, String reason) {
        log.warn("Cannot notify {}: {}", channelName, reason);
        record(channelName, "rejected");
        return NotificationOutcome.failed(channelName, 0, reason);
    }

    private NotificationOutcome exhausted(String channelName, Alert alert, int attempts, String error,
                                          Throwable cause) {
        log.error("Giving up on {} for alert {} after {} attempts: {}", channelName, alert.getId(), attempts, error);
        record(channelName, "failed");
        ChannelDispatchException failure = new ChannelDispatchException(channelName, attempts,
                "Delivery to " + channelName + " failed after " + attempts + " attempts: " + error, cause);
        eventPublisher.publishEvent(new ChannelDispatchFailedEvent(
                alert.getId(), channelName, attempts, error, clock.instant(), failure));
        return NotificationOutcome.failed(channelName, attempts, error);
    }

    private void record(String channel, String outcome) {
        Counter.builder("pulse.notifications")
                .tag("channel", channel)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }
}
