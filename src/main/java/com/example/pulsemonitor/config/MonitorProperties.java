package com.example.pulsemonitor.config;

import com.example.pulsemonitor.domain.AlertRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the monitoring engine.
 * Maps to the 'pulse-monitor' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pulse-monitor")
public class MonitorProperties {

    private CollectorConfig collector = new CollectorConfig();
    private StorageConfig storage = new StorageConfig();
    private HealthConfig health = new HealthConfig();
    private AnomalyConfig anomaly = new AnomalyConfig();
    private PredictionConfig prediction = new PredictionConfig();
    private AlertingConfig alerting = new AlertingConfig();
    private NotificationConfig notifications = new NotificationConfig();

    @Data
    public static class CollectorConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
        /** Window over which process CPU time is compared with wall time. */
        private Duration cpuSampleWindow = Duration.ofMillis(100);
        private String diskPath = "/";
        private String latencyProbeHost = "";
        private int latencyProbePort = 443;
        private int latencyProbeTimeoutMs = 2000;
    }

    @Data
    public static class StorageConfig {
        private int maxEntries = 10_000;
        private Duration retention = Duration.ofDays(7);
        /**
         * How long resolved alerts stay queryable after resolution. Unset means
         * twice {@link #retention}.
         */
        private Duration resolvedAlertRetention;
        private Duration cleanupInterval = Duration.ofHours(1);
        private Duration aggregationBucket = Duration.ofSeconds(60);
        private boolean cleanupEnabled = true;

        public Duration effectiveResolvedAlertRetention() {
            return resolvedAlertRetention != null ? resolvedAlertRetention : retention.multipliedBy(2);
        }
    }

    @Data
    public static class HealthConfig {
        private Map<String, Band> thresholds = new LinkedHashMap<>();

        @Data
        public static class Band {
            private double degraded;
            private double unhealthy;
            private double critical;
        }
    }

    @Data
    public static class AnomalyConfig {
        private boolean enabled = true;
        private double sensitivity = 2.5;
        private int minTrainingPoints = 50;
        private int maxSeasonLength = 24;
        private Duration trainingWindow = Duration.ofDays(1);
        private Duration retrainInterval = Duration.ofHours(1);
        /** Metrics modelled with a trend model instead of seasonal/statistical. */
        private List<String> trendMetrics = new ArrayList<>(List.of("disk"));
    }

    @Data
    public static class PredictionConfig {
        private boolean enabled = true;
        private int minTrainingData = 100;
        private Duration trainingWindow = Duration.ofDays(7);
        private Duration riskWindow = Duration.ofHours(1);
        private Duration failureBaselineWindow = Duration.ofHours(24);
        private Duration retrainInterval = Duration.ofHours(6);
        private List<Integer> horizonsMinutes = new ArrayList<>(List.of(5, 15, 30, 60, 180, 360));
        private double smoothingAlpha = 0.3;
        private double arimaMaCoefficient = 0.5;
        private RiskThresholds riskThresholds = new RiskThresholds();
        private RiskWeights riskWeights = new RiskWeights();
        private Map<String, Double> breachThresholds = new HashMap<>(Map.of(
                "cpu", 95.0, "memory", 90.0, "disk", 95.0, "network", 2000.0));

        @Data
        public static class RiskThresholds {
            private double low = 0.3;
            private double medium = 0.6;
            private double high = 0.8;
        }

        @Data
        public static class RiskWeights {
            private double changeRatio = 0.3;
            private double volatility = 0.25;
            private double trend = 0.2;
            private double anomalyFrequency = 0.15;
            private double uncertainty = 0.1;
        }
    }

    @Data
    public static class AlertingConfig {
        private boolean enabled = true;
        private List<AlertRule> rules = new ArrayList<>();
    }

    @Data
    public static class NotificationConfig {
        private int maxAttempts = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(5);
        private Map<String, ChannelConfig> channels = new LinkedHashMap<>();

        /**
         * Flat binding target for a channel; converted into a typed
         * {@link com.example.pulsemonitor.notification.NotificationChannel}
         * at registration time.
         */
        @Data
        public static class ChannelConfig {
            private String type;
            private boolean enabled = true;
            private String url;
            private String webhookUrl;
            private String channel;
            private String from;
            private List<String> recipients = new ArrayList<>();
            private String routingKey;
            private List<String> phoneNumbers = new ArrayList<>();
            private Map<String, String> headers = new HashMap<>();
        }
    }
}
