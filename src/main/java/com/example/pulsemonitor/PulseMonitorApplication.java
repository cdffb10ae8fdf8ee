package com.example.pulsemonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Pulse Monitor - in-process monitoring and alerting engine.
 *
 * Pipeline:
 * - Metrics Collector → periodic host and custom metric sampling
 * - Storage Manager → bounded in-memory time series with retention
 * - Health Evaluator → per-metric health bands
 * - Anomaly Detector → statistical, seasonal and trend models
 * - Fault Predictor → multi-horizon forecasts with risk grading
 * - Alert Manager → rules with hysteresis, cooldown and escalation
 * - Notification Service → multi-channel delivery with retry
 */
@SpringBootApplication
public class PulseMonitorApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔══════════════════════════════════════════════════╗
            ║         Pulse Monitor v0.1.0                     ║
            ╚══════════════════════════════════════════════════╝
            """);
        SpringApplication.run(PulseMonitorApplication.class, args);
    }
}
