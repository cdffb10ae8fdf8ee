package com.example.pulsemonitor;

import com.example.pulsemonitor.domain.SystemMetrics;

import java.time.Instant;
import java.util.Map;

/**
 * Builders for metric snapshots used across tests.
 */
public final class TestSamples {

    public static final long GB = 1024L * 1024 * 1024;

    private TestSamples() {
    }

    public static SystemMetrics cpu(Instant timestamp, double usage) {
        return SystemMetrics.builder()
                .timestamp(timestamp)
                .cpu(SystemMetrics.Cpu.builder().usage(usage).cores(4).build())
                .build();
    }

    public static SystemMetrics full(Instant timestamp, double cpu, double memoryPercent,
                                     double diskPercent, double latency) {
        long memUsed = Math.round(16 * GB * memoryPercent / 100.0);
        long diskUsed = Math.round(100 * GB * diskPercent / 100.0);
        return SystemMetrics.builder()
                .timestamp(timestamp)
                .cpu(SystemMetrics.Cpu.builder().usage(cpu).cores(4).build())
                .memory(SystemMetrics.Memory.builder()
                        .total(16 * GB).used(memUsed).free(16 * GB - memUsed).available(16 * GB - memUsed)
                        .build())
                .disk(SystemMetrics.Disk.builder()
                        .total(100 * GB).used(diskUsed).free(100 * GB - diskUsed).path("/")
                        .build())
                .network(SystemMetrics.Network.builder().latency(latency).build())
                .build();
    }

    public static SystemMetrics withCustom(SystemMetrics base, Map<String, Double> custom) {
        return base.toBuilder().custom(custom).build();
    }
}
