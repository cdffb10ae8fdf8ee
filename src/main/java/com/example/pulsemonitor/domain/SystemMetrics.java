package com.example.pulsemonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of host and application metrics taken by the collector.
 */
@Value
@Builder(toBuilder = true)
public class SystemMetrics {

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";
    public static final String DISK = "disk";
    public static final String NETWORK = "network";
    public static final String CUSTOM_PREFIX = "custom_";

    Instant timestamp;
    Cpu cpu;
    Memory memory;
    Disk disk;
    Network network;
    Map<String, Double> custom;

    public static class SystemMetricsBuilder {
        private Map<String, Double> custom = Map.of();

        /** Stores a read-only copy; later changes to the argument are not seen. */
        public SystemMetricsBuilder custom(Map<String, Double> custom) {
            this.custom = custom == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(custom));
            return this;
        }
    }

    @Value
    @Builder
    public static class Cpu {
        double usage;
        int cores;
        @Builder.Default
        List<Double> loadAverage = List.of(0.0, 0.0, 0.0);
    }

    @Value
    @Builder
    public static class Memory {
        long total;
        long used;
        long free;
        long available;

        public double usagePercent() {
            return total > 0 ? (double) used / total * 100.0 : 0.0;
        }
    }

    @Value
    @Builder
    public static class Disk {
        long total;
        long used;
        long free;
        String path;

        public double usagePercent() {
            return total > 0 ? (double) used / total * 100.0 : 0.0;
        }
    }

    @Value
    @Builder
    public static class Network {
        double latency;
        long bytesIn;
        long bytesOut;
        long packetsIn;
        long packetsOut;
    }

    /**
     * Derived scalar values keyed by metric name: cpu, memory, disk, network
     * and custom_&lt;name&gt; for every custom metric.
     */
    public Map<String, Double> metricValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        if (cpu != null) values.put(CPU, cpu.getUsage());
        if (memory != null) values.put(MEMORY, memory.usagePercent());
        if (disk != null) values.put(DISK, disk.usagePercent());
        if (network != null) values.put(NETWORK, network.getLatency());
        if (custom != null) {
            custom.forEach((name, value) -> values.put(CUSTOM_PREFIX + name, value));
        }
        return values;
    }

    /**
     * Value of a single named metric, or null when the snapshot does not carry it.
     */
    public Double metricValue(String metric) {
        return metricValues().get(metric);
    }
}
