package com.example.pulsemonitor.monitoring;

import com.example.pulsemonitor.domain.SystemMetrics;

/**
 * Host-level reads behind the metrics collector. CPU, memory and disk reads
 * throw {@link com.example.pulsemonitor.exception.CollectionException} on
 * failure; network reads fall back to zero values where the platform offers
 * no counters.
 */
public interface SystemProbe {

    SystemMetrics.Cpu readCpu();

    SystemMetrics.Memory readMemory();

    SystemMetrics.Disk readDisk();

    SystemMetrics.Network readNetwork();
}
