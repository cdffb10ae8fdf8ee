package com.example.pulsemonitor.monitoring;

import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.SystemMetrics;
import com.example.pulsemonitor.exception.CollectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads host counters through the platform MXBean, the filesystem and, on
 * Linux, /proc.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JvmSystemProbe implements SystemProbe {

    private static final Path LOADAVG = Path.of("/proc/loadavg");
    private static final Path MEMINFO = Path.of("/proc/meminfo");
    private static final Path NET_DEV = Path.of("/proc/net/dev");

    private final MonitorProperties properties;

    @Override
    public SystemMetrics.Cpu readCpu() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        int cores = os.getAvailableProcessors();
        if (!(os instanceof com.sun.management.OperatingSystemMXBean sunOs)) {
            throw new CollectionException("Process CPU time is not available on this JVM", null);
        }

        long window = properties.getCollector().getCpuSampleWindow().toMillis();
        long cpuStart = sunOs.getProcessCpuTime();
        long wallStart = System.nanoTime();
        try {
            Thread.sleep(window);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectionException("Interrupted while sampling CPU", e);
        }
        long cpuDelta = sunOs.getProcessCpuTime() - cpuStart;
        long wallDelta = System.nanoTime() - wallStart;
        if (cpuStart < 0 || wallDelta <= 0) {
            throw new CollectionException("Process CPU time is not supported", null);
        }

        double usage = (double) cpuDelta / ((double) wallDelta * cores) * 100.0;
        return SystemMetrics.Cpu.builder()
                .usage(Math.max(0.0, Math.min(100.0, usage)))
                .cores(cores)
                .loadAverage(readLoadAverage(os))
                .build();
    }

    @Override
    public SystemMetrics.Memory readMemory() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (!(os instanceof com.sun.management.OperatingSystemMXBean sunOs)) {
            throw new CollectionException("Physical memory counters are not available on this JVM", null);
        }
        long total = sunOs.getTotalMemorySize();
        long free = sunOs.getFreeMemorySize();
        if (total <= 0) {
            throw new CollectionException("Total memory reported as " + total, null);
        }
        long available = readMemAvailable().orElse(free);
        return SystemMetrics.Memory.builder()
                .total(total)
                .used(total - free)
                .free(free)
                .available(available)
                .build();
    }

    @Override
    public SystemMetrics.Disk readDisk() {
        String path = properties.getCollector().getDiskPath();
        File root = new File(path);
        long total = root.getTotalSpace();
        if (total <= 0) {
            throw new CollectionException("Disk counters unavailable for " + path, null);
        }
        long free = root.getUsableSpace();
        return SystemMetrics.Disk.builder()
                .total(total)
                .used(total - free)
                .free(free)
                .path(path)
                .build();
    }

    @Override
    public SystemMetrics.Network readNetwork() {
        long[] counters = readNetDev();
        return SystemMetrics.Network.builder()
                .latency(probeLatency())
                .bytesIn(counters[0])
                .packetsIn(counters[1])
                .bytesOut(counters[2])
                .packetsOut(counters[3])
                .build();
    }

    private List<Double> readLoadAverage(OperatingSystemMXBean os) {
        if (Files.isReadable(LOADAVG)) {
            try {
                String[] parts = Files.readString(LOADAVG).trim().split("\\s+");
                return List.of(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]), Double.parseDouble(parts[2]));
            } catch (IOException | RuntimeException e) {
                log.debug("Could not read {}: {}", LOADAVG, e.getMessage());
            }
        }
        double oneMinute = Math.max(0.0, os.getSystemLoadAverage());
        return List.of(oneMinute, 0.0, 0.0);
    }

    private Optional<Long> readMemAvailable() {
        if (!Files.isReadable(MEMINFO)) return Optional.empty();
        try {
            for (String line : Files.readAllLines(MEMINFO)) {
                if (line.startsWith("MemAvailable:")) {
                    String kb = line.replaceAll("[^0-9]", "");
                    return Optional.of(Long.parseLong(kb) * 1024L);
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Could not read {}: {}", MEMINFO, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Sum of rx bytes, rx packets, tx bytes, tx packets over non-loopback interfaces.
     */
    private long[] readNetDev() {
        long[] totals = new long[4];
        if (!Files.isReadable(NET_DEV)) return totals;
        try {
            List<String> lines = Files.readAllLines(NET_DEV);
            for (String line : lines.subList(Math.min(2, lines.size()), lines.size())) {
                String[] ifaceAndStats = line.trim().split(":", 2);
                if (ifaceAndStats.length < 2 || ifaceAndStats[0].trim().equals("lo")) continue;
                String[] fields = ifaceAndStats[1].trim().split("\\s+");
                if (fields.length < 10) continue;
                totals[0] += Long.parseLong(fields[0]);
                totals[1] += Long.parseLong(fields[1]);
                totals[2] += Long.parseLong(fields[8]);
                totals[3] += Long.parseLong(fields[9]);
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Could not read {}: {}", NET_DEV, e.getMessage());
            return new long[4];
        }
        return totals;
    }

    private double probeLatency() {
        MonitorProperties.CollectorConfig collector = properties.getCollector();
        String host = collector.getLatencyProbeHost();
        if (host == null || host.isBlank()) return 0.0;

        long start = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, collector.getLatencyProbePort()),
                    collector.getLatencyProbeTimeoutMs());
            return (System.nanoTime() - start) / 1_000_000.0;
        } catch (IOException e) {
            log.debug("Latency probe to {} failed: {}", host, e.getMessage());
            return 0.0;
        }
    }
}
