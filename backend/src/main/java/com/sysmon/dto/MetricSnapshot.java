package com.sysmon.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;

/**
 * One sampling round of a host. Metric groups are {@code null} when their collector
 * failed or is not available on the platform.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetricSnapshot(
    String hostname,
    Instant timestamp,
    Long collectionDurationMs,
    CpuMetrics cpu,
    MemoryMetrics memory,
    SwapMetrics swap,
    DiskMetrics disk,
    NetworkMetrics network
) {

    public MetricSnapshot normalized(String requestHostname) {
        DiskMetrics sortedDisk = disk == null ? null : new DiskMetrics(
            disk.filesystems().stream()
                .sorted(Comparator.comparing(FilesystemUsage::mountPoint))
                .toList());
        return new MetricSnapshot(
            requestHostname.trim(),
            timestamp.truncatedTo(ChronoUnit.MILLIS),
            collectionDurationMs,
            cpu, memory, swap, sortedDisk, network
        );
    }
}
