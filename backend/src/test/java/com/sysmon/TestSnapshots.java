package com.sysmon;

import com.sysmon.dto.CpuMetrics;
import com.sysmon.dto.DiskMetrics;
import com.sysmon.dto.FilesystemUsage;
import com.sysmon.dto.MemoryMetrics;
import com.sysmon.dto.MetricSnapshot;
import com.sysmon.dto.NetworkMetrics;
import com.sysmon.dto.SwapMetrics;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot fixtures shared by tests.
 */
public final class TestSnapshots {

    public static final long GB = 1024L * 1024 * 1024;

    private TestSnapshots() {}

    public static MetricSnapshot snapshot(String host, Instant at, double cpu, double memory) {
        return new MetricSnapshot(host, at, 12L,
            new CpuMetrics(cpu, List.of(cpu, cpu), List.of(0.5, 0.4, 0.3)),
            memory(memory),
            new SwapMetrics(2 * GB, 0L, 2 * GB, 0.0),
            new DiskMetrics(List.of()),
            new NetworkMetrics(1000L, 2000L, 0L, 0L));
    }

    public static MetricSnapshot withDisks(String host, Instant at, FilesystemUsage... filesystems) {
        return new MetricSnapshot(host, at, null,
            new CpuMetrics(10.0, List.of(), List.of()),
            memory(20.0),
            null,
            new DiskMetrics(List.of(filesystems)),
            null);
    }

    public static MemoryMetrics memory(double percent) {
        long total = 16 * GB;
        long used = (long) (total * percent / 100.0);
        return new MemoryMetrics(total, used, total - used, total - used, percent);
    }

    public static FilesystemUsage fs(String mountPoint, double percent) {
        long total = 100 * GB;
        long used = (long) (total * percent / 100.0);
        return new FilesystemUsage(mountPoint, "/dev/sda1", "ext4", total, used, total - used, percent);
    }
}
