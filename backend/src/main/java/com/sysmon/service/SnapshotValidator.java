package com.sysmon.service;

import com.sysmon.dto.CpuMetrics;
import com.sysmon.dto.FilesystemUsage;
import com.sysmon.dto.MemoryMetrics;
import com.sysmon.dto.MetricSnapshot;
import com.sysmon.dto.NetworkMetrics;
import com.sysmon.dto.SwapMetrics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class SnapshotValidator {

    public List<String> validate(String requestHostname, MetricSnapshot snapshot) {
        List<String> errors = new ArrayList<>();
        if (requestHostname == null || requestHostname.isBlank()) {
            errors.add("hostname: missing");
        }
        if (snapshot == null) {
            errors.add("metrics: missing");
            return errors;
        }
        if (snapshot.timestamp() == null) {
            errors.add("metrics.timestamp: missing");
        }
        if (snapshot.hostname() != null && requestHostname != null
                && !snapshot.hostname().trim().equals(requestHostname.trim())) {
            errors.add("metrics.hostname: '" + snapshot.hostname() + "' does not match request hostname '" + requestHostname + "'");
        }
        if (snapshot.collectionDurationMs() != null && snapshot.collectionDurationMs() < 0) {
            errors.add("metrics.collection_duration_ms: must be >= 0");
        }
        if (snapshot.cpu() != null) validateCpu(snapshot.cpu(), errors);
        if (snapshot.memory() != null) validateMemory(snapshot.memory(), errors);
        if (snapshot.swap() != null) validateSwap(snapshot.swap(), errors);
        if (snapshot.disk() != null) validateDisk(snapshot.disk().filesystems(), errors);
        if (snapshot.network() != null) validateNetwork(snapshot.network(), errors);
        return errors;
    }

    private void validateCpu(CpuMetrics cpu, List<String> errors) {
        percent("cpu.overall_percent", cpu.overallPercent(), errors);
        for (int i = 0; i < cpu.perCorePercent().size(); i++) {
            percent("cpu.per_core_percent[" + i + "]", cpu.perCorePercent().get(i), errors);
        }
        List<Double> load = cpu.loadAverage();
        if (!load.isEmpty() && load.size() != 3) {
            errors.add("cpu.load_avg_1_5_15: expected 3 values, got " + load.size());
        }
        for (int i = 0; i < load.size(); i++) {
            Double l = load.get(i);
            if (l == null || !Double.isFinite(l) || l < 0) {
                errors.add("cpu.load_avg_1_5_15[" + i + "]: must be a finite value >= 0");
            }
        }
    }

    private void validateMemory(MemoryMetrics m, List<String> errors) {
        bytes("memory.total_bytes", m.totalBytes(), errors);
        bytes("memory.used_bytes", m.usedBytes(), errors);
        bytes("memory.free_bytes", m.freeBytes(), errors);
        bytes("memory.available_bytes", m.availableBytes(), errors);
        percent("memory.percent_used", m.percentUsed(), errors);
        capacity("memory", m.usedBytes(), m.freeBytes(), m.totalBytes(), errors);
        if (m.availableBytes() != null && m.totalBytes() != null && m.availableBytes() > m.totalBytes()) {
            errors.add("memory.available_bytes: exceeds total_bytes");
        }
    }

    private void validateSwap(SwapMetrics s, List<String> errors) {
        bytes("swap.total_bytes", s.totalBytes(), errors);
        bytes("swap.used_bytes", s.usedBytes(), errors);
        bytes("swap.free_bytes", s.freeBytes(), errors);
        percent("swap.percent_used", s.percentUsed(), errors);
        capacity("swap", s.usedBytes(), s.freeBytes(), s.totalBytes(), errors);
    }

    private void validateDisk(List<FilesystemUsage> filesystems, List<String> errors) {
        Set<String> mounts = new HashSet<>();
        for (FilesystemUsage fs : filesystems) {
            String field = "disk.filesystems[" + fs.mountPoint() + "]";
            if (fs.mountPoint() == null || fs.mountPoint().isBlank()) {
                errors.add("disk.filesystems.mount_point: missing");
                continue;
            }
            if (!mounts.add(fs.mountPoint())) {
                errors.add(field + ": duplicate mount point");
            }
            bytes(field + ".total_bytes", fs.totalBytes(), errors);
            bytes(field + ".used_bytes", fs.usedBytes(), errors);
            bytes(field + ".free_bytes", fs.freeBytes(), errors);
            percent(field + ".percent_used", fs.percentUsed(), errors);
            capacity(field, fs.usedBytes(), fs.freeBytes(), fs.totalBytes(), errors);
        }
    }

    private void validateNetwork(NetworkMetrics n, List<String> errors) {
        bytes("network.bytes_sent", n.bytesSent(), errors);
        bytes("network.bytes_recv", n.bytesRecv(), errors);
        bytes("network.errors_in", n.errorsIn(), errors);
        bytes("network.errors_out", n.errorsOut(), errors);
    }

    private static void percent(String field, Double value, List<String> errors) {
        if (value == null) {
            errors.add(field + ": missing");
        } else if (!Double.isFinite(value) || value < 0.0 || value > 100.0) {
            errors.add(field + ": " + value + " is outside [0, 100]");
        }
    }

    private static void bytes(String field, Long value, List<String> errors) {
        if (value == null) {
            errors.add(field + ": missing");
        } else if (value < 0) {
            errors.add(field + ": must be >= 0");
        }
    }

    private static void capacity(String group, Long used, Long free, Long total, List<String> errors) {
        if (used == null || free == null || total == null || used < 0 || free < 0 || total < 0) {
            return;
        }
        // total - free cannot overflow once both are non-negative
        if (used > total - free) {
            errors.add(group + ": used_bytes + free_bytes exceeds total_bytes");
        }
    }
}
