package com.sysmon.storage;

import com.sysmon.dto.CpuMetrics;
import com.sysmon.dto.DiskMetrics;
import com.sysmon.dto.FilesystemUsage;
import com.sysmon.dto.MemoryMetrics;
import com.sysmon.dto.MetricSnapshot;
import com.sysmon.dto.NetworkMetrics;
import com.sysmon.dto.SwapMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts snapshots to tagged time-series points and back. Every snapshot carries a
 * {@code snapshot} marker point so that snapshots without any metric group survive the
 * round trip and duplicates can be detected.
 */
public final class SnapshotPointMapper {

    public static final String TAG_HOST = "hostname";
    static final String TAG_TYPE = "type";
    static final String TAG_CORE = "core";
    static final String TAG_MOUNT = "mountpoint";
    static final String TAG_DEVICE = "device";
    static final String TAG_FS_TYPE = "filesystem_type";

    public static final String M_SNAPSHOT = "snapshot";
    static final String M_CPU = "cpu_usage";
    static final String M_LOAD = "load_average";
    static final String M_MEMORY = "memory_usage";
    static final String M_SWAP = "swap_usage";
    static final String M_DISK = "disk_usage";
    static final String M_NETWORK = "network_io";

    private SnapshotPointMapper() {}

    public static List<TaggedPoint> toPoints(MetricSnapshot s) {
        List<TaggedPoint> points = new ArrayList<>();
        Instant t = s.timestamp();
        Map<String, String> host = Map.of(TAG_HOST, s.hostname());

        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("disk_collected", s.disk() != null);
        if (s.collectionDurationMs() != null) {
            marker.put("collection_duration_ms", s.collectionDurationMs());
        }
        points.add(new TaggedPoint(M_SNAPSHOT, host, marker, t));

        CpuMetrics cpu = s.cpu();
        if (cpu != null) {
            points.add(new TaggedPoint(M_CPU, tags(host, TAG_TYPE, "overall"),
                Map.of("percent", cpu.overallPercent()), t));
            for (int i = 0; i < cpu.perCorePercent().size(); i++) {
                Map<String, String> coreTags = tags(tags(host, TAG_TYPE, "per_core"), TAG_CORE, String.valueOf(i));
                points.add(new TaggedPoint(M_CPU, coreTags, Map.of("percent", cpu.perCorePercent().get(i)), t));
            }
            if (cpu.loadAverage().size() == 3) {
                points.add(new TaggedPoint(M_LOAD, host, Map.of(
                    "load_1m", cpu.loadAverage().get(0),
                    "load_5m", cpu.loadAverage().get(1),
                    "load_15m", cpu.loadAverage().get(2)), t));
            }
        }

        MemoryMetrics mem = s.memory();
        if (mem != null) {
            points.add(new TaggedPoint(M_MEMORY, host, Map.of(
                "total_bytes", mem.totalBytes(),
                "used_bytes", mem.usedBytes(),
                "free_bytes", mem.freeBytes(),
                "available_bytes", mem.availableBytes(),
                "percent_used", mem.percentUsed()), t));
        }

        SwapMetrics swap = s.swap();
        if (swap != null) {
            points.add(new TaggedPoint(M_SWAP, host, Map.of(
                "total_bytes", swap.totalBytes(),
                "used_bytes", swap.usedBytes(),
                "free_bytes", swap.freeBytes(),
                "percent_used", swap.percentUsed()), t));
        }

        if (s.disk() != null) {
            for (FilesystemUsage fs : s.disk().filesystems()) {
                Map<String, String> fsTags = tags(host, TAG_MOUNT, fs.mountPoint());
                if (fs.device() != null && !fs.device().isEmpty()) {
                    fsTags = tags(fsTags, TAG_DEVICE, fs.device());
                }
                if (fs.filesystemType() != null && !fs.filesystemType().isEmpty()) {
                    fsTags = tags(fsTags, TAG_FS_TYPE, fs.filesystemType());
                }
                points.add(new TaggedPoint(M_DISK, fsTags, Map.of(
                    "total_bytes", fs.totalBytes(),
                    "used_bytes", fs.usedBytes(),
                    "free_bytes", fs.freeBytes(),
                    "percent_used", fs.percentUsed()), t));
            }
        }

        NetworkMetrics net = s.network();
        if (net != null) {
            points.add(new TaggedPoint(M_NETWORK, host, Map.of(
                "bytes_sent", net.bytesSent(),
                "bytes_recv", net.bytesRecv(),
                "errors_in", net.errorsIn(),
                "errors_out", net.errorsOut()), t));
        }
        return points;
    }

    public static List<MetricSnapshot> fromPoints(List<TaggedPoint> points) {
        Map<GroupKey, Assembly> groups = new TreeMap<>(
            Comparator.comparing(GroupKey::time).thenComparing(GroupKey::hostname));
        for (TaggedPoint p : points) {
            String hostname = p.tag(TAG_HOST);
            if (hostname == null) continue;
            groups.computeIfAbsent(new GroupKey(p.time(), hostname), k -> new Assembly()).add(p);
        }
        List<MetricSnapshot> result = new ArrayList<>(groups.size());
        groups.forEach((key, assembly) -> result.add(assembly.build(key)));
        return result;
    }

    private static Map<String, String> tags(Map<String, String> base, String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(base);
        copy.put(key, value);
        return copy;
    }

    private record GroupKey(Instant time, String hostname) {}

    private static final class Assembly {
        Long durationMs;
        boolean diskCollected;
        Double cpuOverall;
        final TreeMap<Integer, Double> cores = new TreeMap<>();
        List<Double> load = List.of();
        MemoryMetrics memory;
        SwapMetrics swap;
        final List<FilesystemUsage> filesystems = new ArrayList<>();
        NetworkMetrics network;

        void add(TaggedPoint p) {
            Map<String, Object> f = p.fields();
            switch (p.measurement()) {
                case M_SNAPSHOT -> {
                    durationMs = f.containsKey("collection_duration_ms") ? asLong(f.get("collection_duration_ms")) : null;
                    diskCollected = Boolean.TRUE.equals(f.get("disk_collected"));
                }
                case M_CPU -> {
                    if ("per_core".equals(p.tag(TAG_TYPE))) {
                        cores.put(Integer.parseInt(p.tag(TAG_CORE)), asDouble(f.get("percent")));
                    } else {
                        cpuOverall = asDouble(f.get("percent"));
                    }
                }
                case M_LOAD -> load = List.of(
                    asDouble(f.get("load_1m")), asDouble(f.get("load_5m")), asDouble(f.get("load_15m")));
                case M_MEMORY -> memory = new MemoryMetrics(
                    asLong(f.get("total_bytes")), asLong(f.get("used_bytes")), asLong(f.get("free_bytes")),
                    asLong(f.get("available_bytes")), asDouble(f.get("percent_used")));
                case M_SWAP -> swap = new SwapMetrics(
                    asLong(f.get("total_bytes")), asLong(f.get("used_bytes")), asLong(f.get("free_bytes")),
                    asDouble(f.get("percent_used")));
                case M_DISK -> {
                    diskCollected = true;
                    filesystems.add(new FilesystemUsage(
                        p.tag(TAG_MOUNT), p.tag(TAG_DEVICE), p.tag(TAG_FS_TYPE),
                        asLong(f.get("total_bytes")), asLong(f.get("used_bytes")), asLong(f.get("free_bytes")),
                        asDouble(f.get("percent_used"))));
                }
                case M_NETWORK -> network = new NetworkMetrics(
                    asLong(f.get("bytes_sent")), asLong(f.get("bytes_recv")),
                    asLong(f.get("errors_in")), asLong(f.get("errors_out")));
                default -> { }
            }
        }

        MetricSnapshot build(GroupKey key) {
            CpuMetrics cpu = null;
            if (cpuOverall != null) {
                cpu = new CpuMetrics(cpuOverall, new ArrayList<>(cores.values()), load);
            }
            DiskMetrics disk = null;
            if (diskCollected) {
                filesystems.sort(Comparator.comparing(FilesystemUsage::mountPoint));
                disk = new DiskMetrics(filesystems);
            }
            return new MetricSnapshot(key.hostname(), key.time(), durationMs, cpu, memory, swap, disk, network);
        }
    }

    private static double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
