package com.sysmon.entity;

import com.sysmon.dto.CpuMetrics;
import com.sysmon.dto.DiskMetrics;
import com.sysmon.dto.MemoryMetrics;
import com.sysmon.dto.MetricSnapshot;
import com.sysmon.dto.NetworkMetrics;
import com.sysmon.dto.SwapMetrics;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "metric_snapshots",
    uniqueConstraints = @UniqueConstraint(name = "uk_snapshot_host_time", columnNames = {"hostname", "collected_at"}),
    indexes = @Index(name = "idx_snapshot_time", columnList = "collected_at"))
public class SnapshotRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hostname", nullable = false)
    private String hostname;
    @Column(name = "collected_at", nullable = false)
    private Instant collectedAt;
    private Instant receivedAt;
    private Long collectionDurationMs;

    private Double cpuOverallPercent;
    private Double load1;
    private Double load5;
    private Double load15;

    @ElementCollection
    @CollectionTable(name = "snapshot_cpu_cores", joinColumns = @JoinColumn(name = "snapshot_id"))
    @OrderColumn(name = "core_index")
    @Column(name = "percent")
    private List<Double> perCorePercent = new ArrayList<>();

    private Long memoryTotalBytes;
    private Long memoryUsedBytes;
    private Long memoryFreeBytes;
    private Long memoryAvailableBytes;
    private Double memoryPercent;

    private Long swapTotalBytes;
    private Long swapUsedBytes;
    private Long swapFreeBytes;
    private Double swapPercent;

    private Boolean diskCollected;

    @ElementCollection
    @CollectionTable(name = "snapshot_filesystems", joinColumns = @JoinColumn(name = "snapshot_id"))
    @OrderColumn(name = "fs_index")
    private List<FilesystemEntry> filesystems = new ArrayList<>();

    private Long netBytesSent;
    private Long netBytesRecv;
    private Long netErrorsIn;
    private Long netErrorsOut;

    public SnapshotRecord() {}

    public static SnapshotRecord from(MetricSnapshot s, Instant receivedAt) {
        SnapshotRecord r = new SnapshotRecord();
        r.hostname = s.hostname();
        r.collectedAt = s.timestamp();
        r.receivedAt = receivedAt;
        r.collectionDurationMs = s.collectionDurationMs();

        if (s.cpu() != null) {
            r.cpuOverallPercent = s.cpu().overallPercent();
            r.perCorePercent = new ArrayList<>(s.cpu().perCorePercent());
            List<Double> load = s.cpu().loadAverage();
            if (load.size() == 3) {
                r.load1 = load.get(0);
                r.load5 = load.get(1);
                r.load15 = load.get(2);
            }
        }
        if (s.memory() != null) {
            r.memoryTotalBytes = s.memory().totalBytes();
            r.memoryUsedBytes = s.memory().usedBytes();
            r.memoryFreeBytes = s.memory().freeBytes();
            r.memoryAvailableBytes = s.memory().availableBytes();
            r.memoryPercent = s.memory().percentUsed();
        }
        if (s.swap() != null) {
            r.swapTotalBytes = s.swap().totalBytes();
            r.swapUsedBytes = s.swap().usedBytes();
            r.swapFreeBytes = s.swap().freeBytes();
            r.swapPercent = s.swap().percentUsed();
        }
        if (s.disk() != null) {
            r.diskCollected = true;
            r.filesystems = new ArrayList<>(s.disk().filesystems().stream().map(FilesystemEntry::from).toList());
        }
        if (s.network() != null) {
            r.netBytesSent = s.network().bytesSent();
            r.netBytesRecv = s.network().bytesRecv();
            r.netErrorsIn = s.network().errorsIn();
            r.netErrorsOut = s.network().errorsOut();
        }
        return r;
    }

    public MetricSnapshot toSnapshot() {
        CpuMetrics cpu = cpuOverallPercent == null ? null : new CpuMetrics(
            cpuOverallPercent,
            List.copyOf(perCorePercent),
            load1 == null ? List.of() : List.of(load1, load5, load15));
        MemoryMetrics memory = memoryTotalBytes == null ? null : new MemoryMetrics(
            memoryTotalBytes, memoryUsedBytes, memoryFreeBytes, memoryAvailableBytes, memoryPercent);
        SwapMetrics swap = swapTotalBytes == null ? null : new SwapMetrics(
            swapTotalBytes, swapUsedBytes, swapFreeBytes, swapPercent);
        DiskMetrics disk = !Boolean.TRUE.equals(diskCollected) ? null : new DiskMetrics(
            filesystems.stream().map(FilesystemEntry::toUsage).toList());
        NetworkMetrics network = netBytesSent == null ? null : new NetworkMetrics(
            netBytesSent, netBytesRecv, netErrorsIn, netErrorsOut);
        return new MetricSnapshot(hostname, collectedAt, collectionDurationMs, cpu, memory, swap, disk, network);
    }

    public Long getId() { return id; }
    public String getHostname() { return hostname; }
    public Instant getCollectedAt() { return collectedAt; }
    public Instant getReceivedAt() { return receivedAt; }
    public Double getCpuOverallPercent() { return cpuOverallPercent; }
    public Double getMemoryPercent() { return memoryPercent; }
    public Double getSwapPercent() { return swapPercent; }
    public List<FilesystemEntry> getFilesystems() { return filesystems; }
}
