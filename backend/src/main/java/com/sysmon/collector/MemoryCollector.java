package com.sysmon.collector;

import com.sysmon.dto.MemoryMetrics;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Map;
import java.util.Optional;

/**
 * Physical memory from {@code /proc/meminfo}. Used memory excludes buffers and page cache;
 * the percentage is based on available memory.
 */
public class MemoryCollector implements MetricCollector<MemoryMetrics> {

    private final ProcFs procFs;
    private final OperatingSystemMXBean osMXBean;

    public MemoryCollector(ProcFs procFs) {
        this(procFs, ManagementFactory.getOperatingSystemMXBean());
    }

    MemoryCollector(ProcFs procFs, OperatingSystemMXBean osMXBean) {
        this.procFs = procFs;
        this.osMXBean = osMXBean;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public boolean isAvailable() {
        return procFs.exists("meminfo") || osMXBean instanceof com.sun.management.OperatingSystemMXBean;
    }

    @Override
    public Optional<MemoryMetrics> collect() throws CollectionException {
        if (procFs.exists("meminfo")) {
            return Optional.of(fromProc(procFs.readKeyValues("meminfo")));
        }
        if (osMXBean instanceof com.sun.management.OperatingSystemMXBean sunOsMXBean) {
            long total = sunOsMXBean.getTotalMemorySize();
            long free = Math.min(sunOsMXBean.getFreeMemorySize(), total);
            return Optional.of(new MemoryMetrics(total, total - free, free, free, ProcFs.percent(total - free, total)));
        }
        return Optional.empty();
    }

    static MemoryMetrics fromProc(Map<String, Long> info) throws CollectionException {
        Long total = info.get("MemTotal");
        Long free = info.get("MemFree");
        if (total == null || free == null) {
            throw new CollectionException("MemTotal/MemFree missing from /proc/meminfo");
        }
        long buffers = info.getOrDefault("Buffers", 0L);
        long cached = info.getOrDefault("Cached", 0L) + info.getOrDefault("SReclaimable", 0L);
        long available = Math.min(info.getOrDefault("MemAvailable", free + buffers + cached), total);
        long used = total - free - buffers - cached;
        if (used < 0) {
            used = total - free;
        }
        return new MemoryMetrics(total, used, free, available, ProcFs.percent(total - available, total));
    }
}
