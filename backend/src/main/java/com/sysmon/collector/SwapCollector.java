package com.sysmon.collector;

import com.sysmon.dto.SwapMetrics;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Map;
import java.util.Optional;

public class SwapCollector implements MetricCollector<SwapMetrics> {

    private final ProcFs procFs;
    private final OperatingSystemMXBean osMXBean;

    public SwapCollector(ProcFs procFs) {
        this(procFs, ManagementFactory.getOperatingSystemMXBean());
    }

    SwapCollector(ProcFs procFs, OperatingSystemMXBean osMXBean) {
        this.procFs = procFs;
        this.osMXBean = osMXBean;
    }

    @Override
    public String name() {
        return "swap";
    }

    @Override
    public boolean isAvailable() {
        return procFs.exists("meminfo") || osMXBean instanceof com.sun.management.OperatingSystemMXBean;
    }

    @Override
    public Optional<SwapMetrics> collect() throws CollectionException {
        long total;
        long free;
        if (procFs.exists("meminfo")) {
            Map<String, Long> info = procFs.readKeyValues("meminfo");
            if (!info.containsKey("SwapTotal") || !info.containsKey("SwapFree")) {
                throw new CollectionException("SwapTotal/SwapFree missing from /proc/meminfo");
            }
            total = info.get("SwapTotal");
            free = info.get("SwapFree");
        } else if (osMXBean instanceof com.sun.management.OperatingSystemMXBean sunOsMXBean) {
            total = sunOsMXBean.getTotalSwapSpaceSize();
            free = sunOsMXBean.getFreeSwapSpaceSize();
        } else {
            return Optional.empty();
        }
        free = Math.min(free, total);
        long used = total - free;
        return Optional.of(new SwapMetrics(total, used, free, ProcFs.percent(used, total)));
    }
}
