package com.sysmon.collector;

import com.sysmon.dto.CpuMetrics;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CPU utilisation from {@code /proc/stat} jiffy deltas between ticks, load averages from
 * {@code /proc/loadavg}. Falls back to the JDK {@link OperatingSystemMXBean} when the proc
 * files are not present. The first tick reports the average since boot.
 */
public class CpuCollector implements MetricCollector<CpuMetrics> {

    private final ProcFs procFs;
    private final OperatingSystemMXBean osMXBean;

    private long[] previousTotal = new long[0];
    private long[] previousIdle = new long[0];

    public CpuCollector(ProcFs procFs) {
        this(procFs, ManagementFactory.getOperatingSystemMXBean());
    }

    CpuCollector(ProcFs procFs, OperatingSystemMXBean osMXBean) {
        this.procFs = procFs;
        this.osMXBean = osMXBean;
    }

    @Override
    public String name() {
        return "cpu";
    }

    @Override
    public boolean isAvailable() {
        return procFs.exists("stat") || osMXBean instanceof com.sun.management.OperatingSystemMXBean;
    }

    @Override
    public synchronized Optional<CpuMetrics> collect() throws CollectionException {
        if (procFs.exists("stat")) {
            return Optional.of(fromProc());
        }
        return fromMXBean();
    }

    private CpuMetrics fromProc() throws CollectionException {
        List<long[]> counters = new ArrayList<>();
        for (String line : procFs.readLines("stat")) {
            if (!line.startsWith("cpu")) continue;
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 5) {
                throw new CollectionException("Malformed /proc/stat line: " + line);
            }
            long total = 0;
            // user nice system idle iowait irq softirq steal; guest time is already in user
            int fields = Math.min(parts.length - 1, 8);
            long[] values = new long[fields];
            try {
                for (int i = 0; i < fields; i++) {
                    values[i] = Long.parseLong(parts[i + 1]);
                    total += values[i];
                }
            } catch (NumberFormatException e) {
                throw new CollectionException("Malformed /proc/stat line: " + line, e);
            }
            long idle = values[3] + (fields > 4 ? values[4] : 0);
            counters.add(new long[] {total, idle});
        }
        if (counters.isEmpty()) {
            throw new CollectionException("No cpu lines in /proc/stat");
        }

        boolean first = previousTotal.length != counters.size();
        double[] usage = new double[counters.size()];
        long[] totals = new long[counters.size()];
        long[] idles = new long[counters.size()];
        for (int i = 0; i < counters.size(); i++) {
            totals[i] = counters.get(i)[0];
            idles[i] = counters.get(i)[1];
            long dTotal = first ? totals[i] : totals[i] - previousTotal[i];
            long dIdle = first ? idles[i] : idles[i] - previousIdle[i];
            usage[i] = ProcFs.percent(dTotal - dIdle, dTotal);
        }
        previousTotal = totals;
        previousIdle = idles;

        List<Double> perCore = new ArrayList<>();
        for (int i = 1; i < usage.length; i++) {
            perCore.add(usage[i]);
        }
        return new CpuMetrics(usage[0], perCore, loadAverage());
    }

    private List<Double> loadAverage() throws CollectionException {
        if (!procFs.exists("loadavg")) {
            return List.of();
        }
        List<String> lines = procFs.readLines("loadavg");
        if (lines.isEmpty()) return List.of();
        String[] parts = lines.get(0).trim().split("\\s+");
        if (parts.length < 3) {
            throw new CollectionException("Malformed /proc/loadavg: " + lines.get(0));
        }
        try {
            return List.of(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]), Double.parseDouble(parts[2]));
        } catch (NumberFormatException e) {
            throw new CollectionException("Malformed /proc/loadavg: " + lines.get(0), e);
        }
    }

    private Optional<CpuMetrics> fromMXBean() {
        if (!(osMXBean instanceof com.sun.management.OperatingSystemMXBean sunOsMXBean)) {
            return Optional.empty();
        }
        double load = sunOsMXBean.getCpuLoad();
        if (load < 0) {
            return Optional.empty();
        }
        return Optional.of(new CpuMetrics(ProcFs.percent(load, 1.0), List.of(), List.of()));
    }
}
