package com.sysmon.alert;

import com.sysmon.dto.FilesystemUsage;
import com.sysmon.dto.MetricSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public enum AlertMetric {
    CPU("cpu", "CPU"),
    MEMORY("memory", "Memory"),
    SWAP("swap", "Swap"),
    DISK("disk", "Disk");

    public record Reading(String subResource, double value) {}

    private final String key;
    private final String label;

    AlertMetric(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public static Optional<AlertMetric> fromKey(String key) {
        for (AlertMetric m : values()) {
            if (m.key.equalsIgnoreCase(key)) return Optional.of(m);
        }
        return Optional.empty();
    }

    public List<Reading> readings(MetricSnapshot s) {
        return switch (this) {
            case CPU -> s.cpu() == null ? List.of() : List.of(new Reading(null, s.cpu().overallPercent()));
            case MEMORY -> s.memory() == null ? List.of() : List.of(new Reading(null, s.memory().percentUsed()));
            // hosts without swap would otherwise sit at 0% forever
            case SWAP -> s.swap() == null || s.swap().totalBytes() == 0
                ? List.of() : List.of(new Reading(null, s.swap().percentUsed()));
            case DISK -> {
                if (s.disk() == null) yield List.of();
                List<Reading> readings = new ArrayList<>();
                for (FilesystemUsage fs : s.disk().filesystems()) {
                    readings.add(new Reading(fs.mountPoint(), fs.percentUsed()));
                }
                yield readings;
            }
        };
    }
}
