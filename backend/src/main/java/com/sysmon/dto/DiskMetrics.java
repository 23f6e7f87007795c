package com.sysmon.dto;

import java.util.List;

public record DiskMetrics(List<FilesystemUsage> filesystems) {
    public DiskMetrics {
        filesystems = filesystems == null ? List.of() : List.copyOf(filesystems);
    }
}
