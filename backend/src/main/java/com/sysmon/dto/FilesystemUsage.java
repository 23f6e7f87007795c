package com.sysmon.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FilesystemUsage(
    String mountPoint,
    String device,
    String filesystemType,
    Long totalBytes,
    Long usedBytes,
    Long freeBytes,
    Double percentUsed
) {}
