package com.sysmon.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MemoryMetrics(
    Long totalBytes,
    Long usedBytes,
    Long freeBytes,
    Long availableBytes,
    Double percentUsed
) {}
