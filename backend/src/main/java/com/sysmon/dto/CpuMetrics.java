package com.sysmon.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CpuMetrics(
    Double overallPercent,
    List<Double> perCorePercent,
    @JsonProperty("load_avg_1_5_15") List<Double> loadAverage
) {
    public CpuMetrics {
        perCorePercent = perCorePercent == null ? List.of() : List.copyOf(perCorePercent);
        loadAverage = loadAverage == null ? List.of() : List.copyOf(loadAverage);
    }
}
