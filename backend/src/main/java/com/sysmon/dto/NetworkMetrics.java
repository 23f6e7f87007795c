package com.sysmon.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NetworkMetrics(
    Long bytesSent,
    Long bytesRecv,
    Long errorsIn,
    Long errorsOut
) {}
