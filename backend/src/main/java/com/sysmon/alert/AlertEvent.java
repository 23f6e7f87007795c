package com.sysmon.alert;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlertEvent(
    AlertKey key,
    Severity severity,
    double value,
    double threshold,
    Instant firedAt,
    String message
) {
    public boolean isRecovery() {
        return severity == Severity.INFO;
    }
}
