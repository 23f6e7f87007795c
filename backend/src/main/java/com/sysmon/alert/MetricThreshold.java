package com.sysmon.alert;

import java.time.Duration;

public record MetricThreshold(
    AlertMetric metric,
    double threshold,
    double recoveryThreshold,
    Duration cooldown
) {
    public MetricThreshold {
        if (recoveryThreshold > threshold) {
            throw new IllegalArgumentException("Recovery threshold for " + metric.key() + " must not exceed " + threshold);
        }
    }
}
