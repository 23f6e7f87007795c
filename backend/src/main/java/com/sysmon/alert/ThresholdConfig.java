package com.sysmon.alert;

import com.sysmon.config.SysmonProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ThresholdConfig(
    Map<AlertMetric, MetricThreshold> thresholds,
    List<String> channels,
    boolean notifyRecovery
) {
    private static final Logger log = LoggerFactory.getLogger(ThresholdConfig.class);

    public ThresholdConfig {
        Map<AlertMetric, MetricThreshold> copy = new EnumMap<>(AlertMetric.class);
        copy.putAll(thresholds);
        thresholds = Collections.unmodifiableMap(copy);
        channels = List.copyOf(channels);
    }

    public static ThresholdConfig from(SysmonProperties properties) {
        SysmonProperties.Alerts alerts = properties.alerts();
        Duration cooldown = Duration.ofMinutes(alerts.cooldownMinutes());
        Map<AlertMetric, MetricThreshold> thresholds = new EnumMap<>(AlertMetric.class);
        properties.thresholds().forEach((key, value) -> {
            var metric = AlertMetric.fromKey(key);
            if (metric.isEmpty()) {
                log.warn("Ignoring threshold for unknown metric '{}'", key);
                return;
            }
            if (value == null) {
                throw new IllegalStateException("sysmon.thresholds." + key + " has no value");
            }
            double recovery = Math.max(0.0, value - alerts.recoveryHysteresis());
            thresholds.put(metric.get(), new MetricThreshold(metric.get(), value, recovery, cooldown));
        });
        List<String> channels = alerts.channels().stream()
            .map(c -> c.trim().toLowerCase())
            .distinct()
            .toList();
        return new ThresholdConfig(thresholds, channels, alerts.notifyRecovery());
    }

    public MetricThreshold thresholdFor(AlertMetric metric) {
        return thresholds.get(metric);
    }
}
