package com.sysmon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Binding for all {@code sysmon.*} properties. Keys may be written in snake_case
 * ({@code interval_seconds}) or kebab-case; unknown keys are ignored.
 *
 * <pre>
 * sysmon:
 *   interval_seconds: 30
 *   endpoint:
 *     url: http://localhost:8080/ingest
 *     timeout: 5s
 *     max_retries: 3
 *   thresholds:
 *     cpu: 80
 *     memory: 85
 *   alerts:
 *     cooldown_minutes: 5
 *     channels: [log]
 *   storage:
 *     backend: jpa
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "sysmon")
public record SysmonProperties(
    String hostname,
    @DefaultValue("30") @Min(1) int intervalSeconds,
    @Valid @NotNull Endpoint endpoint,
    @NotEmpty Map<String, Double> thresholds,
    @Valid @NotNull Alerts alerts,
    @Valid @DefaultValue Storage storage,
    @Valid @DefaultValue Collector collector
) {

    public String resolvedHostname() {
        if (hostname != null && !hostname.isBlank()) {
            return hostname.trim();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env != null && !env.isBlank() ? env : "localhost";
        }
    }

    public record Endpoint(
        @NotBlank String url,
        @DefaultValue("5s") Duration timeout,
        @DefaultValue("3") @Min(1) int maxRetries,
        @DefaultValue("1s") Duration baseDelay,
        @DefaultValue("30s") Duration maxDelay,
        @DefaultValue("1") @Min(1) @Max(2) int queueDepth
    ) {}

    public record Alerts(
        @NotNull @Min(0) Integer cooldownMinutes,
        @NotNull List<String> channels,
        @DefaultValue("0") @Min(0) double recoveryHysteresis,
        @DefaultValue("false") boolean notifyRecovery,
        @DefaultValue("2") @Min(0) int channelRetries,
        @DefaultValue("500ms") Duration channelRetryDelay,
        @DefaultValue Slack slack,
        @DefaultValue Webhook webhook,
        @DefaultValue Email email
    ) {}

    public record Slack(String webhookUrl) {}

    public record Webhook(String url, Map<String, String> headers) {
        public Webhook {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }
    }

    public record Email(String from, List<String> to) {
        public Email {
            to = to == null ? List.of() : List.copyOf(to);
        }
    }

    public record Storage(
        @DefaultValue("jpa") String backend,
        @DefaultValue Influx influxdb
    ) {}

    public record Influx(
        @DefaultValue("http://localhost:8086") String url,
        String token,
        @DefaultValue("metrics-org") String org,
        @DefaultValue("metrics") String bucket
    ) {}

    public record Collector(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("/proc") String procRoot,
        @DefaultValue({"tmpfs", "devtmpfs", "squashfs", "overlay", "proc", "sysfs", "cgroup", "cgroup2",
            "devpts", "mqueue", "debugfs", "tracefs", "securityfs", "pstore", "autofs", "fusectl",
            "configfs", "hugetlbfs", "binfmt_misc", "nsfs", "ramfs", "bpf"})
        List<String> excludedFsTypes
    ) {}
}
