package com.sysmon.collector;

import com.sysmon.collector.transmission.TransmissionClient;
import com.sysmon.dto.CpuMetrics;
import com.sysmon.dto.DiskMetrics;
import com.sysmon.dto.MemoryMetrics;
import com.sysmon.dto.MetricSnapshot;
import com.sysmon.dto.NetworkMetrics;
import com.sysmon.dto.SwapMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class MetricSampler {

    private static final Logger log = LoggerFactory.getLogger(MetricSampler.class);

    private final String hostname;
    private final Duration interval;
    private final MetricCollector<CpuMetrics> cpu;
    private final MetricCollector<MemoryMetrics> memory;
    private final MetricCollector<SwapMetrics> swap;
    private final MetricCollector<DiskMetrics> disk;
    private final MetricCollector<NetworkMetrics> network;
    private final TransmissionClient transmission;
    private final Clock clock;

    private volatile ScheduledExecutorService scheduler;

    public MetricSampler(String hostname,
                         Duration interval,
                         MetricCollector<CpuMetrics> cpu,
                         MetricCollector<MemoryMetrics> memory,
                         MetricCollector<SwapMetrics> swap,
                         MetricCollector<DiskMetrics> disk,
                         MetricCollector<NetworkMetrics> network,
                         TransmissionClient transmission,
                         Clock clock) {
        this.hostname = hostname;
        this.interval = interval;
        this.cpu = cpu;
        this.memory = memory;
        this.swap = swap;
        this.disk = disk;
        this.network = network;
        this.transmission = transmission;
        this.clock = clock;
    }

    public synchronized void start() {
        if (scheduler != null && !scheduler.isShutdown()) {
            log.warn("Sampler already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metric-sampler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Started sampling {} every {}s", hostname, interval.toSeconds());
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Sampler did not stop within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Stopped sampling");
    }

    public boolean isRunning() {
        ScheduledExecutorService s = scheduler;
        return s != null && !s.isShutdown();
    }

    private void tick() {
        try {
            transmission.deliver(sample());
        } catch (RuntimeException e) {
            // an exception escaping a fixed-rate task would cancel all later ticks
            log.error("Sampling tick failed", e);
        }
    }

    public MetricSnapshot sample() {
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        long started = System.nanoTime();
        CpuMetrics cpuMetrics = collect(cpu);
        MemoryMetrics memoryMetrics = collect(memory);
        SwapMetrics swapMetrics = collect(swap);
        DiskMetrics diskMetrics = collect(disk);
        NetworkMetrics networkMetrics = collect(network);
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        return new MetricSnapshot(hostname, timestamp, durationMs,
            cpuMetrics, memoryMetrics, swapMetrics, diskMetrics, networkMetrics);
    }

    private <T> T collect(MetricCollector<T> collector) {
        if (collector == null || !collector.isAvailable()) {
            return null;
        }
        try {
            Optional<T> value = collector.collect();
            if (value.isEmpty()) {
                log.debug("Collector {} produced no value", collector.name());
            }
            return value.orElse(null);
        } catch (CollectionException | RuntimeException e) {
            log.atWarn()
                .addKeyValue("error_type", "CollectionError")
                .addKeyValue("collector", collector.name())
                .addKeyValue("hostname", hostname)
                .log("Collector {} failed, omitting its metrics: {}", collector.name(), e.getMessage());
            return null;
        }
    }
}
