package com.sysmon.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmon.collector.transmission.HttpIngestTransport;
import com.sysmon.collector.transmission.RetryPolicy;
import com.sysmon.collector.transmission.TransmissionClient;
import com.sysmon.config.SysmonProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;

@Configuration
@ConditionalOnProperty(prefix = "sysmon.collector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CollectorConfig {

    @Bean(destroyMethod = "close")
    public TransmissionClient transmissionClient(SysmonProperties properties, ObjectMapper objectMapper) {
        SysmonProperties.Endpoint endpoint = properties.endpoint();
        HttpIngestTransport transport = new HttpIngestTransport(URI.create(endpoint.url()), endpoint.timeout(), objectMapper);
        return new TransmissionClient(transport, RetryPolicy.from(endpoint), endpoint.queueDepth());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public MetricSampler metricSampler(SysmonProperties properties, TransmissionClient transmissionClient, Clock clock) {
        ProcFs procFs = new ProcFs(Path.of(properties.collector().procRoot()));
        return new MetricSampler(
            properties.resolvedHostname(),
            Duration.ofSeconds(properties.intervalSeconds()),
            new CpuCollector(procFs),
            new MemoryCollector(procFs),
            new SwapCollector(procFs),
            new DiskCollector(procFs, new HashSet<>(properties.collector().excludedFsTypes())),
            new NetworkCollector(procFs),
            transmissionClient,
            clock);
    }
}
