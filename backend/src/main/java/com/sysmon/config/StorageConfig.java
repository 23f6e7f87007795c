package com.sysmon.config;

import com.influxdb.client.InfluxDBClientFactory;
import com.sysmon.repository.SnapshotRecordRepository;
import com.sysmon.storage.InMemoryPointStore;
import com.sysmon.storage.InfluxPointStore;
import com.sysmon.storage.JpaStorageBackend;
import com.sysmon.storage.StorageBackend;
import com.sysmon.storage.TimeSeriesStorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public StorageBackend storageBackend(SysmonProperties properties,
                                         SnapshotRecordRepository repository,
                                         PlatformTransactionManager transactionManager,
                                         Clock clock) {
        String backendId = properties.storage().backend().trim().toLowerCase();
        StorageBackend backend = switch (backendId) {
            case "jpa" -> new JpaStorageBackend(repository, transactionManager, clock);
            case "influxdb" -> {
                SysmonProperties.Influx influx = properties.storage().influxdb();
                if (influx.token() == null || influx.token().isBlank()) {
                    throw new IllegalStateException("sysmon.storage.influxdb.token is required for the influxdb backend");
                }
                yield new TimeSeriesStorageBackend("influxdb", new InfluxPointStore(
                    InfluxDBClientFactory.create(influx.url(), influx.token().toCharArray(), influx.org(), influx.bucket()),
                    influx.org(), influx.bucket()));
            }
            case "memory" -> new TimeSeriesStorageBackend("memory", new InMemoryPointStore());
            default -> throw new IllegalStateException("Unknown storage backend '" + backendId
                + "' (sysmon.storage.backend) - expected one of: jpa, influxdb, memory");
        };

        if (!backend.ping()) {
            backend.close();
            throw new IllegalStateException("Storage backend '" + backendId + "' is unreachable at startup");
        }
        log.info("Storage backend '{}' ready", backend.id());
        return backend;
    }
}
