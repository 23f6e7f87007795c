package com.sysmon.service;

import com.sysmon.alert.AlertEngine;
import com.sysmon.dto.MetricSnapshot;
import com.sysmon.storage.SnapshotQuery;
import com.sysmon.storage.StorageBackend;
import com.sysmon.storage.WriteOutcome;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final SnapshotValidator validator;
    private final StorageBackend storage;
    private final AlertEngine alertEngine;
    private final SimpMessagingTemplate messaging;

    private volatile boolean accepting = true;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object drainLock = new Object();

    public IngestionService(SnapshotValidator validator,
                            StorageBackend storage,
                            AlertEngine alertEngine,
                            SimpMessagingTemplate messaging) {
        this.validator = validator;
        this.storage = storage;
        this.alertEngine = alertEngine;
        this.messaging = messaging;
    }

    public IngestResult ingest(String hostname, MetricSnapshot snapshot) {
        if (!accepting) {
            throw new ServiceUnavailableException("Ingestion is shutting down");
        }
        inFlight.incrementAndGet();
        try {
            if (!accepting) {
                throw new ServiceUnavailableException("Ingestion is shutting down");
            }
            List<String> errors = validator.validate(hostname, snapshot);
            if (!errors.isEmpty()) {
                String reason = String.join("; ", errors);
                log.warn("Rejected snapshot from {}: {}", hostname, reason);
                return IngestResult.rejected(reason);
            }
            MetricSnapshot normalized = snapshot.normalized(hostname);

            alertEngine.submit(normalized);
            WriteOutcome outcome = storage.write(normalized);
            if (outcome == WriteOutcome.DUPLICATE) {
                log.debug("Duplicate snapshot {} at {} ignored", normalized.hostname(), normalized.timestamp());
                return IngestResult.duplicated();
            }
            publish(normalized);
            return IngestResult.stored();
        } finally {
            if (inFlight.decrementAndGet() == 0) {
                synchronized (drainLock) {
                    drainLock.notifyAll();
                }
            }
        }
    }

    public List<MetricSnapshot> query(String host, Instant since, Instant until) {
        return storage.query(new SnapshotQuery(host, since, until));
    }

    public boolean isAccepting() {
        return accepting;
    }

    public String backendId() {
        return storage.id();
    }

    public boolean storageReachable() {
        return accepting && storage.ping();
    }

    private void publish(MetricSnapshot snapshot) {
        try {
            messaging.convertAndSend("/topic/metrics/" + snapshot.hostname(), snapshot);
        } catch (Exception e) {
            log.debug("Failed to broadcast snapshot for {}: {}", snapshot.hostname(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        accepting = false;
        long deadline = System.nanoTime() + SHUTDOWN_GRACE.toNanos();
        synchronized (drainLock) {
            while (inFlight.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("Ingestion shutdown grace elapsed with {} write(s) in flight", inFlight.get());
                    return;
                }
                try {
                    drainLock.wait(Math.max(1, remaining / 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
        log.info("Ingestion stopped");
    }
}
