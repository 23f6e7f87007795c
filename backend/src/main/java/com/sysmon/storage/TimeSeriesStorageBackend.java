package com.sysmon.storage;

import com.sysmon.dto.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public class TimeSeriesStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesStorageBackend.class);

    private final String id;
    private final PointStore store;
    // one writer per host at a time, so the duplicate check and the batch write do not interleave
    private final ConcurrentHashMap<String, Object> hostLocks = new ConcurrentHashMap<>();

    public TimeSeriesStorageBackend(String id, PointStore store) {
        this.id = id;
        this.store = store;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public WriteOutcome write(MetricSnapshot snapshot) {
        Object hostLock = hostLocks.computeIfAbsent(snapshot.hostname(), k -> new Object());
        synchronized (hostLock) {
            try {
                if (store.exists(SnapshotPointMapper.M_SNAPSHOT, snapshot.hostname(), snapshot.timestamp())) {
                    return WriteOutcome.DUPLICATE;
                }
                List<TaggedPoint> points = SnapshotPointMapper.toPoints(snapshot);
                store.write(points);
                log.debug("Stored {} points for {} at {}", points.size(), snapshot.hostname(), snapshot.timestamp());
                return WriteOutcome.STORED;
            } catch (StorageException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new StorageException("Failed to write snapshot for " + snapshot.hostname(), e);
            }
        }
    }

    @Override
    public List<MetricSnapshot> query(SnapshotQuery query) {
        try {
            return SnapshotPointMapper.fromPoints(store.read(query.host(), query.since(), query.until()));
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Failed to query snapshots", e);
        }
    }

    @Override
    public boolean ping() {
        try {
            return store.ping();
        } catch (RuntimeException e) {
            log.warn("Time-series store unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        store.close();
        log.info("Time-series storage backend '{}' closed", id);
    }
}
