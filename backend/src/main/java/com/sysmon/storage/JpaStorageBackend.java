package com.sysmon.storage;

import com.sysmon.dto.MetricSnapshot;
import com.sysmon.entity.SnapshotRecord;
import com.sysmon.repository.SnapshotRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

public class JpaStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(JpaStorageBackend.class);

    private final SnapshotRecordRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Clock clock;

    public JpaStorageBackend(SnapshotRecordRepository repository,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.clock = clock;
    }

    @Override
    public String id() {
        return "jpa";
    }

    @Override
    public WriteOutcome write(MetricSnapshot snapshot) {
        try {
            return transactionTemplate.execute(status -> {
                if (repository.existsByHostnameAndCollectedAt(snapshot.hostname(), snapshot.timestamp())) {
                    return WriteOutcome.DUPLICATE;
                }
                repository.saveAndFlush(SnapshotRecord.from(snapshot, clock.instant()));
                return WriteOutcome.STORED;
            });
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent write of the same snapshot
            log.debug("Duplicate snapshot for {} at {} rejected by constraint", snapshot.hostname(), snapshot.timestamp());
            return WriteOutcome.DUPLICATE;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to write snapshot for " + snapshot.hostname(), e);
        }
    }

    @Override
    public List<MetricSnapshot> query(SnapshotQuery query) {
        try {
            return readOnlyTemplate.execute(status -> {
                List<SnapshotRecord> records = query.host() == null
                    ? repository.findByCollectedAtBetweenOrderByCollectedAtAscHostnameAsc(query.since(), query.until())
                    : repository.findByHostnameAndCollectedAtBetweenOrderByCollectedAtAsc(query.host(), query.since(), query.until());
                return records.stream().map(SnapshotRecord::toSnapshot).toList();
            });
        } catch (DataAccessException e) {
            throw new StorageException("Failed to query snapshots", e);
        }
    }

    @Override
    public boolean ping() {
        try {
            repository.count();
            return true;
        } catch (Exception e) {
            log.warn("Relational store unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        // connection pool is owned by the Spring context
        log.info("JPA storage backend closed");
    }
}
