package com.sysmon.repository;

import com.sysmon.entity.SnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface SnapshotRecordRepository extends JpaRepository<SnapshotRecord, Long> {
    boolean existsByHostnameAndCollectedAt(String hostname, Instant collectedAt);
    List<SnapshotRecord> findByCollectedAtBetweenOrderByCollectedAtAscHostnameAsc(Instant since, Instant until);
    List<SnapshotRecord> findByHostnameAndCollectedAtBetweenOrderByCollectedAtAsc(String hostname, Instant since, Instant until);
}
