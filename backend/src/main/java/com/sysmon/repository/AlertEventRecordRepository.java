package com.sysmon.repository;

import com.sysmon.entity.AlertEventRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AlertEventRecordRepository extends JpaRepository<AlertEventRecord, Long> {
    List<AlertEventRecord> findAllByOrderByFiredAtDescIdDesc(Pageable pageable);
    List<AlertEventRecord> findByHostnameOrderByFiredAtDescIdDesc(String hostname, Pageable pageable);
}
