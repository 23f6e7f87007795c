package com.sysmon.alert;

import com.sysmon.entity.AlertEventRecord;
import com.sysmon.repository.AlertEventRecordRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class AlertHistoryService {

    static final int MAX_LIMIT = 500;

    private final AlertEventRecordRepository repository;

    public AlertHistoryService(AlertEventRecordRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public void record(AlertEvent event) {
        repository.save(AlertEventRecord.from(event));
    }

    @Transactional(readOnly = true)
    public List<AlertEvent> recent(String hostname, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));
        List<AlertEventRecord> records = hostname == null || hostname.isBlank()
            ? repository.findAllByOrderByFiredAtDescIdDesc(page)
            : repository.findByHostnameOrderByFiredAtDescIdDesc(hostname.trim(), page);
        return records.stream().map(AlertEventRecord::toEvent).toList();
    }
}
