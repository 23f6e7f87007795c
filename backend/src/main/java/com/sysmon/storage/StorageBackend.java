package com.sysmon.storage;

import com.sysmon.dto.MetricSnapshot;

import java.util.List;

public interface StorageBackend {

    String id();

    WriteOutcome write(MetricSnapshot snapshot);

    List<MetricSnapshot> query(SnapshotQuery query);

    boolean ping();

    void close();
}
