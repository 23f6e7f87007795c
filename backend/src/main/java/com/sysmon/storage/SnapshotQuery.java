package com.sysmon.storage;

import com.sysmon.dto.MetricSnapshot;

import java.time.Instant;
import java.util.Objects;

public record SnapshotQuery(String host, Instant since, Instant until) {

    public SnapshotQuery {
        Objects.requireNonNull(since, "since");
        Objects.requireNonNull(until, "until");
        if (since.isAfter(until)) {
            throw new IllegalArgumentException("'since' must not be after 'until'");
        }
        host = host == null || host.isBlank() ? null : host.trim();
    }

    public boolean matches(MetricSnapshot snapshot) {
        return (host == null || host.equals(snapshot.hostname()))
            && !snapshot.timestamp().isBefore(since)
            && !snapshot.timestamp().isAfter(until);
    }
}
