package com.sysmon.storage;

import java.time.Instant;
import java.util.List;

public interface PointStore {

    void write(List<TaggedPoint> points);

    boolean exists(String measurement, String hostname, Instant time);

    List<TaggedPoint> read(String hostname, Instant since, Instant until);

    boolean ping();

    void close();
}
