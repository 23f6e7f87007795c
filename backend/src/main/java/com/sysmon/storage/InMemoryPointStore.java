package com.sysmon.storage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class InMemoryPointStore implements PointStore {

    private record PointKey(Instant time, String series) {}

    private static final Comparator<PointKey> ORDER =
        Comparator.comparing(PointKey::time).thenComparing(PointKey::series);

    private static final String SERIES_MAX = "\uffff";

    private final NavigableMap<PointKey, TaggedPoint> points = new TreeMap<>(ORDER);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void write(List<TaggedPoint> batch) {
        lock.writeLock().lock();
        try {
            for (TaggedPoint p : batch) {
                points.put(new PointKey(p.time(), p.seriesKey()), p);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean exists(String measurement, String hostname, Instant time) {
        lock.readLock().lock();
        try {
            return points.subMap(new PointKey(time, ""), true, new PointKey(time, SERIES_MAX), true)
                .values().stream()
                .anyMatch(p -> p.measurement().equals(measurement) && hostname.equals(p.tag(SnapshotPointMapper.TAG_HOST)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TaggedPoint> read(String hostname, Instant since, Instant until) {
        lock.readLock().lock();
        try {
            List<TaggedPoint> result = new ArrayList<>();
            for (TaggedPoint p : points.subMap(new PointKey(since, ""), true, new PointKey(until, SERIES_MAX), true).values()) {
                if (hostname == null || hostname.equals(p.tag(SnapshotPointMapper.TAG_HOST))) {
                    result.add(p);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            points.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
