package com.sysmon.collector.transmission;

import java.util.concurrent.atomic.AtomicLong;

public class DeliveryStats {

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();

    void recordAttempt() { attempts.incrementAndGet(); }

    void record(DeliveryResult.Status status) {
        switch (status) {
            case DELIVERED -> delivered.incrementAndGet();
            case REJECTED -> rejected.incrementAndGet();
            case EXHAUSTED -> failed.incrementAndGet();
            case DROPPED -> dropped.incrementAndGet();
            case ABANDONED -> abandoned.incrementAndGet();
        }
    }

    public long attempts() { return attempts.get(); }
    public long delivered() { return delivered.get(); }
    public long rejected() { return rejected.get(); }
    public long failed() { return failed.get(); }
    public long dropped() { return dropped.get(); }
    public long abandoned() { return abandoned.get(); }
}
