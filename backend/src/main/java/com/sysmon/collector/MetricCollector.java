package com.sysmon.collector;

import java.util.Optional;

public interface MetricCollector<T> {

    String name();

    Optional<T> collect() throws CollectionException;

    boolean isAvailable();
}
