package com.sysmon.collector.transmission;

import com.sysmon.dto.MetricSnapshot;

public interface IngestTransport {

    void send(MetricSnapshot snapshot) throws DeliveryException;
}
