package com.sysmon.entity;

import com.sysmon.alert.AlertEvent;
import com.sysmon.alert.AlertKey;
import com.sysmon.alert.Severity;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "alert_events",
    indexes = @Index(name = "idx_alert_host_time", columnList = "hostname, fired_at"))
public class AlertEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hostname", nullable = false)
    private String hostname;
    @Column(nullable = false)
    private String metric;
    private String subResource;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Column(name = "alert_value")
    private double value;
    private double threshold;
    @Column(name = "fired_at", nullable = false)
    private Instant firedAt;
    @Column(length = 1000)
    private String message;

    public static AlertEventRecord from(AlertEvent event) {
        AlertEventRecord r = new AlertEventRecord();
        r.hostname = event.key().hostname();
        r.metric = event.key().metric();
        r.subResource = event.key().subResource();
        r.severity = event.severity();
        r.value = event.value();
        r.threshold = event.threshold();
        r.firedAt = event.firedAt();
        r.message = event.message();
        return r;
    }

    public AlertEvent toEvent() {
        return new AlertEvent(new AlertKey(hostname, metric, subResource), severity, value, threshold, firedAt, message);
    }

    public Long getId() { return id; }
    public String getHostname() { return hostname; }
    public String getMetric() { return metric; }
    public Severity getSeverity() { return severity; }
    public Instant getFiredAt() { return firedAt; }
}
