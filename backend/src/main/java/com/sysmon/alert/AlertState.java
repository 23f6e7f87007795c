package com.sysmon.alert;

import java.time.Duration;
import java.time.Instant;

public class AlertState {

    private AlertPhase phase = AlertPhase.NORMAL;
    private Instant lastFiredAt;
    private boolean active;
    private double lastValue;
    private Instant lastEvaluatedAt;

    AlertState() {}

    private AlertState(AlertState other) {
        this.phase = other.phase;
        this.lastFiredAt = other.lastFiredAt;
        this.active = other.active;
        this.lastValue = other.lastValue;
        this.lastEvaluatedAt = other.lastEvaluatedAt;
    }

    boolean cooldownElapsed(Instant now, Duration cooldown) {
        return lastFiredAt == null || !now.isBefore(lastFiredAt.plus(cooldown));
    }

    void observe(double value, Instant at) {
        this.lastValue = value;
        this.lastEvaluatedAt = at;
    }

    void fire(Instant at) {
        phase = AlertPhase.FIRING;
        lastFiredAt = at;
        active = true;
    }

    void enterCooldown() {
        phase = AlertPhase.COOLDOWN;
    }

    void markActive() {
        active = true;
    }

    void recover() {
        active = false;
    }

    void reset() {
        phase = AlertPhase.NORMAL;
        active = false;
    }

    AlertState copy() {
        return new AlertState(this);
    }

    public AlertPhase getPhase() { return phase; }
    public Instant getLastFiredAt() { return lastFiredAt; }
    public boolean isActive() { return active; }
    public double getLastValue() { return lastValue; }
    public Instant getLastEvaluatedAt() { return lastEvaluatedAt; }
}
