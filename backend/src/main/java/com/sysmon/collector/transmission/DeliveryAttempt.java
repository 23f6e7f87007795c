package com.sysmon.collector.transmission;

import com.sysmon.dto.MetricSnapshot;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

final class DeliveryAttempt {

    private final MetricSnapshot snapshot;
    private final CompletableFuture<DeliveryResult> result = new CompletableFuture<>();
    private DeliveryPhase phase = DeliveryPhase.IDLE;
    private int attemptCount;
    private Duration nextBackoff;
    private String lastError;

    DeliveryAttempt(MetricSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    synchronized boolean begin() {
        if (phase.isTerminal()) return false;
        phase = DeliveryPhase.ATTEMPTING;
        attemptCount++;
        nextBackoff = null;
        return true;
    }

    synchronized void backoff(Duration delay, String error) {
        if (phase.isTerminal()) return;
        phase = DeliveryPhase.BACKOFF;
        nextBackoff = delay;
        lastError = error;
    }

    synchronized boolean finish(DeliveryPhase terminal, String error) {
        if (phase.isTerminal()) return false;
        phase = terminal;
        if (error != null) lastError = error;
        DeliveryResult.Status status = switch (terminal) {
            case SUCCEEDED -> DeliveryResult.Status.DELIVERED;
            case REJECTED -> DeliveryResult.Status.REJECTED;
            case EXHAUSTED -> DeliveryResult.Status.EXHAUSTED;
            case ABANDONED -> DeliveryResult.Status.ABANDONED;
            default -> throw new IllegalArgumentException("Not a terminal phase: " + terminal);
        };
        result.complete(new DeliveryResult(status, attemptCount, lastError));
        return true;
    }

    synchronized boolean drop() {
        if (phase.isTerminal()) return false;
        phase = DeliveryPhase.ABANDONED;
        result.complete(new DeliveryResult(DeliveryResult.Status.DROPPED, attemptCount, "replaced by a newer snapshot"));
        return true;
    }

    MetricSnapshot snapshot() { return snapshot; }
    CompletableFuture<DeliveryResult> result() { return result; }
    synchronized DeliveryPhase phase() { return phase; }
    synchronized int attemptCount() { return attemptCount; }
    synchronized Duration nextBackoff() { return nextBackoff; }
    synchronized String lastError() { return lastError; }
}
