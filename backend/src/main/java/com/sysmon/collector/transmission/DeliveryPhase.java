package com.sysmon.collector.transmission;

public enum DeliveryPhase {
    IDLE,
    ATTEMPTING,
    BACKOFF,
    SUCCEEDED,
    REJECTED,
    EXHAUSTED,
    ABANDONED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == REJECTED || this == EXHAUSTED || this == ABANDONED;
    }
}
