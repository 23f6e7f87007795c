package com.sysmon.collector.transmission;

public record DeliveryResult(Status status, int attempts, String error) {

    public enum Status {
        DELIVERED,
        REJECTED,
        EXHAUSTED,
        DROPPED,
        ABANDONED
    }

    public boolean delivered() {
        return status == Status.DELIVERED;
    }
}
