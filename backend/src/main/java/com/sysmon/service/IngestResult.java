package com.sysmon.service;

public record IngestResult(boolean accepted, boolean duplicate, String reason) {

    public static IngestResult stored() {
        return new IngestResult(true, false, null);
    }

    public static IngestResult duplicated() {
        return new IngestResult(true, true, null);
    }

    public static IngestResult rejected(String reason) {
        return new IngestResult(false, false, reason);
    }
}
