package com.sysmon.dto;

public record IngestRequest(
    String hostname,
    MetricSnapshot metrics
) {}
