package com.sysmon.controller;

import com.sysmon.dto.MetricSnapshot;
import com.sysmon.service.IngestionService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
public class MetricsQueryController {

    static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

    private final IngestionService ingestionService;
    private final Clock clock;

    public MetricsQueryController(IngestionService ingestionService, Clock clock) {
        this.ingestionService = ingestionService;
        this.clock = clock;
    }

    @GetMapping("/metrics")
    public List<MetricSnapshot> query(
            @RequestParam(required = false) String host,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant until) {
        Instant end = until != null ? until : clock.instant();
        Instant start = since != null ? since : end.minus(DEFAULT_WINDOW);
        return ingestionService.query(host, start, end);
    }
}
