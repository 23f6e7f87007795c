package com.sysmon.controller;

import com.sysmon.dto.IngestRequest;
import com.sysmon.dto.IngestResponse;
import com.sysmon.service.IngestResult;
import com.sysmon.service.IngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IngestController {

    private final IngestionService ingestionService;

    public IngestController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/ingest")
    public ResponseEntity<IngestResponse> ingest(@RequestBody IngestRequest request) {
        IngestResult result = ingestionService.ingest(request.hostname(), request.metrics());
        if (!result.accepted()) {
            return ResponseEntity.badRequest().body(IngestResponse.rejected(result.reason()));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestResponse.accepted());
    }
}
