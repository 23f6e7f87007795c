package com.sysmon.controller;

import com.sysmon.alert.AlertEngine;
import com.sysmon.alert.AlertHistoryService;
import com.sysmon.alert.AlertKey;
import com.sysmon.alert.AlertPhase;
import com.sysmon.repository.AlertEventRecordRepository;
import com.sysmon.repository.SnapshotRecordRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class IngestApiIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private SnapshotRecordRepository snapshotRepository;
    @Autowired
    private AlertEventRecordRepository alertRepository;
    @Autowired
    private AlertEngine alertEngine;
    @Autowired
    private AlertHistoryService alertHistory;

    @AfterEach
    void cleanUp() {
        snapshotRepository.deleteAll();
        alertRepository.deleteAll();
    }

    private static String body(String host, Instant at, double cpu) {
        return """
            {
              "hostname": "%s",
              "metrics": {
                "hostname": "%s",
                "timestamp": "%s",
                "cpu": {"overall_percent": %s, "per_core_percent": [%s, %s], "load_avg_1_5_15": [0.5, 0.4, 0.3]},
                "memory": {"total_bytes": 1000, "used_bytes": 400, "free_bytes": 600, "available_bytes": 600, "percent_used": 40.0},
                "disk": {"filesystems": []},
                "network": {"bytes_sent": 10, "bytes_recv": 20, "errors_in": 0, "errors_out": 0}
              }
            }
            """.formatted(host, host, at, cpu, cpu, cpu);
    }

    @Test
    void ingest_valid_returns202AndIsQueryable() throws Exception {
        mockMvc.perform(post("/ingest").contentType(MediaType.APPLICATION_JSON).content(body("api-1", T0, 42.0)))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("accepted"))
            .andExpect(jsonPath("$.reason").doesNotExist());

        mockMvc.perform(get("/metrics").param("host", "api-1")
                .param("since", T0.minusSeconds(60).toString()).param("until", T0.plusSeconds(60).toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].hostname").value("api-1"))
            .andExpect(jsonPath("$[0].cpu.overall_percent").value(42.0))
            .andExpect(jsonPath("$[0].cpu.load_avg_1_5_15.length()").value(3))
            .andExpect(jsonPath("$[0].memory.percent_used").value(40.0))
            .andExpect(jsonPath("$[0].swap").doesNotExist());
    }

    @Test
    void ingest_duplicate_stillAccepted_storedOnce() throws Exception {
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/ingest").contentType(MediaType.APPLICATION_JSON).content(body("api-2", T0, 10.0)))
                .andExpect(status().isAccepted());
        }

        assertThat(snapshotRepository.count()).isEqualTo(1);
    }

    @Test
    void ingest_outOfRangePercent_returns400WithReason() throws Exception {
        mockMvc.perform(post("/ingest").contentType(MediaType.APPLICATION_JSON).content(body("api-3", T0, 101.0)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("rejected"))
            .andExpect(jsonPath("$.reason").value(org.hamcrest.Matchers.containsString("cpu.overall_percent")));

        assertThat(snapshotRepository.count()).isZero();
    }

    @Test
    void ingest_malformedJson_returns400Rejected() throws Exception {
        mockMvc.perform(post("/ingest").contentType(MediaType.APPLICATION_JSON).content("{\"hostname\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("rejected"));
    }

    @Test
    void ingest_missingTimestamp_returns400() throws Exception {
        mockMvc.perform(post("/ingest").contentType(MediaType.APPLICATION_JSON)
                .content("{\"hostname\":\"api-4\",\"metrics\":{\"cpu\":{\"overall_percent\":5}}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.reason").value(org.hamcrest.Matchers.containsString("metrics.timestamp: missing")));
    }

    @Test
    void ingest_emptyMetricGroups_returns400AndNothingStored() throws Exception {
        String partial = """
            {"hostname": "api-6", "metrics": {"timestamp": "%s", "cpu": {}, "memory": {"total_bytes": 1000}}}
            """.formatted(T0);

        mockMvc.perform(post("/ingest").contentType(MediaType.APPLICATION_JSON).content(partial))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("rejected"))
            .andExpect(jsonPath("$.reason").value(org.hamcrest.Matchers.containsString("cpu.overall_percent: missing")))
            .andExpect(jsonPath("$.reason").value(org.hamcrest.Matchers.containsString("memory.percent_used: missing")));

        assertThat(snapshotRepository.count()).isZero();
    }

    @Test
    void ingest_breach_firesAlertAndRecordsHistory() throws Exception {
        mockMvc.perform(post("/ingest").contentType(MediaType.APPLICATION_JSON).content(body("api-5", T0, 92.0)))
            .andExpect(status().isAccepted());

        AlertKey key = AlertKey.of("api-5", "cpu");
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (alertHistory.recent("api-5", 10).isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(alertEngine.stateOf(key)).get().extracting(s -> s.getPhase()).isEqualTo(AlertPhase.COOLDOWN);

        mockMvc.perform(get("/alerts").param("host", "api-5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].key.metric").value("cpu"))
            .andExpect(jsonPath("$[0].severity").value("ERROR"))
            .andExpect(jsonPath("$[0].value").value(92.0));
    }

    @Test
    void metrics_sinceAfterUntil_returns400() throws Exception {
        mockMvc.perform(get("/metrics").param("since", T0.toString()).param("until", T0.minusSeconds(1).toString()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void metrics_invalidInstant_returns400() throws Exception {
        mockMvc.perform(get("/metrics").param("since", "yesterday"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void health_reportsBackend() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.backend").value("jpa"));
    }
}
