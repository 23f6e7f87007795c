package com.sysmon.controller;

import com.sysmon.alert.AlertEvent;
import com.sysmon.alert.AlertHistoryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class AlertController {

    private final AlertHistoryService historyService;

    public AlertController(AlertHistoryService historyService) {
        this.historyService = historyService;
    }

    @GetMapping("/alerts")
    public List<AlertEvent> recent(@RequestParam(required = false) String host,
                                   @RequestParam(defaultValue = "50") int limit) {
        return historyService.recent(host, limit);
    }
}
