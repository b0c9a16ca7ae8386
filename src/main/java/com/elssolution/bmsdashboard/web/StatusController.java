package com.elssolution.bmsdashboard.web;

import com.elssolution.bmsdashboard.alerts.AlertService;
import com.elssolution.bmsdashboard.domain.Snapshot;
import com.elssolution.bmsdashboard.service.BmsPollingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

    private final AlertService alerts;

    private final BmsPollingService poller;

    public StatusController(AlertService alerts, BmsPollingService poller) {
        this.alerts = alerts;
        this.poller = poller;
    }

    @GetMapping("/status")
    public BmsPollingService.PollStatus getStatus() {
        return poller.buildStatus();
    }

    /** Latest snapshot alone; 204 until the first successful cycle. */
    @GetMapping("/snapshot")
    public ResponseEntity<Snapshot> getSnapshot() {
        Snapshot s = poller.getLatestSnapshot();
        return (s == null) ? ResponseEntity.noContent().build() : ResponseEntity.ok(s);
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }
}
