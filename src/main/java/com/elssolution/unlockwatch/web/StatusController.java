package com.elssolution.unlockwatch.web;

import com.elssolution.unlockwatch.alerts.AlertService;
import com.elssolution.unlockwatch.service.StatusService;
import com.elssolution.unlockwatch.service.SweepReport;
import com.elssolution.unlockwatch.service.SweepService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

    private final AlertService alerts;
    private final StatusService status;
    private final SweepService sweeps;

    public StatusController(AlertService alerts, StatusService status, SweepService sweeps) {
        this.alerts = alerts;
        this.status = status;
        this.sweeps = sweeps;
    }

    @GetMapping("/status")
    public StatusService.StatusView getStatus() {
        return status.buildStatusView();
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }

    /** Manual sweep; 409 when the scheduled one is still running. */
    @PostMapping("/sweep")
    public ResponseEntity<SweepReport> sweepNow() {
        return sweeps.sweepOnce()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
    }
}
