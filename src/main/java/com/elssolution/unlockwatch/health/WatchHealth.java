package com.elssolution.unlockwatch.health;

import com.elssolution.unlockwatch.service.StatusService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

/** UP while sweeps keep completing; DOWN when the last one is older than three periods. */
@Component
public class WatchHealth implements HealthIndicator {
    private final StatusService status;

    public WatchHealth(StatusService status) { this.status = status; }

    @Override public Health health() {
        var v = status.buildStatusView();
        Health.Builder b;
        if (v.getLastSweep() == null) {
            b = Health.unknown();
        } else {
            boolean fresh = v.getLastSweepAgeMs() <= v.getSweepPeriodSeconds() * 3_000L;
            b = fresh ? Health.up() : Health.down();
        }
        return b.withDetail("endpointConfigured", v.isEndpointConfigured())
                .withDetail("subscribers", v.getSubscribers())
                .withDetail("lastSweepAgeMs", v.getLastSweepAgeMs())
                .withDetail("sweepRunning", v.isSweepRunning())
                .build();
    }
}
