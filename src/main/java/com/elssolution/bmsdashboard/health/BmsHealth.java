package com.elssolution.bmsdashboard.health;

import com.elssolution.bmsdashboard.service.BmsPollingService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

@Component
public class BmsHealth implements HealthIndicator {
    private final BmsPollingService poller;

    @Value("${bms.health.maxAgeMs:30000}")
    private long maxAgeMs;

    public BmsHealth(BmsPollingService poller) { this.poller = poller; }

    @Override public Health health() {
        var v = poller.buildStatus();
        boolean ok = v.getError() == null
                && v.getSnapshotAgeMs() >= 0 && v.getSnapshotAgeMs() < maxAgeMs; // snapshot fresh

        Health.Builder b = (ok ? Health.up() : Health.down())
                .withDetail("address", v.getAddress())
                .withDetail("snapshotAgeMs", v.getSnapshotAgeMs())
                .withDetail("inFlight", v.isInFlight());
        if (v.getError() != null) {
            b.withDetail("errorKind", v.getError().getKind())
             .withDetail("error", v.getError().getMessage());
        }
        return b.build();
    }
}
