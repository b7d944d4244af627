package com.elssolution.tanksim.health;

import com.elssolution.tanksim.bridge.ExternalBridge;
import com.elssolution.tanksim.domain.SourceStatus;
import com.elssolution.tanksim.service.ReplayStatusService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

/** DOWN only when a running replay has a source that ended in ERROR. */
@Component("replay")
public class ReplayHealth implements HealthIndicator {
    private final ReplayStatusService status;
    private final ExternalBridge bridge;

    public ReplayHealth(ReplayStatusService status, ExternalBridge bridge) {
        this.status = status;
        this.bridge = bridge;
    }

    @Override public Health health() {
        var v = status.buildStatusView();
        long failed = v.getLatest().values().stream()
                .filter(s -> s.status() == SourceStatus.ERROR)
                .count();
        boolean ok = !v.isRunning() || failed == 0;

        return (ok ? Health.up() : Health.down())
                .withDetail("running", v.isRunning())
                .withDetail("sources", v.getSources())
                .withDetail("failedSources", failed)
                .withDetail("queueSize", v.getQueueSize())
                .withDetail("subscribers", status.subscriberCount())
                .withDetail("bridge", bridge.name())
                .withDetail("bridgeDropped", bridge.getDropped())
                .build();
    }
}
