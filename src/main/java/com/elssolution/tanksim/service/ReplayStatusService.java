package com.elssolution.tanksim.service;

import com.elssolution.tanksim.bus.EventBus;
import com.elssolution.tanksim.cache.LatestStateCache;
import com.elssolution.tanksim.control.ReplayControlPlane;
import com.elssolution.tanksim.domain.SourceSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Status aggregation for the query surface, the health indicator and the periodic summary log.
 * Every read is a lock-copy-release on one component; nothing here holds two locks at once.
 */
@Slf4j
@Component
public class ReplayStatusService {

    private final ScheduledExecutorService scheduler;
    private final ReplayControlPlane control;
    private final LatestStateCache cache;
    private final EventBus bus;

    public ReplayStatusService(@Qualifier("scheduler") ScheduledExecutorService scheduler,
                               ReplayControlPlane control,
                               LatestStateCache cache,
                               EventBus bus) {
        this.scheduler = scheduler;
        this.control = control;
        this.cache = cache;
        this.bus = bus;
    }

    // Summary log period
    @Value("${replay.summary.periodSeconds:30}") private int summaryEverySec;

    @PostConstruct
    void startSummaryLogger() {
        if (summaryEverySec <= 0) {
            log.info("Status summary logger disabled");
            return;
        }
        scheduler.scheduleAtFixedRate(this::logSummarySafe, summaryEverySec, summaryEverySec, TimeUnit.SECONDS);
        log.info("Status summary logger started: every {}s", summaryEverySec);
    }

    // ---------------------- Public API ----------------------

    public StatusView buildStatusView() {
        return StatusView.builder()
                .running(control.isRunning())
                .sources(control.getActiveSources())
                .latest(cache.getAll())
                .queueSize(bus.queueSize())
                .build();
    }

    public LatestView buildLatestView() {
        return new LatestView(cache.getAll());
    }

    public int subscriberCount() {
        return bus.subscriberCount();
    }

    // ---------------------- Log summary ----------------------

    private void logSummarySafe() {
        try {
            StatusView v = buildStatusView();
            log.info("Status: running={} sources={} queueSize={} subscribers={} delay={}s",
                    v.running, v.sources, v.queueSize, bus.subscriberCount(), control.getActiveDelaySeconds());
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    // ---------------------- Views ----------------------

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StatusView {
        boolean running;
        List<String> sources;
        Map<String, SourceSnapshot> latest;
        int queueSize;
    }

    public record LatestView(Map<String, SourceSnapshot> latest) {}
}
