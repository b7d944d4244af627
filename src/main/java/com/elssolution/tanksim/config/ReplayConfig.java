package com.elssolution.tanksim.config;

import com.elssolution.tanksim.alerts.AlertService;
import com.elssolution.tanksim.bridge.ExternalBridge;
import com.elssolution.tanksim.bus.EventBus;
import com.elssolution.tanksim.cache.LatestStateCache;
import com.elssolution.tanksim.control.ReplayControlPlane;
import com.elssolution.tanksim.loader.SourceLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Wires the replay core. The bus, the cache and the control plane are plain classes;
 * one instance of each lives in the context and is handed to whoever needs it.
 */
@Slf4j
@Configuration
public class ReplayConfig {

    @Value("${replay.level.scale:10.0}")        private double levelScale;
    @Value("${replay.stopGraceMs:2000}")        private long stopGraceMs;
    @Value("${replay.defaultDelaySeconds:1.0}") private double defaultDelaySeconds;
    @Value("${replay.sources:}")                private String sourcesCsv;   // comma-separated
    @Value("${replay.bridge.redis.channel:tank_events}") private String bridgeChannel;

    @Bean
    public LatestStateCache latestStateCache() {
        return new LatestStateCache();
    }

    @Bean(destroyMethod = "closeAll")
    public EventBus eventBus(ExternalBridge bridge) {
        EventBus bus = new EventBus(bridge);
        bridge.subscribe(bridgeChannel, bus::deliverExternal);
        return bus;
    }

    @Bean(destroyMethod = "shutdown")
    public ReplayControlPlane replayControlPlane(SourceLoader loader,
                                                 EventBus bus,
                                                 LatestStateCache cache,
                                                 ExternalBridge bridge,
                                                 AlertService alerts,
                                                 @Qualifier("replayExecutor") ExecutorService replayExecutor) {
        // sanitize knobs
        if (levelScale <= 0 || !Double.isFinite(levelScale)) {
            log.warn("replay.level.scale invalid ({}). Using 10.0.", levelScale);
            levelScale = 10.0;
        }
        if (stopGraceMs < 0) {
            log.warn("replay.stopGraceMs < 0 ({}). Clamping to 0.", stopGraceMs);
            stopGraceMs = 0;
        }
        if (defaultDelaySeconds < 0 || !Double.isFinite(defaultDelaySeconds)) {
            log.warn("replay.defaultDelaySeconds invalid ({}). Using 1.0.", defaultDelaySeconds);
            defaultDelaySeconds = 1.0;
        }

        ReplayControlPlane.Settings settings = ReplayControlPlane.Settings.builder()
                .levelScale(levelScale)
                .stopGrace(Duration.ofMillis(stopGraceMs))
                .defaultDelaySeconds(defaultDelaySeconds)
                .defaultSources(splitCsv(sourcesCsv))
                .build();
        log.info("Replay core: levelScale={}, stopGraceMs={}, defaultDelaySeconds={}, defaultSources={}",
                levelScale, stopGraceMs, defaultDelaySeconds, settings.getDefaultSources());
        return new ReplayControlPlane(loader, bus, cache, bridge, alerts, replayExecutor, settings);
    }

    static List<String> splitCsv(String csv) {
        return Arrays.stream(Optional.ofNullable(csv).orElse("").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
