package com.elssolution.tanksim.control;

import com.elssolution.tanksim.alerts.AlertService;
import com.elssolution.tanksim.bridge.ExternalBridge;
import com.elssolution.tanksim.bus.EventBus;
import com.elssolution.tanksim.cache.LatestStateCache;
import com.elssolution.tanksim.domain.LoadedSource;
import com.elssolution.tanksim.domain.Reading;
import com.elssolution.tanksim.loader.SourceLoadException;
import com.elssolution.tanksim.loader.SourceLoader;
import com.elssolution.tanksim.replay.SourceReplayWorker;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutorService;

/**
 * Start/stop/restart of the replay workers.
 *
 * States: STOPPED (initial) and RUNNING. A start is all-or-nothing: every source must
 * load before anything running is touched. Stop is cooperative with a bounded wait per
 * worker; a worker that overruns the grace period is abandoned, not killed.
 *
 * Control calls are serialized on this instance. Query calls read volatile fields only
 * and never wait behind a start/stop in progress.
 */
@Slf4j
public class ReplayControlPlane {

    public enum State { STOPPED, RUNNING }

    public record StartResult(String status, List<String> sources, double delaySeconds) {}

    @lombok.Value
    @Builder
    public static class Settings {
        @Builder.Default double levelScale = 10.0;
        @Builder.Default Duration stopGrace = Duration.ofSeconds(2);
        @Builder.Default double defaultDelaySeconds = 1.0;
        @Builder.Default List<String> defaultSources = List.of();
    }

    private final SourceLoader loader;
    private final EventBus bus;
    private final LatestStateCache cache;
    private final ExternalBridge bridge;
    private final AlertService alerts;
    private final ExecutorService executor;
    private final Settings settings;

    private final Map<String, SourceReplayWorker> workers = new LinkedHashMap<>();
    private volatile State state = State.STOPPED;
    private volatile List<String> activeSources = List.of();
    private volatile double activeDelaySeconds = 0.0;
    private long runCounter = 0L; // guarded by this

    public ReplayControlPlane(SourceLoader loader,
                              EventBus bus,
                              LatestStateCache cache,
                              ExternalBridge bridge,
                              AlertService alerts,
                              ExecutorService executor,
                              Settings settings) {
        this.loader = loader;
        this.bus = bus;
        this.cache = cache;
        this.bridge = bridge;
        this.alerts = alerts;
        this.executor = executor;
        this.settings = settings;
    }

    // ---- Transitions ----

    /**
     * Loads every source, then replaces whatever is running with one worker per source.
     *
     * @param delaySeconds inter-event delay; null means the configured default
     * @param refs source references; null/empty means the configured default list
     * @throws ReplayStartException if any source fails to load (nothing running is touched)
     */
    public synchronized StartResult start(Double delaySeconds, List<String> refs) {
        double delay = (delaySeconds == null) ? settings.getDefaultDelaySeconds() : delaySeconds;
        if (!Double.isFinite(delay) || delay < 0) {
            throw new IllegalArgumentException("delaySeconds must be >= 0, got " + delaySeconds);
        }
        List<String> wanted = (refs == null || refs.isEmpty()) ? settings.getDefaultSources() : refs;
        if (wanted.isEmpty()) {
            throw new ReplayStartException(List.of("no sources given and no default sources configured"));
        }

        List<LoadedSource> loaded = loadAll(wanted);

        // all sources valid: tear down the previous run
        stopWorkers();
        cache.clear();
        bridge.clearMirror();

        long runId = ++runCounter;
        Duration tick = Duration.ofMillis(Math.round(delay * 1000.0));
        List<String> ids = new ArrayList<>(loaded.size());
        for (LoadedSource src : loaded) {
            SourceReplayWorker w = new SourceReplayWorker(runId, src, tick, settings.getLevelScale(),
                    bus, cache, bridge, alerts);
            workers.put(src.id(), w);
            ids.add(src.id());
        }
        workers.values().forEach(executor::execute);

        activeSources = List.copyOf(ids);
        activeDelaySeconds = delay;
        state = State.RUNNING;
        log.info("replay_started run={} sources={} delaySeconds={}", runId, ids, delay);
        return new StartResult("started", activeSources, delay);
    }

    /** Signals every worker, waits a bounded time for each, then reports STOPPED regardless. */
    public synchronized void stop() {
        boolean wasRunning = state == State.RUNNING;
        stopWorkers();
        state = State.STOPPED;
        activeSources = List.of();
        if (wasRunning) log.info("replay_stopped");
    }

    private List<LoadedSource> loadAll(List<String> refs) {
        List<LoadedSource> ok = new ArrayList<>(refs.size());
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String ref : refs) {
            if (ref == null || ref.isBlank()) {
                errors.add("'" + (ref == null ? "" : ref) + "': empty source reference");
                continue;
            }
            String id = loader.sourceId(ref);
            if (!seen.add(id)) {
                errors.add(id + ": duplicate source id");
                continue;
            }
            try {
                List<Reading> readings = loader.load(ref);
                if (readings == null || readings.isEmpty()) {
                    errors.add(id + ": no readings");
                    continue;
                }
                ok.add(LoadedSource.of(id, readings));
            } catch (SourceLoadException e) {
                errors.add(e.getSourceId() + ": " + e.getReason());
            }
        }
        if (!errors.isEmpty()) {
            log.warn("replay_start_rejected errors={}", errors);
            alerts.raise("LOAD_FAILED", String.join("; ", errors), AlertService.Severity.WARN);
            throw new ReplayStartException(errors);
        }
        alerts.resolve("LOAD_FAILED");
        return ok;
    }

    private void stopWorkers() {
        if (workers.isEmpty()) return;
        workers.values().forEach(SourceReplayWorker::requestStop);
        for (SourceReplayWorker w : workers.values()) {
            if (!w.awaitExit(settings.getStopGrace())) {
                log.warn("replay_worker_overran source={} graceMs={} (abandoned)",
                        w.sourceId(), settings.getStopGrace().toMillis());
            }
        }
        workers.clear();
    }

    // ---- Queries ----

    public State getState() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public List<String> getActiveSources() {
        return activeSources;
    }

    public double getActiveDelaySeconds() {
        return activeDelaySeconds;
    }

    public List<String> getDefaultSources() {
        return settings.getDefaultSources();
    }

    /** Shutdown hook: stop workers so their snapshots end in STOPPED. */
    public void shutdown() {
        stop();
    }
}
