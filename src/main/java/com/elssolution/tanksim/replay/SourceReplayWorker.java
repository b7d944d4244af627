package com.elssolution.tanksim.replay;

import com.elssolution.tanksim.alerts.AlertService;
import com.elssolution.tanksim.bridge.ExternalBridge;
import com.elssolution.tanksim.bus.EventBus;
import com.elssolution.tanksim.cache.LatestStateCache;
import com.elssolution.tanksim.domain.LoadedSource;
import com.elssolution.tanksim.domain.Reading;
import com.elssolution.tanksim.domain.ReplayEvent;
import com.elssolution.tanksim.domain.SourceSnapshot;
import com.elssolution.tanksim.domain.SourceStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Replays one source forever: cursor 0..n-1, wrapping, one event per tick.
 *
 * Wraparound replays values, not sequence numbers: the sequence keeps counting up
 * until the worker is stopped. Cancellation is cooperative and observed only while
 * waiting between ticks.
 */
@Slf4j
public class SourceReplayWorker implements Runnable {

    public static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final long runId;
    private final LoadedSource source;
    private final Duration delay;
    private final double levelScale;
    private final EventBus bus;
    private final LatestStateCache cache;
    private final ExternalBridge bridge;
    private final AlertService alerts;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    // only touched by the worker thread (or by tests calling tick() directly)
    private int cursor = 0;
    private long sequence = 0L;

    /**
     * @param runId start generation this worker belongs to; cache writes carry it so that
     *              a worker left over from an earlier start cannot touch a newer snapshot
     */
    public SourceReplayWorker(long runId,
                              LoadedSource source,
                              Duration delay,
                              double levelScale,
                              EventBus bus,
                              LatestStateCache cache,
                              ExternalBridge bridge,
                              AlertService alerts) {
        if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
        this.runId = runId;
        this.source = source;
        this.delay = delay;
        this.levelScale = levelScale;
        this.bus = bus;
        this.cache = cache;
        this.bridge = bridge;
        this.alerts = alerts;
    }

    public String sourceId() {
        return source.id();
    }

    // ---- Loop ----

    @Override
    public void run() {
        log.info("replay_worker_started source={} run={} total={} delayMs={}",
                source.id(), runId, source.size(), delay.toMillis());
        SourceStatus exitStatus = SourceStatus.STOPPED;
        try {
            while (!isStopRequested() && !Thread.currentThread().isInterrupted()) {
                tick();
                if (awaitStop()) break;
            }
        } catch (RuntimeException e) {
            exitStatus = SourceStatus.ERROR;
            log.error("replay_worker_failed source={} seq={}", source.id(), sequence, e);
            alerts.raise("REPLAY_WORKER_FAILED", source.id() + ": " + e, AlertService.Severity.ERROR);
        } finally {
            cache.markTerminal(source.id(), exitStatus, runId)
                    .ifPresent(s -> bridge.mirrorSnapshot(source.id(), s));
            log.info("replay_worker_exited source={} run={} status={} lastSeq={}", source.id(), runId, exitStatus, sequence);
            finished.countDown();
        }
    }

    /** Emits the event for the current cursor position and advances. */
    ReplayEvent tick() {
        Reading r = source.readings().get(cursor);
        double normalized = source.range().normalize(r.value());
        ReplayEvent event = ReplayEvent.builder()
                .sourceId(source.id())
                .timestamp(TS_FORMAT.format(r.timestamp()))
                .rawValue(r.value())
                .normalized(normalized)
                .level(round3(normalized * levelScale))
                .sequence(++sequence)
                .totalCount(source.size())
                .build();

        bus.publish(event);
        SourceSnapshot snap = SourceSnapshot.running(event);
        if (cache.set(source.id(), snap, runId)) {
            bridge.mirrorSnapshot(source.id(), snap);
        }

        cursor = (cursor + 1) % source.size();
        if (log.isDebugEnabled()) {
            log.debug("replay_tick source={} seq={} raw={} level={}", source.id(), event.getSequence(),
                    event.getRawValue(), event.getLevel());
        }
        return event;
    }

    /** Timed wait between ticks; returns true once a stop was requested. */
    private boolean awaitStop() {
        try {
            return stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    // ---- Control ----

    public void requestStop() {
        stopSignal.countDown();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    /** Waits up to {@code grace} for the loop to exit. */
    public boolean awaitExit(Duration grace) {
        try {
            return finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean hasExited() {
        return finished.getCount() == 0;
    }

    private static double round3(double v) { return Math.round(v * 1000.0) / 1000.0; }
}
