package com.elssolution.tanksim.cache;

import com.elssolution.tanksim.domain.SourceSnapshot;
import com.elssolution.tanksim.domain.SourceStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest snapshot per source. Guarded by its own lock, never nested with the bus locks.
 * Snapshots are immutable, so handing out a copy of the map is enough for readers.
 *
 * Every write names the run that produced it. A newer run replaces whatever an older run
 * left behind; writes from an older run are rejected, so a worker abandoned on restart
 * cannot overwrite (or terminate) the snapshot of its successor.
 */
@Slf4j
public class LatestStateCache {

    private record Entry(long runId, SourceSnapshot snapshot) {}

    private final Object lock = new Object();
    private final Map<String, Entry> latest = new LinkedHashMap<>();

    /**
     * Stores {@code snapshot} for run {@code runId} unless an entry from a newer run exists,
     * or the same run already reached a terminal status.
     * @return false if the write was rejected
     */
    public boolean set(String sourceId, SourceSnapshot snapshot, long runId) {
        synchronized (lock) {
            Entry cur = latest.get(sourceId);
            if (cur != null) {
                if (cur.runId() > runId) {
                    log.debug("snapshot_stale source={} run={} current={}", sourceId, runId, cur.runId());
                    return false;
                }
                if (cur.runId() == runId && !cur.snapshot().status().canMoveTo(snapshot.status())) {
                    log.debug("snapshot_rejected source={} from={} to={}",
                            sourceId, cur.snapshot().status(), snapshot.status());
                    return false;
                }
            }
            latest.put(sourceId, new Entry(runId, snapshot));
            return true;
        }
    }

    /**
     * Moves the snapshot written by run {@code runId} into a terminal status.
     * No-op if the source has no snapshot yet or the snapshot belongs to another run.
     */
    public Optional<SourceSnapshot> markTerminal(String sourceId, SourceStatus status, long runId) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + status);
        }
        synchronized (lock) {
            Entry cur = latest.get(sourceId);
            if (cur == null || cur.runId() != runId || !cur.snapshot().status().canMoveTo(status)) {
                return Optional.empty();
            }
            SourceSnapshot next = cur.snapshot().withStatus(status);
            latest.put(sourceId, new Entry(runId, next));
            return Optional.of(next);
        }
    }

    public Optional<SourceSnapshot> get(String sourceId) {
        synchronized (lock) {
            return Optional.ofNullable(latest.get(sourceId)).map(Entry::snapshot);
        }
    }

    /** Insertion-ordered copy of every snapshot. */
    public Map<String, SourceSnapshot> getAll() {
        synchronized (lock) {
            Map<String, SourceSnapshot> out = new LinkedHashMap<>();
            latest.forEach((id, e) -> out.put(id, e.snapshot()));
            return out;
        }
    }

    public void clear() {
        synchronized (lock) {
            latest.clear();
        }
    }
}
