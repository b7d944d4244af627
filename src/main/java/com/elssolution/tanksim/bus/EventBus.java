package com.elssolution.tanksim.bus;

import com.elssolution.tanksim.bridge.ExternalBridge;
import com.elssolution.tanksim.domain.ReplayEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Central routing: a drainable log for pull callers plus a registry of push subscribers.
 *
 * The log and the registry are guarded independently. Fan-out copies the registry under
 * its lock and delivers outside of it, so a slow client never stalls a publisher or
 * another client's (un)registration.
 *
 * The log has no retention limit; it grows until someone polls it.
 */
@Slf4j
public class EventBus {

    private final BlockingQueue<ReplayEvent> eventLog = new LinkedBlockingQueue<>();

    private final Object subscribersLock = new Object();
    private final Map<String, EventSubscription> subscribers = new LinkedHashMap<>();

    private final ExternalBridge bridge;

    public EventBus(ExternalBridge bridge) {
        this.bridge = bridge;
    }

    // ---- Producers ----

    /** Appends to the log, fans out to current subscribers, mirrors to the bridge. Never blocks. */
    public void publish(ReplayEvent event) {
        eventLog.offer(event);
        fanOut(event);
        try {
            bridge.publish(event);
        } catch (RuntimeException e) {
            log.warn("bridge_publish_failed bridge={} err={}", bridge.name(), e.toString());
        }
    }

    /** Entry point for events received from the external channel: push subscribers only, no log. */
    public void deliverExternal(ReplayEvent event) {
        fanOut(event);
    }

    private void fanOut(ReplayEvent event) {
        List<EventSubscription> targets;
        synchronized (subscribersLock) {
            if (subscribers.isEmpty()) return;
            targets = new ArrayList<>(subscribers.values());
        }
        for (EventSubscription s : targets) {
            if (!s.offer(event) && log.isDebugEnabled()) {
                log.debug("fanout_skipped subscriber={} (closed)", s.getId());
            }
        }
    }

    // ---- Pull consumers ----

    /** Removes and returns up to {@code maxEvents} oldest events. */
    public List<ReplayEvent> poll(int maxEvents) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive, got " + maxEvents);
        }
        List<ReplayEvent> out = new ArrayList<>(Math.min(maxEvents, 1024));
        eventLog.drainTo(out, maxEvents);
        return out;
    }

    public int queueSize() {
        return eventLog.size();
    }

    // ---- Push consumers ----

    /** Registers a new subscriber. It sees only events published from now on. */
    public EventSubscription subscribe() {
        String id = UUID.randomUUID().toString();
        EventSubscription sub = new EventSubscription(id, () -> remove(id));
        synchronized (subscribersLock) {
            subscribers.put(id, sub);
        }
        log.info("subscriber_added id={} total={}", id, subscriberCount());
        return sub;
    }

    public void unsubscribe(String id) {
        EventSubscription sub;
        synchronized (subscribersLock) {
            sub = subscribers.get(id);
        }
        if (sub != null) sub.close();
    }

    private void remove(String id) {
        boolean removed;
        synchronized (subscribersLock) {
            removed = subscribers.remove(id) != null;
        }
        if (removed) log.info("subscriber_removed id={} total={}", id, subscriberCount());
    }

    public int subscriberCount() {
        synchronized (subscribersLock) {
            return subscribers.size();
        }
    }

    /** Closes every subscription; used on shutdown. */
    public void closeAll() {
        List<EventSubscription> all;
        synchronized (subscribersLock) {
            all = new ArrayList<>(subscribers.values());
        }
        all.forEach(EventSubscription::close);
    }
}
