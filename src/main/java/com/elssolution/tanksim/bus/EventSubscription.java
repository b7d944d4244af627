package com.elssolution.tanksim.bus;

import com.elssolution.tanksim.domain.ReplayEvent;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Delivery channel of one push subscriber (one stream client).
 * The queue is unbounded so {@link #offer} never blocks the publisher.
 */
public final class EventSubscription implements AutoCloseable {

    private final String id;
    private final BlockingQueue<ReplayEvent> channel = new LinkedBlockingQueue<>();
    private final Runnable onClose;
    private volatile boolean alive = true;

    EventSubscription(String id, Runnable onClose) {
        this.id = id;
        this.onClose = onClose;
    }

    public String getId() {
        return id;
    }

    public boolean isAlive() {
        return alive;
    }

    /** Pending events not yet taken by the client. */
    public int backlog() {
        return channel.size();
    }

    /**
     * Waits up to {@code timeout} for the next event.
     * @return the event, or null on timeout or once closed
     */
    public ReplayEvent next(Duration timeout) throws InterruptedException {
        if (!alive) return null;
        return channel.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    boolean offer(ReplayEvent event) {
        return alive && channel.offer(event);
    }

    /** Marks the subscription dead and removes it from its bus. Idempotent. */
    @Override
    public void close() {
        if (!alive) return;
        alive = false;
        channel.clear();
        onClose.run();
    }
}
