package com.elssolution.tanksim.bridge;

import com.elssolution.tanksim.domain.ReplayEvent;
import com.elssolution.tanksim.domain.SourceSnapshot;

import java.util.function.Consumer;

/**
 * Best-effort mirror of the local event stream onto an external pub/sub channel.
 * Implementations log and absorb their own failures; none of these calls may throw.
 */
public interface ExternalBridge {

    /** Fire {@code event} toward the external channel. */
    void publish(ReplayEvent event);

    /** Start forwarding events received on {@code channel} (from other processes) to {@code inbound}. */
    void subscribe(String channel, Consumer<ReplayEvent> inbound);

    default void mirrorSnapshot(String sourceId, SourceSnapshot snapshot) {}

    default void clearMirror() {}

    /** Outbound messages discarded because the external side could not keep up. */
    default long getDropped() {
        return 0L;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
