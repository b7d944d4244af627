package com.elssolution.tanksim.bridge;

import com.elssolution.tanksim.domain.ReplayEvent;

import java.util.function.Consumer;

/** Default bridge: everything stays in-process. */
public class NoopEventBridge implements ExternalBridge {

    @Override
    public void publish(ReplayEvent event) {
        // in-process only
    }

    @Override
    public void subscribe(String channel, Consumer<ReplayEvent> inbound) {
        // nothing external to listen to
    }

    @Override
    public String name() {
        return "none";
    }
}
