package com.elssolution.tanksim.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private final AlertService alerts;

    private volatile boolean stopping = false; // mute noise while shutting down

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;

        String key = classify(t);
        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        alerts.raise(key, t.getName() + ": " + e, AlertService.Severity.CRITICAL);
    }

    static String classify(Thread t) {
        String name = (t.getName() == null ? "" : t.getName());
        if (name.startsWith("replay-")) return "REPLAY_UNCAUGHT";
        if (name.startsWith("stream-")) return "STREAM_UNCAUGHT";
        return "UNCAUGHT";
    }
}
