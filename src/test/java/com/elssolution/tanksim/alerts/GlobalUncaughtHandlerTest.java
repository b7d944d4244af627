package com.elssolution.tanksim.alerts;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalUncaughtHandlerTest {

    @Test
    void classifies_by_thread_name() {
        assertThat(GlobalUncaughtHandler.classify(new Thread(() -> {}, "replay-3"))).isEqualTo("REPLAY_UNCAUGHT");
        assertThat(GlobalUncaughtHandler.classify(new Thread(() -> {}, "stream-1"))).isEqualTo("STREAM_UNCAUGHT");
        assertThat(GlobalUncaughtHandler.classify(new Thread(() -> {}, "main"))).isEqualTo("UNCAUGHT");
    }

    @Test
    void uncaught_raises_critical_alert() {
        AlertService alerts = new AlertService();
        GlobalUncaughtHandler handler = new GlobalUncaughtHandler(alerts);

        handler.uncaughtException(new Thread(() -> {}, "replay-1"), new IllegalStateException("boom"));

        assertThat(alerts.isActive("REPLAY_UNCAUGHT")).isTrue();
        assertThat(alerts.snapshot().getActive().get(0).getSeverity()).isEqualTo(AlertService.Severity.CRITICAL);
    }
}
