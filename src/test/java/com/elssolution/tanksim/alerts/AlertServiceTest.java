package com.elssolution.tanksim.alerts;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertServiceTest {

    @Test
    void raise_then_resolve_forms_one_episode() {
        AlertService alerts = new AlertService();

        alerts.raise("BRIDGE_DOWN", "redis unreachable", AlertService.Severity.WARN);
        alerts.raise("BRIDGE_DOWN", "redis unreachable", AlertService.Severity.WARN);

        AlertService.AlertsSnapshot snap = alerts.snapshot();
        assertThat(snap.getActive()).hasSize(1);
        assertThat(snap.getActive().get(0).getCount()).isEqualTo(2);
        assertThat(alerts.isActive("BRIDGE_DOWN")).isTrue();

        alerts.resolve("BRIDGE_DOWN");

        snap = alerts.snapshot();
        assertThat(snap.getActive()).isEmpty();
        assertThat(snap.getRecent().get(0).getType()).isEqualTo("RESOLVE");
    }

    @Test
    void new_episode_restarts_count() {
        AlertService alerts = new AlertService();
        alerts.raise("LOAD_FAILED", "x", AlertService.Severity.WARN);
        alerts.resolve("LOAD_FAILED");

        alerts.raise("LOAD_FAILED", "y", AlertService.Severity.ERROR);

        AlertService.AlertView v = alerts.snapshot().getActive().get(0);
        assertThat(v.getCount()).isEqualTo(1);
        assertThat(v.getMessage()).isEqualTo("y");
        assertThat(v.getSeverity()).isEqualTo(AlertService.Severity.ERROR);
    }

    @Test
    void resolve_of_unknown_key_is_noop() {
        AlertService alerts = new AlertService();
        alerts.resolve("NOPE");
        assertThat(alerts.snapshot().getRecent()).isEmpty();
    }

    @Test
    void recent_events_are_capped_newest_first() {
        AlertService alerts = new AlertService(3);
        for (int i = 0; i < 5; i++) alerts.raise("K" + i, "m" + i, AlertService.Severity.INFO);

        assertThat(alerts.snapshot().getRecent())
                .extracting(AlertService.EventView::getKey)
                .containsExactly("K4", "K3", "K2");
    }
}
