package com.elssolution.tanksim.health;

import com.elssolution.tanksim.bridge.ExternalBridge;
import com.elssolution.tanksim.domain.SourceSnapshot;
import com.elssolution.tanksim.domain.SourceStatus;
import com.elssolution.tanksim.service.ReplayStatusService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReplayHealthTest {

    private final ReplayStatusService status = mock(ReplayStatusService.class);
    private final ExternalBridge bridge = mock(ExternalBridge.class);
    private final ReplayHealth health = new ReplayHealth(status, bridge);

    ReplayHealthTest() {
        when(bridge.name()).thenReturn("none");
    }

    private static SourceSnapshot snap(SourceStatus s) {
        return new SourceSnapshot(2.5, "2025-05-16 06:58:00", 3, 10, s);
    }

    private void given(boolean running, Map<String, SourceSnapshot> latest) {
        when(status.buildStatusView()).thenReturn(ReplayStatusService.StatusView.builder()
                .running(running)
                .sources(List.copyOf(latest.keySet()))
                .latest(latest)
                .queueSize(4)
                .build());
    }

    @Test
    void up_while_sources_replay() {
        given(true, Map.of("A", snap(SourceStatus.RUNNING)));
        when(bridge.name()).thenReturn("redis");
        when(bridge.getDropped()).thenReturn(17L);

        Health h = health.health();

        assertThat(h.getStatus()).isEqualTo(Status.UP);
        assertThat(h.getDetails())
                .containsEntry("queueSize", 4)
                .containsEntry("bridge", "redis")
                .containsEntry("bridgeDropped", 17L);
    }

    @Test
    void down_when_running_source_failed() {
        given(true, Map.of("A", snap(SourceStatus.RUNNING), "B", snap(SourceStatus.ERROR)));

        Health h = health.health();

        assertThat(h.getStatus()).isEqualTo(Status.DOWN);
        assertThat(h.getDetails()).containsEntry("failedSources", 1L);
    }

    @Test
    void stopped_replay_is_up_even_with_failed_snapshot() {
        given(false, Map.of("B", snap(SourceStatus.ERROR)));

        assertThat(health.health().getStatus()).isEqualTo(Status.UP);
    }
}
