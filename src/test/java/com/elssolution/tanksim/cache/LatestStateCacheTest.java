package com.elssolution.tanksim.cache;

import com.elssolution.tanksim.domain.SourceSnapshot;
import com.elssolution.tanksim.domain.SourceStatus;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LatestStateCacheTest {

    private static final long RUN = 1L;

    private final LatestStateCache cache = new LatestStateCache();

    private static SourceSnapshot running(long seq, double level) {
        return new SourceSnapshot(level, "2025-05-16 06:58:00", seq, 10, SourceStatus.RUNNING);
    }

    @Test
    void get_returns_latest_snapshot() {
        cache.set("A", running(1, 1.0), RUN);
        cache.set("A", running(2, 2.5), RUN);

        assertThat(cache.get("A")).hasValueSatisfying(s -> {
            assertThat(s.sequence()).isEqualTo(2);
            assertThat(s.level()).isEqualTo(2.5);
        });
        assertThat(cache.get("B")).isEmpty();
    }

    @Test
    void getAll_is_a_detached_copy() {
        cache.set("A", running(1, 1.0), RUN);
        Map<String, SourceSnapshot> view = cache.getAll();

        cache.set("B", running(1, 3.0), RUN);
        view.clear();

        assertThat(cache.getAll()).containsOnlyKeys("A", "B");
    }

    @Test
    void terminal_status_is_sticky_until_clear() {
        cache.set("A", running(4, 1.0), RUN);
        assertThat(cache.markTerminal("A", SourceStatus.STOPPED, RUN)).isPresent();

        assertThat(cache.set("A", running(5, 2.0), RUN)).isFalse();
        assertThat(cache.markTerminal("A", SourceStatus.ERROR, RUN)).isEmpty();
        assertThat(cache.get("A").orElseThrow().status()).isEqualTo(SourceStatus.STOPPED);
        assertThat(cache.get("A").orElseThrow().sequence()).isEqualTo(4);

        cache.clear();
        assertThat(cache.set("A", running(1, 2.0), RUN)).isTrue();
    }

    @Test
    void markTerminal_without_snapshot_is_a_noop() {
        assertThat(cache.markTerminal("ghost", SourceStatus.STOPPED, RUN)).isEmpty();
        assertThat(cache.getAll()).isEmpty();
    }

    @Test
    void markTerminal_rejects_non_terminal_status() {
        assertThatThrownBy(() -> cache.markTerminal("A", SourceStatus.RUNNING, RUN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void older_run_cannot_overwrite_or_terminate_newer_run() {
        cache.set("A", running(7, 1.0), RUN);
        cache.clear();
        cache.set("A", running(1, 4.0), RUN + 1);

        assertThat(cache.set("A", running(8, 1.5), RUN)).isFalse();
        assertThat(cache.markTerminal("A", SourceStatus.STOPPED, RUN)).isEmpty();

        SourceSnapshot s = cache.get("A").orElseThrow();
        assertThat(s.status()).isEqualTo(SourceStatus.RUNNING);
        assertThat(s.sequence()).isEqualTo(1);
        assertThat(cache.set("A", running(2, 4.5), RUN + 1)).isTrue();
    }

    @Test
    void newer_run_replaces_terminal_snapshot_of_older_run() {
        cache.set("A", running(3, 1.0), RUN);
        cache.markTerminal("A", SourceStatus.STOPPED, RUN);

        assertThat(cache.set("A", running(1, 2.0), RUN + 1)).isTrue();
        assertThat(cache.get("A").orElseThrow().status()).isEqualTo(SourceStatus.RUNNING);
    }
}
