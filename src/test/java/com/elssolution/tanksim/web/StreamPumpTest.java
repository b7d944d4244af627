package com.elssolution.tanksim.web;

import com.elssolution.tanksim.bridge.NoopEventBridge;
import com.elssolution.tanksim.bus.EventBus;
import com.elssolution.tanksim.bus.EventSubscription;
import com.elssolution.tanksim.domain.ReplayEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StreamPumpTest {

    private final EventBus bus = new EventBus(new NoopEventBridge());
    private final ExecutorService exec = Executors.newCachedThreadPool();
    private final StreamPump pump = new StreamPump(bus, exec, new ObjectMapper());

    StreamPumpTest() {
        ReflectionTestUtils.setField(pump, "pollMs", 20L);
    }

    @AfterEach
    void tearDown() {
        exec.shutdownNow();
    }

    private static ReplayEvent event(long seq) {
        return ReplayEvent.builder()
                .sourceId("A").timestamp("2025-05-16 06:58:00")
                .rawValue(1.0).normalized(0.5).level(5.0)
                .sequence(seq).totalCount(2)
                .build();
    }

    /** Collects frames; completes a latch when the pump signals it is done. */
    private static class RecordingSink implements StreamPump.EventSink {
        final List<String> frames = new CopyOnWriteArrayList<>();
        final CountDownLatch completed = new CountDownLatch(1);
        final CountDownLatch firstFrame = new CountDownLatch(1);

        @Override
        public void send(String json) throws IOException {
            frames.add(json);
            firstFrame.countDown();
        }

        @Override
        public void complete() {
            completed.countDown();
        }
    }

    @Test
    void delivers_published_events_as_json() throws Exception {
        RecordingSink sink = new RecordingSink();
        EventSubscription sub = pump.open("test", sink);

        bus.publish(event(1));

        assertThat(sink.firstFrame.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(sink.frames.get(0)).contains("\"sourceId\":\"A\"").contains("\"sequence\":1");

        sub.close();
        assertThat(sink.completed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void failed_send_closes_subscription() throws Exception {
        CountDownLatch completed = new CountDownLatch(1);
        EventSubscription sub = pump.open("broken", new StreamPump.EventSink() {
            @Override
            public void send(String json) throws IOException {
                throw new IOException("client went away");
            }

            @Override
            public void complete() {
                completed.countDown();
            }
        });

        bus.publish(event(1));

        assertThat(completed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(sub.isAlive()).isFalse();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void idle_client_that_went_away_is_noticed_by_heartbeat() throws Exception {
        CountDownLatch completed = new CountDownLatch(1);
        EventSubscription sub = pump.open("idle", new StreamPump.EventSink() {
            @Override
            public void send(String json) {
                throw new AssertionError("no events were published");
            }

            @Override
            public void heartbeat() throws IOException {
                throw new IOException("broken pipe");
            }

            @Override
            public void complete() {
                completed.countDown();
            }
        });

        assertThat(completed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(sub.isAlive()).isFalse();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void rejected_when_executor_is_down() {
        exec.shutdown();
        RecordingSink sink = new RecordingSink();

        EventSubscription sub = pump.open("late", sink);

        assertThat(sub.isAlive()).isFalse();
        assertThat(sink.completed.getCount()).isZero();
        assertThat(bus.subscriberCount()).isZero();
    }
}
