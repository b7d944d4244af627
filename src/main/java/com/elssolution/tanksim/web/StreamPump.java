package com.elssolution.tanksim.web;

import com.elssolution.tanksim.bus.EventBus;
import com.elssolution.tanksim.bus.EventSubscription;
import com.elssolution.tanksim.domain.ReplayEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Moves events from a subscription's channel to one stream client (SSE or WebSocket).
 * One pump thread per client; a failed send means the client is gone and the
 * subscription is closed.
 */
@Slf4j
@Component
public class StreamPump {

    /** Transport-specific writer of one serialized event. */
    public interface EventSink {
        void send(String json) throws IOException;

        /** Sent when no event arrived within one poll interval, so a vanished client is noticed while idle. */
        default void heartbeat() throws IOException {}

        /** Called once after the pump stops, whatever the reason. */
        default void complete() {}
    }

    private final EventBus bus;
    private final ExecutorService streamExecutor;
    private final ObjectMapper mapper;

    @Value("${replay.stream.pollMs:1000}") private long pollMs = 1000;

    public StreamPump(EventBus bus,
                      @Qualifier("streamExecutor") ExecutorService streamExecutor,
                      ObjectMapper mapper) {
        this.bus = bus;
        this.streamExecutor = streamExecutor;
        this.mapper = mapper;
    }

    /** Registers a subscriber and starts pumping. Events published before this call are not sent. */
    public EventSubscription open(String client, EventSink sink) {
        EventSubscription sub = bus.subscribe();
        try {
            streamExecutor.execute(() -> pump(client, sub, sink));
        } catch (RejectedExecutionException e) {
            log.warn("stream_rejected client={} (shutting down)", client);
            sub.close();
            sink.complete();
        }
        return sub;
    }

    private void pump(String client, EventSubscription sub, EventSink sink) {
        Duration wait = Duration.ofMillis(Math.max(10, pollMs));
        log.info("stream_opened client={} subscriber={}", client, sub.getId());
        try {
            while (sub.isAlive()) {
                ReplayEvent ev = sub.next(wait);
                if (ev == null) {
                    if (sub.isAlive()) sink.heartbeat();
                    continue;
                }
                sink.send(mapper.writeValueAsString(ev));
            }
        } catch (JsonProcessingException e) {
            log.warn("stream_encode_failed client={} err={}", client, e.getOriginalMessage());
        } catch (IOException | IllegalStateException e) {
            log.debug("stream_client_gone client={} err={}", client, e.toString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } finally {
            sub.close();
            sink.complete();
            log.info("stream_closed client={} subscriber={}", client, sub.getId());
        }
    }
}
