package com.elssolution.tanksim.bridge;

import com.elssolution.tanksim.alerts.AlertService;
import com.elssolution.tanksim.domain.ReplayEvent;
import com.elssolution.tanksim.domain.SourceSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Redis pub/sub mirror.
 *
 * Outbound work (publish, latest-state hash) runs on one background thread with a bounded
 * queue, so a slow or unreachable Redis costs the replay workers nothing; when the queue is
 * full the oldest pending write is dropped. Every outbound message carries this process's
 * origin id and inbound messages with the same id are ignored, so local subscribers do not
 * see their own events twice.
 */
@Slf4j
public class RedisEventBridge implements ExternalBridge {

    static final String ALERT_KEY = "BRIDGE_DOWN";

    /** Wire format on the channel. */
    public record BridgeMessage(String origin, ReplayEvent event) {}

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer container;
    private final ObjectMapper mapper;
    private final AlertService alerts;
    private final String channel;
    private final String latestKey;
    private final String origin = UUID.randomUUID().toString();

    private final ThreadPoolExecutor outbound;
    private final AtomicLong dropped = new AtomicLong();

    public RedisEventBridge(StringRedisTemplate redis,
                            RedisMessageListenerContainer container,
                            ObjectMapper mapper,
                            AlertService alerts,
                            String channel,
                            String latestKey,
                            int outboundCapacity) {
        this.redis = redis;
        this.container = container;
        this.mapper = mapper;
        this.alerts = alerts;
        this.channel = channel;
        this.latestKey = latestKey;
        this.outbound = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(1, outboundCapacity)),
                r -> {
                    Thread t = new Thread(r, "bridge-out");
                    t.setDaemon(true);
                    return t;
                },
                (r, ex) -> {
                    // drop-oldest
                    dropped.incrementAndGet();
                    if (!ex.isShutdown()) {
                        ex.getQueue().poll();
                        ex.getQueue().offer(r);
                    }
                });
        log.info("redis_bridge_ready channel={} latestKey={} origin={}", channel, latestKey, origin);
    }

    // ---- Outbound ----

    @Override
    public void publish(ReplayEvent event) {
        submit("publish", () -> redis.convertAndSend(channel, mapper.writeValueAsString(new BridgeMessage(origin, event))));
    }

    @Override
    public void mirrorSnapshot(String sourceId, SourceSnapshot snapshot) {
        submit("mirror", () -> redis.opsForHash().put(latestKey, sourceId, mapper.writeValueAsString(snapshot)));
    }

    @Override
    public void clearMirror() {
        submit("clear", () -> redis.delete(latestKey));
    }

    private void submit(String op, RedisCall call) {
        try {
            outbound.execute(() -> runSafe(op, call));
        } catch (RejectedExecutionException e) {
            log.debug("bridge_{}_rejected (shutting down)", op);
        }
    }

    private void runSafe(String op, RedisCall call) {
        try {
            call.run();
            alerts.resolve(ALERT_KEY);
        } catch (Exception e) {
            warn(op, e);
        }
    }

    // ---- Inbound ----

    @Override
    public void subscribe(String channel, Consumer<ReplayEvent> inbound) {
        try {
            container.addMessageListener(
                    (Message message, byte[] pattern) -> onMessage(new String(message.getBody(), StandardCharsets.UTF_8), inbound),
                    new ChannelTopic(channel));
            log.info("redis_bridge_subscribed channel={}", channel);
        } catch (RuntimeException e) {
            warn("subscribe", e);
        }
    }

    /** Decodes one channel payload and forwards it unless it came from this process. */
    void onMessage(String payload, Consumer<ReplayEvent> inbound) {
        BridgeMessage msg;
        try {
            msg = mapper.readValue(payload, BridgeMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("bridge_inbound_undecodable err={}", e.getOriginalMessage());
            return;
        }
        if (msg.event() == null || origin.equals(msg.origin())) return;
        inbound.accept(msg.event());
    }

    // ---- Misc ----

    public String getOrigin() {
        return origin;
    }

    @Override
    public long getDropped() {
        return dropped.get();
    }

    @Override
    public String name() {
        return "redis";
    }

    public void shutdown() {
        outbound.shutdown();
        try {
            if (!outbound.awaitTermination(2, TimeUnit.SECONDS)) outbound.shutdownNow();
        } catch (InterruptedException ie) {
            outbound.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void warn(String op, Exception e) {
        if (alerts.isActive(ALERT_KEY)) {
            log.debug("bridge_{}_failed err={}", op, e.toString());
        } else {
            log.warn("bridge_{}_failed channel={} err={}", op, channel, e.toString());
        }
        alerts.raise(ALERT_KEY, "Redis " + op + " failed: " + e.getMessage(), AlertService.Severity.WARN);
    }

    @FunctionalInterface
    private interface RedisCall {
        void run() throws Exception;
    }
}
