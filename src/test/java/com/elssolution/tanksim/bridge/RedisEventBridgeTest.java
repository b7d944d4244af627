package com.elssolution.tanksim.bridge;

import com.elssolution.tanksim.alerts.AlertService;
import com.elssolution.tanksim.domain.ReplayEvent;
import com.elssolution.tanksim.domain.SourceSnapshot;
import com.elssolution.tanksim.domain.SourceStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RedisEventBridgeTest {

    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    private final RedisMessageListenerContainer container = mock(RedisMessageListenerContainer.class);
    private final ObjectMapper mapper = new ObjectMapper();
    private final AlertService alerts = new AlertService();
    private final RedisEventBridge bridge =
            new RedisEventBridge(redis, container, mapper, alerts, "tank_events", "tank_latest_state", 100);

    private static ReplayEvent event(String source, long seq) {
        return ReplayEvent.builder()
                .sourceId(source).timestamp("2025-05-16 06:58:00")
                .rawValue(12.0).normalized(0.25).level(2.5)
                .sequence(seq).totalCount(40)
                .build();
    }

    @AfterEach
    void tearDown() {
        bridge.shutdown();
    }

    @Test
    void publish_sends_tagged_json_to_channel() throws Exception {
        bridge.publish(event("A", 3));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(redis, timeout(2000)).convertAndSend(eq("tank_events"), payload.capture());
        RedisEventBridge.BridgeMessage msg =
                mapper.readValue((String) payload.getValue(), RedisEventBridge.BridgeMessage.class);
        assertThat(msg.origin()).isEqualTo(bridge.getOrigin());
        assertThat(msg.event()).isEqualTo(event("A", 3));
    }

    @Test
    void publish_failure_is_absorbed_and_alerted() throws Exception {
        when(redis.convertAndSend(anyString(), any())).thenThrow(new RedisConnectionFailureException("down"));

        assertThatCode(() -> bridge.publish(event("A", 1))).doesNotThrowAnyException();

        verify(redis, timeout(2000)).convertAndSend(anyString(), any());
        awaitAlert(true);
    }

    @Test
    void successful_publish_resolves_alert() throws Exception {
        alerts.raise("BRIDGE_DOWN", "earlier failure", AlertService.Severity.WARN);

        bridge.publish(event("A", 1));

        awaitAlert(false);
    }

    @Test
    void inbound_from_other_process_is_forwarded() throws Exception {
        List<ReplayEvent> got = new ArrayList<>();
        String json = mapper.writeValueAsString(new RedisEventBridge.BridgeMessage("other-node", event("B", 9)));

        bridge.onMessage(json, got::add);

        assertThat(got).containsExactly(event("B", 9));
    }

    @Test
    void inbound_echo_of_own_event_is_dropped() throws Exception {
        List<ReplayEvent> got = new ArrayList<>();
        String json = mapper.writeValueAsString(new RedisEventBridge.BridgeMessage(bridge.getOrigin(), event("A", 1)));

        bridge.onMessage(json, got::add);

        assertThat(got).isEmpty();
    }

    @Test
    void undecodable_inbound_is_ignored() {
        List<ReplayEvent> got = new ArrayList<>();

        assertThatCode(() -> bridge.onMessage("{not json", got::add)).doesNotThrowAnyException();
        assertThat(got).isEmpty();
    }

    @Test
    void subscribe_registers_listener_on_channel() {
        bridge.subscribe("tank_events", e -> {});

        ArgumentCaptor<Topic> topic = ArgumentCaptor.forClass(Topic.class);
        verify(container).addMessageListener(any(MessageListener.class), topic.capture());
        assertThat(topic.getValue().getTopic()).isEqualTo("tank_events");
    }

    @Test
    void subscribe_failure_is_absorbed() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(container).addMessageListener(any(MessageListener.class), any(Topic.class));

        assertThatCode(() -> bridge.subscribe("tank_events", e -> {})).doesNotThrowAnyException();
        assertThat(alerts.isActive("BRIDGE_DOWN")).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void snapshots_are_mirrored_into_latest_hash() {
        HashOperations<String, Object, Object> hash = mock(HashOperations.class);
        when(redis.<Object, Object>opsForHash()).thenReturn(hash);

        bridge.mirrorSnapshot("A", new SourceSnapshot(2.5, "2025-05-16 06:58:00", 3, 40, SourceStatus.RUNNING));
        bridge.clearMirror();

        verify(hash, timeout(2000)).put(eq("tank_latest_state"), eq("A"), contains("\"sequence\":3"));
        verify(redis, timeout(2000)).delete("tank_latest_state");
    }

    private void awaitAlert(boolean active) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (alerts.isActive("BRIDGE_DOWN") != active && System.currentTimeMillis() < deadline) Thread.sleep(5);
        assertThat(alerts.isActive("BRIDGE_DOWN")).isEqualTo(active);
    }
}
