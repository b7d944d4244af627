package com.elssolution.tanksim.web;

import com.elssolution.tanksim.bus.EventSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Push stream over WebSocket: one JSON text frame per event, from connect until close.
 * Inbound frames are ignored.
 */
@Slf4j
@Component
public class ReplayWebSocketHandler extends TextWebSocketHandler {

    private final StreamPump pump;
    private final Map<String, EventSubscription> subscriptions = new ConcurrentHashMap<>();

    public ReplayWebSocketHandler(StreamPump pump) {
        this.pump = pump;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        EventSubscription sub = pump.open("ws:" + session.getId(), new StreamPump.EventSink() {
            @Override
            public void send(String json) throws IOException {
                if (!session.isOpen()) throw new IOException("session closed");
                session.sendMessage(new TextMessage(json));
            }

            @Override
            public void complete() {
                if (!session.isOpen()) return;
                try {
                    session.close(CloseStatus.GOING_AWAY);
                } catch (IOException e) {
                    log.debug("ws_close_failed session={} err={}", session.getId(), e.toString());
                }
            }
        });
        subscriptions.put(session.getId(), sub);
        log.info("WebSocket connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        EventSubscription sub = subscriptions.remove(session.getId());
        if (sub != null) sub.close();
        log.info("WebSocket disconnected: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error session={} err={}", session.getId(), exception.toString());
        EventSubscription sub = subscriptions.remove(session.getId());
        if (sub != null) sub.close();
    }
}
