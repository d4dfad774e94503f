package com.example.pictochat.handler;

import com.example.pictochat.model.ClientMessage;
import com.example.pictochat.service.ConnectionContext;
import com.example.pictochat.service.RoomSynchronizationEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket transport for the room engine.
 * - Every frame is one JSON {@link ClientMessage}; unparseable frames get an error reply
 * - Sessions are wrapped so broadcasts from other threads can write concurrently
 * - Close (clean or not) detaches the player and notifies the room
 */
@Component
public class RoomWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RoomWebSocketHandler.class);

    private final RoomSynchronizationEngine engine;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    /** WebSocket session id → connection state in the engine */
    private final Map<String, ConnectionContext> bySession = new ConcurrentHashMap<>();

    public RoomWebSocketHandler(
            RoomSynchronizationEngine engine,
            ObjectMapper objectMapper,
            @Value("${app.websocket.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.websocket.send-buffer-size-limit:524288}") int sendBufferSizeLimit
    ) {
        this.engine = engine;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
        ConnectionContext ctx = engine.open(new WebSocketPlayerConnection(safe));
        bySession.put(session.getId(), ctx);
        log.info("WS OPEN sid={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        ConnectionContext ctx = bySession.get(session.getId());
        if (ctx == null) {
            log.debug("WS frame for unknown session {}", session.getId());
            return;
        }

        ClientMessage msg;
        try {
            msg = objectMapper.readValue(message.getPayload(), ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("WS invalid frame sid={}: {}", session.getId(), e.getOriginalMessage());
            engine.invalidFrame(ctx);
            return;
        }
        engine.handle(ctx, msg);
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("WS transport error sid={}: {}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        ConnectionContext ctx = bySession.remove(session.getId());
        if (ctx != null) {
            engine.close(ctx);
        }
        log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
    }

    int openSessions() {
        return bySession.size();
    }
}
