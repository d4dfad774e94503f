package com.example.pictochat.handler;

import com.example.pictochat.model.ClientMessage;
import com.example.pictochat.model.PlayerConnection;
import com.example.pictochat.service.ConnectionContext;
import com.example.pictochat.service.RoomSynchronizationEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RoomWebSocketHandlerTest {

    private RoomSynchronizationEngine engine;
    private RoomWebSocketHandler handler;
    private WebSocketSession session;
    private ConnectionContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        engine = mock(RoomSynchronizationEngine.class);
        handler = new RoomWebSocketHandler(engine, new ObjectMapper(), 5000, 512 * 1024);

        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);

        ctx = new ConnectionContext(mock(PlayerConnection.class));
        when(engine.open(any(PlayerConnection.class))).thenReturn(ctx);

        handler.afterConnectionEstablished(session);
    }

    @Test
    @DisplayName("open registers a connection backed by the session")
    void open() throws Exception {
        ArgumentCaptor<PlayerConnection> conn = ArgumentCaptor.forClass(PlayerConnection.class);
        verify(engine).open(conn.capture());
        assertEquals("s1", conn.getValue().id());
        assertTrue(conn.getValue().isOpen());
        assertEquals(1, handler.openSessions());

        conn.getValue().send("{\"type\":\"ping\"}");
        verify(session).sendMessage(new TextMessage("{\"type\":\"ping\"}"));
    }

    @Test
    @DisplayName("frames are parsed into client messages, unknown fields ignored")
    void parses() throws Exception {
        handler.handleTextMessage(session, new TextMessage(
                "{\"type\":\"draw\",\"points\":[[1,2],[3,4]],\"color\":\"#fff\",\"size\":5,\"pressure\":0.3}"));

        ArgumentCaptor<ClientMessage> msg = ArgumentCaptor.forClass(ClientMessage.class);
        verify(engine).handle(same(ctx), msg.capture());
        assertEquals("draw", msg.getValue().type);
        assertEquals(2, msg.getValue().points.size());
        assertEquals("#fff", msg.getValue().color);
        assertEquals(5, msg.getValue().size.asInt());
    }

    @Test
    @DisplayName("rejoin watermark and replay events are read")
    void rejoinAndReplayFields() throws Exception {
        handler.handleTextMessage(session, new TextMessage(
                "{\"type\":\"rejoin\",\"roomId\":\"chat-a\",\"playerId\":\"p1\",\"playerName\":\"Al\",\"lastEventTimestamp\":1234}"));
        handler.handleTextMessage(session, new TextMessage(
                "{\"type\":\"queueReplay\",\"events\":[{\"type\":\"message\",\"text\":\"hi\"},{\"type\":\"draw\"}]}"));

        ArgumentCaptor<ClientMessage> msg = ArgumentCaptor.forClass(ClientMessage.class);
        verify(engine, times(2)).handle(same(ctx), msg.capture());
        assertEquals(1234L, msg.getAllValues().get(0).lastEventTimestamp);
        assertEquals(2, msg.getAllValues().get(1).events.size());
        assertEquals("hi", msg.getAllValues().get(1).events.get(0).get("text").asText());
    }

    @Test
    @DisplayName("unparseable frames are answered, not propagated")
    void invalidJson() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{not json"));
        handler.handleTextMessage(session, new TextMessage("[1,2,3]"));

        verify(engine, times(2)).invalidFrame(ctx);
        verify(engine, never()).handle(any(), any());
    }

    @Test
    @DisplayName("close hands the context back to the engine once")
    void close() throws Exception {
        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);
        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        verify(engine, times(1)).close(ctx);
        assertEquals(0, handler.openSessions());

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"message\",\"text\":\"late\"}"));
        verify(engine, never()).handle(any(), any());
    }
}
