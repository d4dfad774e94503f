package com.example.pictochat.service;

import com.example.pictochat.model.Player;
import com.example.pictochat.model.PlayerConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * One-way fan-out to the players currently registered in a room.
 *
 * <p>Delivery is best-effort: no acknowledgement, no retry, and no failure is reported to the
 * sender. A connection that is closed or fails mid-send simply misses the message; the client
 * catches up through rejoin, since the event log holds the state.
 */
public class Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;

    public Broadcaster(ConnectionRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    /** Sends to every player in the room. Returns the number of connections written to. */
    public int broadcast(String roomId, Map<String, Object> message) {
        return broadcast(roomId, message, null);
    }

    /** Sends to every player in the room except {@code excludePlayerId}. */
    public int broadcast(String roomId, Map<String, Object> message, String excludePlayerId) {
        String json = toJson(message);
        if (json == null) return 0;

        int delivered = 0;
        for (Player p : registry.listPlayers(roomId)) {
            if (Objects.equals(p.getPlayerId(), excludePlayerId)) continue;
            if (write(p.getConnection(), json)) delivered++;
        }
        return delivered;
    }

    /** Sends to a single connection, best-effort. */
    public boolean send(PlayerConnection connection, Map<String, Object> message) {
        String json = toJson(message);
        return json != null && write(connection, json);
    }

    private boolean write(PlayerConnection connection, String json) {
        if (connection == null || !connection.isOpen()) return false;
        try {
            connection.send(json);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropped message for connection {}: {}", connection.id(), e.toString());
            return false;
        }
    }

    private String toJson(Map<String, Object> message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize outbound message type={}", message.get("type"), e);
            return null;
        }
    }
}
