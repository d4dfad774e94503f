package com.example.pictochat.service;

import com.example.pictochat.error.StorageException;
import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.DrawingEvent;
import com.example.pictochat.model.Player;
import com.example.pictochat.model.PlayerConnection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Append-then-fan-out for live room events. Each operation runs under the room's lock, so
 * the order other players receive events in is the order they were appended in.
 *
 * <p>A storage failure is logged and the broadcast still goes out: the room stays usable,
 * at the cost of that one event not surviving a restart.
 */
public class RoomEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RoomEventPublisher.class);

    static final String DEFAULT_TOOL = "pen";

    private final ConnectionRegistry registry;
    private final EventLog eventLog;
    private final Broadcaster broadcaster;
    private final Clock clock;

    public RoomEventPublisher(ConnectionRegistry registry, EventLog eventLog, Broadcaster broadcaster, Clock clock) {
        this.registry = registry;
        this.eventLog = eventLog;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    /** Builds the stored form of a stroke. */
    public static ObjectNode drawPayload(JsonNode points, String color, JsonNode size, String tool) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.set("points", points);
        n.put("color", color);
        n.set("size", size);
        n.put("tool", (tool == null || tool.isBlank()) ? DEFAULT_TOOL : tool);
        return n;
    }

    /** Appends a stroke and sends it to everyone but the author. Empty if the room is gone. */
    public Optional<DrawingEvent> draw(String roomId, String playerId, ObjectNode payload, long timestamp) {
        return registry.inRoom(roomId, live -> {
            Long id = null;
            try {
                id = eventLog.appendDrawingEvent(roomId, playerId, DrawingEvent.DRAW, payload, timestamp);
            } catch (StorageException e) {
                log.warn("Drawing event not persisted (room={}, player={}): {}", roomId, playerId, e.toString());
            }
            DrawingEvent event = new DrawingEvent(id, roomId, playerId, DrawingEvent.DRAW, payload, timestamp);
            live.touch(clock.millis());
            broadcaster.broadcast(roomId, OutboundMessages.drawingEvent(event), playerId);
            return event;
        });
    }

    /**
     * Appends a chat line and sends it to everyone, author included.
     *
     * @throws com.example.pictochat.error.ValidationException empty or oversized text; nothing is sent
     */
    public Optional<ChatMessage> chat(String roomId, String playerId, String playerName, String text, long timestamp) {
        String clean = eventLog.normalizeChatText(text);
        return registry.inRoom(roomId, live -> {
            Long id = null;
            try {
                id = eventLog.appendChat(roomId, playerId, playerName, clean, timestamp);
            } catch (StorageException e) {
                log.warn("Chat message not persisted (room={}, player={}): {}", roomId, playerId, e.toString());
            }
            ChatMessage msg = new ChatMessage(id, roomId, playerId, playerName, clean, timestamp);
            live.touch(clock.millis());
            broadcaster.broadcast(roomId, OutboundMessages.message(msg));
            return msg;
        });
    }

    /** Drops the room's drawing events and snapshot, then tells everyone, author included. */
    public boolean clear(String roomId, String playerId, String playerName) {
        return registry.inRoom(roomId, live -> {
            try {
                eventLog.clearDrawingState(roomId);
            } catch (StorageException e) {
                log.warn("Clear not persisted (room={}, player={}): {}", roomId, playerId, e.toString());
            }
            long now = clock.millis();
            live.touch(now);
            broadcaster.broadcast(roomId, OutboundMessages.clear(playerId, playerName, now));
            return true;
        }).orElse(false);
    }

    public boolean drawIndicator(String roomId, String playerId, String playerName, boolean drawing) {
        return registry.inRoom(roomId, live -> {
            if (!registry.setDrawingFlag(roomId, playerId, drawing)) return false;
            broadcaster.broadcast(roomId, OutboundMessages.drawIndicator(playerId, playerName, drawing), playerId);
            return true;
        }).orElse(false);
    }

    /** Stores the client's canvas as the room snapshot, replacing the previous one. */
    public boolean snapshot(String roomId, String data) {
        return registry.inRoom(roomId, live -> {
            try {
                eventLog.saveSnapshot(roomId, data, clock.millis());
                return true;
            } catch (StorageException e) {
                log.warn("Snapshot not persisted (room={}): {}", roomId, e.toString());
                return false;
            }
        }).orElse(false);
    }

    /**
     * Removes the player if it is still registered through {@code connection} and tells the rest
     * of the room. Returns false if nothing was removed.
     */
    public boolean leave(String roomId, String playerId, String playerName, PlayerConnection connection) {
        return registry.inRoom(roomId, live -> {
            if (!registry.removePlayer(roomId, playerId, connection)) return false;
            broadcaster.broadcast(roomId, OutboundMessages.userLeft(playerId, playerName, clock.millis()), playerId);
            return true;
        }).orElse(false);
    }

    /**
     * Removes a player whose id has since been claimed by another room, regardless of which
     * connection registered it here. No-op if the id is claimed by {@code roomId} again.
     */
    public boolean evict(String roomId, String playerId) {
        return registry.inRoom(roomId, live -> {
            Player player = live.getPlayer(playerId);
            if (player == null || !registry.removeIfClaimedElsewhere(roomId, playerId)) return false;
            broadcaster.broadcast(roomId,
                    OutboundMessages.userLeft(playerId, player.getPlayerName(), clock.millis()), playerId);
            return true;
        }).orElse(false);
    }
}
