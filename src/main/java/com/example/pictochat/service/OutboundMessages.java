package com.example.pictochat.service;

import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.DrawingEvent;
import com.example.pictochat.model.Player;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Builders for the server → client payloads. Drawing events go out flattened:
 * {@code {playerId, type, ...payload, timestamp}}.
 */
public final class OutboundMessages {

    private OutboundMessages() {}

    public static Map<String, Object> roomState(RoomStateView view, String playerId, String playerName) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", view.rejoin() ? "rejoinState" : "roomState");
        m.put("roomId", view.roomId());
        m.put("roomName", view.roomName());
        m.put("activePlayers", view.activePlayers().stream().map(OutboundMessages::player).toList());
        m.put("chatHistory", view.chatHistory().stream().map(OutboundMessages::chatEntry).toList());
        m.put("drawingEvents", view.drawingEvents().stream().map(OutboundMessages::drawingEvent).toList());
        m.put("canvasSnapshot", view.canvasSnapshot());
        if (view.rejoin()) {
            m.put("missedEvents", view.missedEvents().stream().map(OutboundMessages::drawingEvent).toList());
        }
        m.put("playerId", playerId);
        m.put("playerName", playerName);
        return m;
    }

    public static Map<String, Object> userJoined(String playerId, String playerName, boolean rejoin, long timestamp) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "userJoined");
        m.put("playerId", playerId);
        m.put("playerName", playerName);
        if (rejoin) m.put("isRejoin", true);
        m.put("timestamp", timestamp);
        return m;
    }

    public static Map<String, Object> userLeft(String playerId, String playerName, long timestamp) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "userLeft");
        m.put("playerId", playerId);
        m.put("playerName", playerName);
        m.put("timestamp", timestamp);
        return m;
    }

    /** A persisted drawing event as sent live and inside state views. */
    public static Map<String, Object> drawingEvent(DrawingEvent e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", e.eventType());
        JsonNode payload = e.payload();
        if (payload != null && payload.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = payload.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> f = it.next();
                m.put(f.getKey(), f.getValue());
            }
        }
        m.put("type", e.eventType()); // payload must not override attribution
        m.put("playerId", e.playerId());
        m.put("timestamp", e.timestamp());
        return m;
    }

    public static Map<String, Object> message(ChatMessage msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "message");
        m.put("text", msg.text());
        m.put("playerId", msg.playerId());
        m.put("playerName", msg.playerName());
        m.put("timestamp", msg.timestamp());
        return m;
    }

    public static Map<String, Object> clear(String playerId, String playerName, long timestamp) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "clear");
        m.put("playerId", playerId);
        m.put("playerName", playerName);
        m.put("timestamp", timestamp);
        return m;
    }

    public static Map<String, Object> drawIndicator(String playerId, String playerName, boolean drawing) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", drawing ? "drawStart" : "drawEnd");
        m.put("playerId", playerId);
        m.put("playerName", playerName);
        return m;
    }

    public static Map<String, Object> error(String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "error");
        m.put("message", message);
        return m;
    }

    static Map<String, Object> player(Player p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("playerId", p.getPlayerId());
        m.put("playerName", p.getPlayerName());
        m.put("isDrawing", p.isDrawing());
        return m;
    }

    static Map<String, Object> chatEntry(ChatMessage msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("playerId", msg.playerId());
        m.put("playerName", msg.playerName());
        m.put("text", msg.text());
        m.put("timestamp", msg.timestamp());
        return m;
    }
}
