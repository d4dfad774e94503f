package com.example.pictochat.persistence;

import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.DrawingEvent;
import com.example.pictochat.model.Snapshot;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Volatile event store (app.sync.store-mode=memory, tests).
 * One log per room; each log is guarded by its own monitor so rooms never contend.
 */
public class InMemoryEventStore implements EventStore {

    private static final Comparator<ChatMessage> CHAT_ORDER =
            Comparator.comparingLong(ChatMessage::timestamp).thenComparing(ChatMessage::id);
    private static final Comparator<DrawingEvent> DRAWING_ORDER =
            Comparator.comparingLong(DrawingEvent::timestamp).thenComparing(DrawingEvent::id);

    private final AtomicLong chatIds = new AtomicLong();
    private final AtomicLong drawingIds = new AtomicLong();
    private final ConcurrentHashMap<String, RoomLog> logs = new ConcurrentHashMap<>();

    private RoomLog log(String roomId) {
        return logs.computeIfAbsent(roomId, k -> new RoomLog());
    }

    @Override
    public long appendChat(String roomId, String playerId, String playerName, String text, long timestamp) {
        long id = chatIds.incrementAndGet();
        RoomLog l = log(roomId);
        synchronized (l) {
            l.chat.add(new ChatMessage(id, roomId, playerId, playerName, text, timestamp));
        }
        return id;
    }

    @Override
    public long appendDrawingEvent(String roomId, String playerId, String eventType, JsonNode payload, long timestamp) {
        long id = drawingIds.incrementAndGet();
        RoomLog l = log(roomId);
        synchronized (l) {
            l.drawing.add(new DrawingEvent(id, roomId, playerId, eventType, payload.deepCopy(), timestamp));
        }
        return id;
    }

    @Override
    public List<ChatMessage> recentChat(String roomId, int limit) {
        if (limit <= 0) return List.of();
        RoomLog l = log(roomId);
        List<ChatMessage> sorted;
        synchronized (l) {
            sorted = new ArrayList<>(l.chat);
        }
        sorted.sort(CHAT_ORDER);
        int from = Math.max(0, sorted.size() - limit);
        return new ArrayList<>(sorted.subList(from, sorted.size()));
    }

    @Override
    public List<DrawingEvent> drawingEventsSince(String roomId, long since) {
        RoomLog l = log(roomId);
        List<DrawingEvent> out = new ArrayList<>();
        synchronized (l) {
            for (DrawingEvent e : l.drawing) {
                if (e.timestamp() > since) out.add(e);
            }
        }
        out.sort(DRAWING_ORDER);
        return out;
    }

    @Override
    public void replaceSnapshot(String roomId, String data, long timestamp) {
        RoomLog l = log(roomId);
        synchronized (l) {
            l.snapshot = new Snapshot(roomId, data, timestamp);
        }
    }

    @Override
    public Optional<Snapshot> findSnapshot(String roomId) {
        RoomLog l = log(roomId);
        synchronized (l) {
            return Optional.ofNullable(l.snapshot);
        }
    }

    @Override
    public void deleteSnapshot(String roomId) {
        RoomLog l = log(roomId);
        synchronized (l) {
            l.snapshot = null;
        }
    }

    @Override
    public long deleteDrawingEventsBefore(String roomId, long cutoff) {
        RoomLog l = log(roomId);
        synchronized (l) {
            int before = l.drawing.size();
            l.drawing.removeIf(e -> e.timestamp() < cutoff);
            return before - l.drawing.size();
        }
    }

    @Override
    public long deleteChatBefore(String roomId, long cutoff) {
        RoomLog l = log(roomId);
        synchronized (l) {
            int before = l.chat.size();
            l.chat.removeIf(m -> m.timestamp() < cutoff);
            return before - l.chat.size();
        }
    }

    @Override
    public long deleteDrawingEvents(String roomId) {
        RoomLog l = log(roomId);
        synchronized (l) {
            int n = l.drawing.size();
            l.drawing.clear();
            return n;
        }
    }

    @Override
    public void deleteAll(String roomId) {
        logs.remove(roomId);
    }

    private static final class RoomLog {
        private final List<ChatMessage> chat = new ArrayList<>();
        private final List<DrawingEvent> drawing = new ArrayList<>();
        private Snapshot snapshot;
    }
}
