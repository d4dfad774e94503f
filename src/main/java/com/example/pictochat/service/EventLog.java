package com.example.pictochat.service;

import com.example.pictochat.config.SyncProperties;
import com.example.pictochat.error.StorageException;
import com.example.pictochat.error.ValidationException;
import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.DrawingEvent;
import com.example.pictochat.model.Snapshot;
import com.example.pictochat.persistence.EventStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Append-only, per-room log of chat messages and drawing events plus the single snapshot slot.
 *
 * <p>Saving a snapshot never deletes drawing events. Pre-snapshot rows are only reclaimed by
 * {@link #compactionPass(String, long)}, and only when a durable snapshot covers them.
 *
 * <p>Callers serialize access per room; calls for different rooms may run concurrently.
 * Storage failures surface as {@link StorageException}.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final EventStore store;
    private final SyncProperties props;

    public EventLog(EventStore store, SyncProperties props) {
        this.store = store;
        this.props = props;
    }

    // ========================================================================
    //  APPEND
    // ========================================================================

    public long appendChat(String roomId, String playerId, String playerName, String text, long timestamp) {
        String clean = normalizeChatText(text);
        return storage("append chat to " + roomId,
                () -> store.appendChat(roomId, playerId, playerName, clean, timestamp));
    }

    public long appendDrawingEvent(String roomId, String playerId, String eventType, JsonNode payload, long timestamp) {
        if (eventType == null || eventType.isBlank()) {
            throw new ValidationException("Drawing event type is required");
        }
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new ValidationException("Drawing event payload is required");
        }
        return storage("append drawing event to " + roomId,
                () -> store.appendDrawingEvent(roomId, playerId, eventType, payload, timestamp));
    }

    /**
     * Returns the trimmed text, or throws if it is empty or longer than the configured
     * number of code points.
     */
    public String normalizeChatText(String text) {
        String trimmed = (text == null ? "" : text.trim());
        if (trimmed.isEmpty()) {
            throw new ValidationException("Message text is empty");
        }
        int max = props.getMaxMessageLength();
        if (trimmed.codePointCount(0, trimmed.length()) > max) {
            throw new ValidationException("Message exceeds " + max + " characters");
        }
        return trimmed;
    }

    // ========================================================================
    //  READ
    // ========================================================================

    /** The most recent {@code limit} messages, oldest first. */
    public List<ChatMessage> chatHistory(String roomId, int limit) {
        if (limit <= 0) return List.of();
        return storage("read chat history of " + roomId, () -> store.recentChat(roomId, limit));
    }

    /** Drawing events with {@code timestamp > sinceTimestamp}, ascending by (timestamp, id). */
    public List<DrawingEvent> drawingEventsSince(String roomId, long sinceTimestamp) {
        return storage("read drawing events of " + roomId, () -> store.drawingEventsSince(roomId, sinceTimestamp));
    }

    public Optional<Snapshot> snapshot(String roomId) {
        return storage("read snapshot of " + roomId, () -> store.findSnapshot(roomId));
    }

    // ========================================================================
    //  SNAPSHOT / CLEAR / COMPACTION
    // ========================================================================

    /** Replaces the room's snapshot. Drawing events stay in the log. */
    public void saveSnapshot(String roomId, String data, long timestamp) {
        if (data == null || data.isEmpty()) {
            throw new ValidationException("Snapshot data is required");
        }
        storage("save snapshot of " + roomId, () -> {
            store.replaceSnapshot(roomId, data, timestamp);
            return null;
        });
        log.info("Snapshot saved (room={}, timestamp={}, bytes={})", roomId, timestamp, data.length());
    }

    /** Drops every drawing event and the snapshot of the room. Chat is kept. */
    public void clearDrawingState(String roomId) {
        long deleted = storage("clear drawing state of " + roomId, () -> {
            long n = store.deleteDrawingEvents(roomId);
            store.deleteSnapshot(roomId);
            return n;
        });
        log.info("Drawing state cleared (room={}, events={})", roomId, deleted);
    }

    public void deleteRoomData(String roomId) {
        storage("delete data of " + roomId, () -> {
            store.deleteAll(roomId);
            return null;
        });
    }

    /**
     * Deletes drawing events older than {@code olderThan} if, and only if, the room has a
     * snapshot with {@code timestamp >= olderThan}. Chat older than the cutoff is deleted
     * regardless.
     */
    public CompactionResult compactionPass(String roomId, long olderThan) {
        Optional<Snapshot> snap = snapshot(roomId);
        long drawing = 0;
        if (snap.isPresent() && snap.get().timestamp() >= olderThan) {
            drawing = storage("compact drawing events of " + roomId,
                    () -> store.deleteDrawingEventsBefore(roomId, olderThan));
        } else {
            log.debug("Compaction skips drawing events (room={}, cutoff={}, snapshot={})",
                    roomId, olderThan, snap.map(Snapshot::timestamp).orElse(null));
        }
        long chat = storage("compact chat of " + roomId, () -> store.deleteChatBefore(roomId, olderThan));

        if (drawing > 0 || chat > 0) {
            log.info("Compaction (room={}, cutoff={}): drawingEvents={}, chatMessages={}",
                    roomId, olderThan, drawing, chat);
        }
        return new CompactionResult(drawing, chat);
    }

    private static <T> T storage(String what, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("Storage failure: " + what, e);
        }
    }
}
