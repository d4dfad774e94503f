package com.example.pictochat.persistence;

import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.DrawingEvent;
import com.example.pictochat.model.Snapshot;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Port for the chat, drawing and snapshot relations. Calls for different rooms may run
 * concurrently; calls for one room are serialized by the caller.
 * Implementations may throw Spring's DataAccessException on storage failure.
 */
public interface EventStore {

    /** Returns the assigned, monotonically increasing id. */
    long appendChat(String roomId, String playerId, String playerName, String text, long timestamp);

    /** Returns the assigned, monotonically increasing id. */
    long appendDrawingEvent(String roomId, String playerId, String eventType, JsonNode payload, long timestamp);

    /** The newest {@code limit} messages, in ascending (timestamp, id) order. */
    List<ChatMessage> recentChat(String roomId, int limit);

    /** Events with timestamp strictly greater than {@code since}, ascending (timestamp, id). */
    List<DrawingEvent> drawingEventsSince(String roomId, long since);

    /** Atomically replaces the room's snapshot. */
    void replaceSnapshot(String roomId, String data, long timestamp);

    Optional<Snapshot> findSnapshot(String roomId);

    void deleteSnapshot(String roomId);

    long deleteDrawingEventsBefore(String roomId, long cutoff);

    long deleteChatBefore(String roomId, long cutoff);

    long deleteDrawingEvents(String roomId);

    /** Removes chat, drawing and snapshot rows of the room. */
    void deleteAll(String roomId);
}
