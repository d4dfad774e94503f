package com.example.pictochat.persistence;

import com.example.pictochat.error.StorageException;
import com.example.pictochat.model.CanvasSnapshotEntity;
import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.ChatMessageEntity;
import com.example.pictochat.model.DrawingEvent;
import com.example.pictochat.model.DrawingEventEntity;
import com.example.pictochat.model.Snapshot;
import com.example.pictochat.repository.CanvasSnapshotRepository;
import com.example.pictochat.repository.ChatMessageRepository;
import com.example.pictochat.repository.DrawingEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JPA-backed event store. Drawing payloads are written to {@code event_data} as JSON text.
 */
public class JpaEventStore implements EventStore {

    private final ChatMessageRepository chat;
    private final DrawingEventRepository drawing;
    private final CanvasSnapshotRepository snapshots;
    private final ObjectMapper objectMapper;

    public JpaEventStore(ChatMessageRepository chat,
                         DrawingEventRepository drawing,
                         CanvasSnapshotRepository snapshots,
                         ObjectMapper objectMapper) {
        this.chat = chat;
        this.drawing = drawing;
        this.snapshots = snapshots;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public long appendChat(String roomId, String playerId, String playerName, String text, long timestamp) {
        return chat.save(new ChatMessageEntity(roomId, playerId, playerName, text, timestamp)).getId();
    }

    @Override
    @Transactional
    public long appendDrawingEvent(String roomId, String playerId, String eventType, JsonNode payload, long timestamp) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize drawing payload for room " + roomId, e);
        }
        return drawing.save(new DrawingEventEntity(roomId, playerId, eventType, json, timestamp)).getId();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> recentChat(String roomId, int limit) {
        if (limit <= 0) return List.of();
        List<ChatMessage> out = new ArrayList<>();
        for (ChatMessageEntity e : chat.findByRoomIdOrderByTimestampDescIdDesc(roomId, PageRequest.of(0, limit))) {
            out.add(e.toMessage());
        }
        Collections.reverse(out);
        return out;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DrawingEvent> drawingEventsSince(String roomId, long since) {
        List<DrawingEvent> out = new ArrayList<>();
        for (DrawingEventEntity e : drawing.findByRoomIdAndTimestampGreaterThanOrderByTimestampAscIdAsc(roomId, since)) {
            out.add(new DrawingEvent(e.getId(), e.getRoomId(), e.getPlayerId(), e.getEventType(),
                    readPayload(e), e.getTimestamp()));
        }
        return out;
    }

    @Override
    @Transactional
    public void replaceSnapshot(String roomId, String data, long timestamp) {
        snapshots.deleteByRoomId(roomId);
        snapshots.save(new CanvasSnapshotEntity(roomId, data, timestamp));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Snapshot> findSnapshot(String roomId) {
        return snapshots.findFirstByRoomIdOrderByTimestampDescIdDesc(roomId).map(CanvasSnapshotEntity::toSnapshot);
    }

    @Override
    @Transactional
    public void deleteSnapshot(String roomId) {
        snapshots.deleteByRoomId(roomId);
    }

    @Override
    @Transactional
    public long deleteDrawingEventsBefore(String roomId, long cutoff) {
        return drawing.deleteByRoomIdAndTimestampLessThan(roomId, cutoff);
    }

    @Override
    @Transactional
    public long deleteChatBefore(String roomId, long cutoff) {
        return chat.deleteByRoomIdAndTimestampLessThan(roomId, cutoff);
    }

    @Override
    @Transactional
    public long deleteDrawingEvents(String roomId) {
        return drawing.deleteByRoomId(roomId);
    }

    @Override
    @Transactional
    public void deleteAll(String roomId) {
        chat.deleteByRoomId(roomId);
        drawing.deleteByRoomId(roomId);
        snapshots.deleteByRoomId(roomId);
    }

    private JsonNode readPayload(DrawingEventEntity e) {
        try {
            return objectMapper.readTree(e.getEventData());
        } catch (JsonProcessingException ex) {
            throw new StorageException("Corrupt event_data in drawing event " + e.getId(), ex);
        }
    }
}
