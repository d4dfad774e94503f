package com.example.pictochat.persistence;

import com.example.pictochat.config.SyncProperties;
import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.DrawingEvent;
import com.example.pictochat.model.Room;
import com.example.pictochat.repository.CanvasSnapshotRepository;
import com.example.pictochat.repository.ChatMessageRepository;
import com.example.pictochat.repository.DrawingEventRepository;
import com.example.pictochat.repository.PersistentRoomRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stores against embedded H2 with the generated schema.
 */
@DataJpaTest
class JpaEventStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Autowired private PersistentRoomRepository roomRepo;
    @Autowired private ChatMessageRepository chatRepo;
    @Autowired private DrawingEventRepository drawingRepo;
    @Autowired private CanvasSnapshotRepository snapshotRepo;

    private JpaRoomStore rooms;
    private JpaEventStore events;

    @BeforeEach
    void setUp() {
        rooms = new JpaRoomStore(roomRepo);
        events = new JpaEventStore(chatRepo, drawingRepo, snapshotRepo, MAPPER);
    }

    @Test
    @DisplayName("rooms: upsert by id, built-in rooms listed first")
    void roomsRoundTrip() {
        rooms.save(new Room("custom-1", "Aaa", Instant.ofEpochMilli(1_000), 4, true));
        rooms.save(new Room("chat-b", "Chat B", Instant.ofEpochMilli(2_000), 4, false));
        rooms.save(new Room("chat-a", "Chat A", Instant.ofEpochMilli(3_000), 4, false));
        rooms.save(new Room("custom-1", "Renamed", Instant.ofEpochMilli(1_000), 4, true));

        List<Room> all = rooms.findAll();
        assertEquals(List.of("chat-a", "chat-b", "custom-1"), all.stream().map(Room::id).toList());
        assertEquals("Renamed", rooms.findById("custom-1").orElseThrow().name());
        assertEquals(Instant.ofEpochMilli(1_000), rooms.findById("custom-1").orElseThrow().createdAt());

        rooms.delete("custom-1");
        assertTrue(rooms.findById("custom-1").isEmpty());
    }

    @Test
    @DisplayName("player ids and names at the configured bounds fit their columns")
    void identityBoundsFitColumns() {
        SyncProperties props = new SyncProperties();
        String playerId = "x".repeat(props.getMaxPlayerIdLength());
        String playerName = "N".repeat(props.getMaxPlayerNameLength());

        events.appendChat("chat-a", playerId, playerName, "hi", 100);
        events.appendDrawingEvent("chat-a", playerId, DrawingEvent.DRAW, MAPPER.createObjectNode(), 101);

        ChatMessage stored = events.recentChat("chat-a", 1).get(0);
        assertEquals(playerId, stored.playerId());
        assertEquals(playerName, stored.playerName());
        assertEquals(playerId, events.drawingEventsSince("chat-a", 0).get(0).playerId());
    }

    @Test
    @DisplayName("chat: newest N in chronological order")
    void recentChat() {
        for (int i = 1; i <= 5; i++) {
            events.appendChat("chat-a", "p1", "Alice", "m" + i, i * 10L);
        }
        events.appendChat("chat-b", "p2", "Bob", "elsewhere", 1);

        List<ChatMessage> last2 = events.recentChat("chat-a", 2);
        assertEquals(List.of("m4", "m5"), last2.stream().map(ChatMessage::text).toList());
        assertNotNull(last2.get(0).id());
        assertEquals(3, events.deleteChatBefore("chat-a", 40));
        assertEquals(2, events.recentChat("chat-a", 50).size());
    }

    @Test
    @DisplayName("drawing: payload survives as JSON, filter is strictly greater")
    void drawingEvents() throws Exception {
        long id1 = events.appendDrawingEvent("chat-a", "p1", DrawingEvent.DRAW,
                MAPPER.readTree("{\"points\":[[1,2]],\"color\":\"#000\",\"size\":3,\"tool\":\"pen\"}"), 100);
        long id2 = events.appendDrawingEvent("chat-a", "p1", DrawingEvent.DRAW,
                MAPPER.readTree("{\"points\":[[5,6]],\"color\":\"#fff\",\"size\":1,\"tool\":\"eraser\"}"), 200);
        assertTrue(id2 > id1);

        List<DrawingEvent> after100 = events.drawingEventsSince("chat-a", 100);
        assertEquals(1, after100.size());
        assertEquals("eraser", after100.get(0).payload().get("tool").asText());
        assertEquals(6, after100.get(0).payload().get("points").get(0).get(1).asInt());

        assertEquals(1, events.deleteDrawingEventsBefore("chat-a", 200));
        assertEquals(1, events.drawingEventsSince("chat-a", 0).size());
        assertEquals(1, events.deleteDrawingEvents("chat-a"));
    }

    @Test
    @DisplayName("snapshot: one row per room, replaced atomically")
    void snapshotReplace() {
        events.replaceSnapshot("chat-a", "first", 100);
        events.replaceSnapshot("chat-a", "second", 200);

        assertEquals("second", events.findSnapshot("chat-a").orElseThrow().data());
        assertEquals(1, snapshotRepo.count());

        events.deleteSnapshot("chat-a");
        assertTrue(events.findSnapshot("chat-a").isEmpty());
    }

    @Test
    @DisplayName("deleteAll removes every row of the room only")
    void deleteAll() throws Exception {
        events.appendChat("chat-a", "p1", "Alice", "hi", 1);
        events.appendDrawingEvent("chat-a", "p1", DrawingEvent.DRAW, MAPPER.readTree("{}"), 1);
        events.replaceSnapshot("chat-a", "x", 1);
        events.appendChat("chat-b", "p1", "Alice", "keep", 1);

        events.deleteAll("chat-a");

        assertTrue(events.recentChat("chat-a", 10).isEmpty());
        assertTrue(events.drawingEventsSince("chat-a", 0).isEmpty());
        assertTrue(events.findSnapshot("chat-a").isEmpty());
        assertEquals(1, events.recentChat("chat-b", 10).size());
    }
}
