package com.example.pictochat.service;

import com.example.pictochat.model.Player;
import com.example.pictochat.model.Room;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionRegistryTest {

    private MutableClock clock;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000);
        registry = new ConnectionRegistry(clock);
    }

    private static Room room(String id, int max) {
        return new Room(id, "Room " + id, Instant.EPOCH, max, true);
    }

    private static Player player(String id) {
        return new Player(id, "Name " + id, new RecordingConnection("conn-" + id));
    }

    @Test
    @DisplayName("unknown room rejects players")
    void unknownRoom() {
        assertFalse(registry.addPlayer("nope", player("a")));
        assertTrue(registry.listPlayers("nope").isEmpty());
    }

    @Test
    @DisplayName("full room rejects and leaves the active set unchanged")
    void capacity() {
        registry.attach(room("r", 2));
        assertTrue(registry.addPlayer("r", player("a")));
        assertTrue(registry.addPlayer("r", player("b")));

        assertFalse(registry.addPlayer("r", player("c")));

        assertEquals(List.of("a", "b"), registry.listPlayers("r").stream().map(Player::getPlayerId).toList());
        assertTrue(registry.roomOf("c").isEmpty());
    }

    @Test
    @DisplayName("same player id replaces its entry without using a second seat")
    void sameIdReplaces() {
        registry.attach(room("r", 1));
        Player first = player("a");
        Player second = new Player("a", "Alice again", new RecordingConnection("conn-2"));

        assertTrue(registry.addPlayer("r", first));
        assertTrue(registry.addPlayer("r", second));

        assertEquals(1, registry.playerCount("r"));
        assertSame(second.getConnection(), registry.listPlayers("r").get(0).getConnection());
    }

    @Test
    @DisplayName("removal through a stale connection keeps the newer registration")
    void guardedRemove() {
        registry.attach(room("r", 4));
        Player old = player("a");
        Player fresh = new Player("a", "Alice", new RecordingConnection("conn-new"));
        registry.addPlayer("r", old);
        registry.addPlayer("r", fresh);

        assertFalse(registry.removePlayer("r", "a", old.getConnection()));
        assertEquals(1, registry.playerCount("r"));

        assertTrue(registry.removePlayer("r", "a", fresh.getConnection()));
        assertEquals(0, registry.playerCount("r"));
        assertTrue(registry.roomOf("a").isEmpty());
    }

    @Test
    @DisplayName("leaving moves the activity watermark")
    void removeTouches() {
        registry.attach(room("r", 4));
        registry.addPlayer("r", player("a"));
        clock.set(5_000);

        assertTrue(registry.removePlayer("r", "a"));
        assertFalse(registry.removePlayer("r", "a"));
        assertEquals(5_000, registry.lastActivity("r").getAsLong());
    }

    @Test
    @DisplayName("listPlayers returns a copy")
    void listIsCopy() {
        registry.attach(room("r", 4));
        registry.addPlayer("r", player("a"));

        List<Player> snapshot = registry.listPlayers("r");
        registry.addPlayer("r", player("b"));

        assertEquals(1, snapshot.size());
        assertEquals(2, registry.listPlayers("r").size());
    }

    @Test
    @DisplayName("drawing flag is a no-op for absent players")
    void drawingFlag() {
        registry.attach(room("r", 4));
        registry.addPlayer("r", player("a"));

        assertTrue(registry.setDrawingFlag("r", "a", true));
        assertTrue(registry.listPlayers("r").get(0).isDrawing());
        assertFalse(registry.setDrawingFlag("r", "ghost", true));
        assertFalse(registry.setDrawingFlag("gone", "a", true));
    }

    @Test
    @DisplayName("re-attaching only replaces metadata")
    void reattachKeepsPlayers() {
        registry.attach(room("r", 4));
        registry.addPlayer("r", player("a"));

        registry.attach(new Room("r", "Renamed", Instant.EPOCH, 4, true));

        assertEquals("Renamed", registry.getRoom("r").orElseThrow().name());
        assertEquals(1, registry.playerCount("r"));
    }

    @Test
    @DisplayName("a detached room accepts nobody")
    void detach() {
        registry.attach(room("r", 4));
        registry.addPlayer("r", player("a"));

        assertTrue(registry.detach("r"));
        assertFalse(registry.detach("r"));
        assertFalse(registry.addPlayer("r", player("b")));
        assertTrue(registry.getRoom("r").isEmpty());
        assertTrue(registry.roomOf("a").isEmpty());
        assertTrue(registry.inRoom("r", live -> true).isEmpty());
    }

    @Test
    @DisplayName("registering in a second room reports the room the id was claimed from")
    void claimMovesBetweenRooms() {
        registry.attach(room("r", 2));
        registry.attach(room("s", 2));
        registry.addPlayer("r", player("a"));

        ConnectionRegistry.Registration moved = registry.register("s", player("a"));

        assertTrue(moved.added());
        assertEquals("r", moved.displacedFrom());
        assertEquals("s", registry.roomOf("a").orElseThrow());
        assertTrue(registry.removeIfClaimedElsewhere("r", "a"));
        assertEquals(0, registry.playerCount("r"));
        assertTrue(registry.register("s", player("a")).displaced().isEmpty());
    }

    @Test
    @DisplayName("a room that reclaimed the id keeps the player")
    void reclaimedRoomKeepsPlayer() {
        registry.attach(room("r", 2));
        registry.attach(room("s", 2));
        registry.addPlayer("r", player("a"));
        registry.addPlayer("s", player("a"));
        registry.addPlayer("r", player("a"));

        assertFalse(registry.removeIfClaimedElsewhere("r", "a"));
        assertEquals(1, registry.playerCount("r"));
        assertTrue(registry.removeIfClaimedElsewhere("s", "a"));
    }

    @Test
    @DisplayName("concurrent joins never exceed capacity")
    void concurrentJoins() throws Exception {
        int max = 4;
        int contenders = 32;
        registry.attach(room("r", max));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                Player p = player("p" + i);
                futures.add(pool.submit(() -> {
                    start.await();
                    if (registry.addPlayer("r", p)) accepted.incrementAndGet();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(max, accepted.get());
        assertEquals(max, registry.listPlayers("r").size());
    }
}
