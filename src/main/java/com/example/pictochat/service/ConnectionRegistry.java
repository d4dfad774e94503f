package com.example.pictochat.service;

import com.example.pictochat.model.LiveRoom;
import com.example.pictochat.model.Player;
import com.example.pictochat.model.PlayerConnection;
import com.example.pictochat.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Live player sets per room, and the only place capacity is enforced.
 *
 * <p>Each {@link LiveRoom} is its own lock: every mutation of a room's player set runs in
 * {@code synchronized (liveRoom)}. {@link #inRoom(String, Function)} exposes the same lock so
 * callers can make join, append and broadcast for one room atomic. Different rooms never
 * contend.
 */
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Clock clock;

    /** Room id → live state. A room lives here until it is detached. */
    private final Map<String, LiveRoom> rooms = new ConcurrentHashMap<>();

    /** playerId → room it is registered in. */
    private final Map<String, String> roomByPlayer = new ConcurrentHashMap<>();

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    private long now() {
        return clock.millis();
    }

    // ========================================================================
    //  ROOMS
    // ========================================================================

    /**
     * Makes the room known to the registry. An already attached room only gets its metadata
     * replaced; its players stay.
     */
    public LiveRoom attach(Room room) {
        while (true) {
            LiveRoom live = rooms.computeIfAbsent(room.id(), id -> new LiveRoom(room, now()));
            synchronized (live) {
                if (live.isDetached()) continue; // lost a race with detach
                live.setRoom(room);
                return live;
            }
        }
    }

    /** Forgets the room. Returns false if it was not attached. */
    public boolean detach(String roomId) {
        LiveRoom live = rooms.get(roomId);
        if (live == null) return false;
        synchronized (live) {
            if (live.isDetached()) return false;
            for (Player p : live.getPlayers()) {
                live.removePlayer(p.getPlayerId());
                roomByPlayer.remove(p.getPlayerId(), roomId);
            }
            live.detach();
            rooms.remove(roomId, live);
        }
        log.debug("Room detached (room={})", roomId);
        return true;
    }

    public Optional<Room> getRoom(String roomId) {
        if (roomId == null) return Optional.empty();
        LiveRoom live = rooms.get(roomId);
        return live == null ? Optional.empty() : Optional.of(live.getRoom());
    }

    /** Copy of the attached rooms. */
    public List<LiveRoom> liveRooms() {
        return new ArrayList<>(rooms.values());
    }

    /**
     * Runs {@code action} while holding the room's lock. Empty if the room is unknown or was
     * detached before the lock was taken.
     */
    public <T> Optional<T> inRoom(String roomId, Function<LiveRoom, T> action) {
        if (roomId == null) return Optional.empty();
        LiveRoom live = rooms.get(roomId);
        if (live == null) return Optional.empty();
        synchronized (live) {
            if (live.isDetached()) return Optional.empty();
            return Optional.ofNullable(action.apply(live));
        }
    }

    // ========================================================================
    //  PLAYERS
    // ========================================================================

    /** Outcome of {@link #register}: whether the player was added, and the room its id was claimed from. */
    public record Registration(boolean added, String displacedFrom) {

        static final Registration REJECTED = new Registration(false, null);

        public Optional<String> displaced() {
            return Optional.ofNullable(displacedFrom);
        }
    }

    /**
     * Registers the player. Returns false if the room is unknown or full; the active set is
     * then unchanged. A player id already present in the room is replaced in place and does not
     * count against capacity.
     */
    public boolean addPlayer(String roomId, Player player) {
        return register(roomId, player).added();
    }

    /**
     * Like {@link #addPlayer}, and claims the player id for this room in the same step. If the id
     * was claimed by another room, that room is returned as {@code displacedFrom}; the caller
     * clears it with {@link #removeIfClaimedElsewhere} once this room's lock is released.
     */
    public Registration register(String roomId, Player player) {
        if (roomId == null || player == null) return Registration.REJECTED;
        LiveRoom live = rooms.get(roomId);
        if (live == null) return Registration.REJECTED;
        synchronized (live) {
            if (live.isDetached()) return Registration.REJECTED;
            boolean present = live.getPlayer(player.getPlayerId()) != null;
            if (!present && live.isFull()) {
                log.debug("Room full (room={}, max={})", roomId, live.getRoom().maxPlayers());
                return Registration.REJECTED;
            }
            live.putPlayer(player);
            live.touch(now());
            String previous = roomByPlayer.put(player.getPlayerId(), roomId);
            return new Registration(true, roomId.equals(previous) ? null : previous);
        }
    }

    /**
     * Removes the player from {@code roomId} unless its id is claimed by that room. Claims only
     * change under the claiming room's lock, so the check and the removal cannot be split.
     */
    public boolean removeIfClaimedElsewhere(String roomId, String playerId) {
        if (roomId == null || playerId == null) return false;
        LiveRoom live = rooms.get(roomId);
        if (live == null) return false;
        synchronized (live) {
            if (roomId.equals(roomByPlayer.get(playerId))) return false;
            if (live.removePlayer(playerId) == null) return false;
            live.touch(now());
            return true;
        }
    }

    public boolean removePlayer(String roomId, String playerId) {
        return removeIf(roomId, playerId, null);
    }

    /**
     * Removes the player only if it is still registered through {@code connection}, so a
     * stale connection closing late cannot remove the player's newer registration.
     */
    public boolean removePlayer(String roomId, String playerId, PlayerConnection connection) {
        return removeIf(roomId, playerId, Objects.requireNonNull(connection, "connection"));
    }

    private boolean removeIf(String roomId, String playerId, PlayerConnection connection) {
        if (roomId == null || playerId == null) return false;
        LiveRoom live = rooms.get(roomId);
        if (live == null) return false;
        synchronized (live) {
            Player p = live.getPlayer(playerId);
            if (p == null) return false;
            if (connection != null && p.getConnection() != connection) return false;
            live.removePlayer(playerId);
            live.touch(now());
            roomByPlayer.remove(playerId, roomId);
            return true;
        }
    }

    /** Snapshot of the room's players; empty if the room is unknown. */
    public List<Player> listPlayers(String roomId) {
        if (roomId == null) return List.of();
        LiveRoom live = rooms.get(roomId);
        if (live == null) return List.of();
        synchronized (live) {
            return live.getPlayers();
        }
    }

    public int playerCount(String roomId) {
        if (roomId == null) return 0;
        LiveRoom live = rooms.get(roomId);
        if (live == null) return 0;
        synchronized (live) {
            return live.playerCount();
        }
    }

    /** Best-effort; no-op if the player has left. */
    public boolean setDrawingFlag(String roomId, String playerId, boolean drawing) {
        LiveRoom live = (roomId == null ? null : rooms.get(roomId));
        if (live == null) return false;
        synchronized (live) {
            Player p = live.getPlayer(playerId);
            if (p == null) return false;
            p.setDrawing(drawing);
            return true;
        }
    }

    /** The room the player is currently registered in, if any. */
    public Optional<String> roomOf(String playerId) {
        if (playerId == null) return Optional.empty();
        return Optional.ofNullable(roomByPlayer.get(playerId));
    }

    // ========================================================================
    //  ACTIVITY
    // ========================================================================

    public void touch(String roomId) {
        LiveRoom live = (roomId == null ? null : rooms.get(roomId));
        if (live == null) return;
        synchronized (live) {
            live.touch(now());
        }
    }

    public OptionalLong lastActivity(String roomId) {
        LiveRoom live = (roomId == null ? null : rooms.get(roomId));
        if (live == null) return OptionalLong.empty();
        synchronized (live) {
            return OptionalLong.of(live.getLastActivityAt());
        }
    }
}
