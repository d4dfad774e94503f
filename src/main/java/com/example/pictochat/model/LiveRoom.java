package com.example.pictochat.model;

import java.util.*;

/**
 * In-memory state of one room: its metadata, the attached players and the
 * last-activity watermark. ConnectionRegistry synchronizes on LiveRoom instances,
 * so this class itself does not add extra locking.
 */
public class LiveRoom {

    private Room room;

    /** Players by id (insertion order preserved to keep a stable roster order). */
    private final Map<String, Player> players = new LinkedHashMap<>();

    private long lastActivityAt;

    /** Set once the room is deleted; a detached room accepts no players. */
    private boolean detached = false;

    public LiveRoom(Room room, long now) {
        this.room = Objects.requireNonNull(room, "room");
        this.lastActivityAt = now;
    }

    public Room getRoom() { return room; }
    public void setRoom(Room room) { this.room = Objects.requireNonNull(room, "room"); }

    public String getId() { return room.id(); }

    public boolean isFull() {
        return players.size() >= room.maxPlayers();
    }

    public int playerCount() {
        return players.size();
    }

    public Player getPlayer(String playerId) {
        if (playerId == null) return null;
        return players.get(playerId);
    }

    /** Puts the player, replacing any entry with the same id. Returns the replaced entry. */
    public Player putPlayer(Player player) {
        return players.put(player.getPlayerId(), player);
    }

    public Player removePlayer(String playerId) {
        if (playerId == null) return null;
        return players.remove(playerId);
    }

    /** Returns a copy of the players, preserving join order. */
    public List<Player> getPlayers() {
        return new ArrayList<>(players.values());
    }

    public long getLastActivityAt() { return lastActivityAt; }
    public void touch(long now) { this.lastActivityAt = now; }

    public boolean isDetached() { return detached; }
    public void detach() { this.detached = true; }
}
