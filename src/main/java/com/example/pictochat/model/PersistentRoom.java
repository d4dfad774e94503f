package com.example.pictochat.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Row of the {@code rooms} relation. */
@Entity
@Table(name = "rooms")
public class PersistentRoom {

    @Id
    @Column(length = 64, nullable = false, updatable = false)
    private String id;

    @NotBlank
    @Size(max = 100)
    @Column(nullable = false, length = 100)
    private String name;

    /** Epoch millis. */
    @Column(name = "created_at", nullable = false)
    private long createdAt;

    @Min(1)
    @Column(name = "max_players", nullable = false)
    private int maxPlayers = Room.DEFAULT_MAX_PLAYERS;

    @Column(name = "is_custom", nullable = false)
    private boolean custom = false;

    protected PersistentRoom() {}

    public PersistentRoom(String id, String name, long createdAt, int maxPlayers, boolean custom) {
        this.id = id;
        this.name = name != null ? name.trim() : null;
        this.createdAt = createdAt;
        this.maxPlayers = maxPlayers;
        this.custom = custom;
    }

    public static PersistentRoom from(Room room) {
        return new PersistentRoom(room.id(), room.name(), room.createdAt().toEpochMilli(),
                room.maxPlayers(), room.custom());
    }

    public Room toRoom() {
        return new Room(id, name, java.time.Instant.ofEpochMilli(createdAt), maxPlayers, custom);
    }

    public String getId() { return id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = (name != null ? name.trim() : null); }

    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }

    public int getMaxPlayers() { return maxPlayers; }
    public void setMaxPlayers(int maxPlayers) { this.maxPlayers = maxPlayers; }

    public boolean isCustom() { return custom; }
    public void setCustom(boolean custom) { this.custom = custom; }

    @Override
    public String toString() {
        return "PersistentRoom{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", createdAt=" + createdAt +
                ", maxPlayers=" + maxPlayers +
                ", custom=" + custom +
                '}';
    }
}
