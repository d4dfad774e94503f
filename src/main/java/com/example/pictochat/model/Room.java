package com.example.pictochat.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Room metadata. Immutable; re-creating a room with the same id replaces this value
 * but never the players or events attached to it.
 */
public record Room(String id, String name, Instant createdAt, int maxPlayers, boolean custom) {

    public static final int DEFAULT_MAX_PLAYERS = 4;

    public Room {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createdAt, "createdAt");
        if (maxPlayers <= 0) maxPlayers = DEFAULT_MAX_PLAYERS;
    }
}
