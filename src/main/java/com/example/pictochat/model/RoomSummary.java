package com.example.pictochat.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Room metadata joined with the live player count at read time. */
public record RoomSummary(
        String id,
        String name,
        int playerCount,
        int maxPlayers,
        @JsonProperty("isCustom") boolean custom
) {

    public static RoomSummary of(Room room, int playerCount) {
        return new RoomSummary(room.id(), room.name(), playerCount, room.maxPlayers(), room.custom());
    }
}
