package com.example.pictochat.error;

public class RoomFullException extends RoomSyncException {

    public RoomFullException(String roomId, int maxPlayers) {
        super("Room is full: " + roomId + " (max " + maxPlayers + ")");
    }
}
