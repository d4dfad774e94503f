package com.example.pictochat.error;

public class RoomNotFoundException extends RoomSyncException {

    public RoomNotFoundException(String roomId) {
        super("Room does not exist: " + roomId);
    }
}
