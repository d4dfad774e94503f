package com.example.pictochat.error;

/** Raised when a room cannot be deleted because players are still attached. */
public class RoomConflictException extends RoomSyncException {

    public RoomConflictException(String message) {
        super(message);
    }
}
