package com.example.pictochat.error;

/** Raised when an operation is not allowed on a built-in room. */
public class RoomPermissionException extends RoomSyncException {

    public RoomPermissionException(String message) {
        super(message);
    }
}
