package com.example.pictochat.error;

/**
 * Base of all failures raised by the room synchronization core.
 * Every failure is scoped to one room or one connection; none is fatal to the process.
 */
public class RoomSyncException extends RuntimeException {

    public RoomSyncException(String message) {
        super(message);
    }

    public RoomSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
