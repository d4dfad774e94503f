package com.example.pictochat.error;

/**
 * A durable write or read failed. The in-memory path (registry, broadcast) is unaffected;
 * callers log and carry on.
 */
public class StorageException extends RoomSyncException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
