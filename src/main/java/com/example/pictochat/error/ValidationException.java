package com.example.pictochat.error;

/** Malformed or oversized input. Rejected without any state change. */
public class ValidationException extends RoomSyncException {

    public ValidationException(String message) {
        super(message);
    }
}
