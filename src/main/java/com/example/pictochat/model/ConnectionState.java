package com.example.pictochat.model;

/**
 * Lifecycle of one client connection.
 * UNATTACHED -> JOINING -> ACTIVE -> CLOSED, with a rejected join falling back to UNATTACHED.
 * A dropped connection is CLOSED; the client comes back through a new connection and rejoin.
 */
public enum ConnectionState {
    UNATTACHED,
    JOINING,
    ACTIVE,
    CLOSED;

    public boolean acceptsEvents() {
        return this == ACTIVE;
    }
}
