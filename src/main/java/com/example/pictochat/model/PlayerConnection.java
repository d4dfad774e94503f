package com.example.pictochat.model;

import java.io.IOException;

/**
 * Opaque handle to one client connection. The core only pushes serialized messages
 * through it and never assumes a particular transport.
 */
public interface PlayerConnection {

    /** Transport-level identifier, unique per open connection. */
    String id();

    boolean isOpen();

    void send(String text) throws IOException;
}
