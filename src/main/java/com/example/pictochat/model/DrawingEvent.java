package com.example.pictochat.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An appended drawing event. The payload is opaque structured data; for {@code draw}
 * it carries points, color, size and tool.
 */
public record DrawingEvent(
        Long id,
        String roomId,
        String playerId,
        String eventType,
        JsonNode payload,
        long timestamp
) {

    public static final String DRAW = "draw";
    public static final String CLEAR = "clear";
}
