package com.example.pictochat.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Inbound frame, one shape for every client message type. Fields a type does not use stay null.
 * Stroke geometry ({@code points}, {@code size}) is kept as raw JSON and stored as-is.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientMessage {
    public String type;
    public String roomId;
    public String playerId;
    public String playerName;

    /** rejoin */
    public Long lastEventTimestamp;

    /** draw */
    public JsonNode points;
    public String color;
    public JsonNode size;
    public String tool;

    /** message */
    public String text;

    /** canvasSnapshot */
    public String snapshotData;

    /** queueReplay */
    public List<JsonNode> events;

    public Long timestamp;

    public ClientMessage() {}

    public ClientMessage(String type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return "ClientMessage{type='" + type + "', roomId='" + roomId + "', playerId='" + playerId + "'}";
    }
}
