package com.example.pictochat.model;

/** An appended chat line. Ordered by (timestamp, id). */
public record ChatMessage(
        Long id,
        String roomId,
        String playerId,
        String playerName,
        String text,
        long timestamp
) { }
