package com.example.pictochat.service;

import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.DrawingEvent;
import com.example.pictochat.model.Player;

import java.util.List;

/**
 * What a (re)joining client needs to rebuild the room: the snapshot, the drawing events after
 * it (all events if there is none), bounded chat history and the roster. {@code missedEvents}
 * is only meaningful for a rejoin.
 */
public record RoomStateView(
        String roomId,
        String roomName,
        List<Player> activePlayers,
        List<ChatMessage> chatHistory,
        List<DrawingEvent> drawingEvents,
        String canvasSnapshot,
        List<DrawingEvent> missedEvents,
        boolean rejoin
) {

    public RoomStateView {
        activePlayers = List.copyOf(activePlayers);
        chatHistory = List.copyOf(chatHistory);
        drawingEvents = List.copyOf(drawingEvents);
        missedEvents = (missedEvents == null ? List.of() : List.copyOf(missedEvents));
    }
}
