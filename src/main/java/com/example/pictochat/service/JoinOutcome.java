package com.example.pictochat.service;

import com.example.pictochat.error.RoomSyncException;

import java.util.Optional;

/**
 * Result of a join or rejoin: either the state view, or the reason the player was turned away.
 * An accepted join may name the room the player id was registered in before.
 */
public record JoinOutcome(RoomStateView view, RoomSyncException rejection, String displacedFrom) {

    public static JoinOutcome accepted(RoomStateView view) {
        return new JoinOutcome(view, null, null);
    }

    public static JoinOutcome accepted(RoomStateView view, String displacedFrom) {
        return new JoinOutcome(view, null, displacedFrom);
    }

    public static JoinOutcome rejected(RoomSyncException reason) {
        return new JoinOutcome(null, reason, null);
    }

    public boolean isAccepted() {
        return view != null;
    }

    public Optional<String> displaced() {
        return Optional.ofNullable(displacedFrom);
    }
}
