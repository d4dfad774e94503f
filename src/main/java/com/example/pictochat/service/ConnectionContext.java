package com.example.pictochat.service;

import com.example.pictochat.model.ConnectionState;
import com.example.pictochat.model.PlayerConnection;

import java.util.Objects;

/** Per-connection session state: where the connection is attached and as whom. */
public class ConnectionContext {

    private final PlayerConnection connection;
    private volatile ConnectionState state = ConnectionState.UNATTACHED;
    private volatile String roomId;
    private volatile String playerId;
    private volatile String playerName;

    public ConnectionContext(PlayerConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public PlayerConnection getConnection() { return connection; }
    public ConnectionState getState() { return state; }
    public String getRoomId() { return roomId; }
    public String getPlayerId() { return playerId; }
    public String getPlayerName() { return playerName; }

    void joining() {
        this.state = ConnectionState.JOINING;
    }

    void attached(String roomId, String playerId, String playerName) {
        this.roomId = roomId;
        this.playerId = playerId;
        this.playerName = playerName;
        this.state = ConnectionState.ACTIVE;
    }

    void detached() {
        this.roomId = null;
        this.state = ConnectionState.UNATTACHED;
    }

    void closed() {
        this.state = ConnectionState.CLOSED;
    }

    @Override
    public String toString() {
        return "ConnectionContext{" +
                "connection=" + connection.id() +
                ", state=" + state +
                ", roomId='" + roomId + '\'' +
                ", playerId='" + playerId + '\'' +
                '}';
    }
}
