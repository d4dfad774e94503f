package com.example.pictochat.model;

import java.util.Objects;

/** A player attached to a room through one open connection. Never persisted. */
public class Player {

    private final String playerId;
    private final String playerName;
    private final PlayerConnection connection;
    private volatile boolean drawing = false;   // transient UI hint

    public Player(String playerId, String playerName, PlayerConnection connection) {
        this.playerId = Objects.requireNonNull(playerId, "playerId");
        this.playerName = Objects.requireNonNull(playerName, "playerName");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public String getPlayerId() { return playerId; }
    public String getPlayerName() { return playerName; }
    public PlayerConnection getConnection() { return connection; }

    public boolean isDrawing() { return drawing; }
    public void setDrawing(boolean drawing) { this.drawing = drawing; }

    @Override
    public String toString() {
        return "Player{" +
                "playerId='" + playerId + '\'' +
                ", playerName='" + playerName + '\'' +
                ", connection=" + connection.id() +
                ", drawing=" + drawing +
                '}';
    }
}
