package com.example.pictochat.model;

import jakarta.persistence.*;

/** Row of the {@code chat_messages} relation. */
@Entity
@Table(
    name = "chat_messages",
    indexes = @Index(name = "idx_messages_room", columnList = "room_id")
)
public class ChatMessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 64)
    private String roomId;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "player_name", nullable = false, length = 100)
    private String playerName;

    @Column(name = "message", nullable = false, length = 1000)
    private String message;

    // quoted: TIMESTAMP is a keyword in most SQL dialects
    @Column(name = "`timestamp`", nullable = false)
    private long timestamp;

    protected ChatMessageEntity() {}

    public ChatMessageEntity(String roomId, String playerId, String playerName, String message, long timestamp) {
        this.roomId = roomId;
        this.playerId = playerId;
        this.playerName = playerName;
        this.message = message;
        this.timestamp = timestamp;
    }

    public ChatMessage toMessage() {
        return new ChatMessage(id, roomId, playerId, playerName, message, timestamp);
    }

    public Long getId() { return id; }
    public String getRoomId() { return roomId; }
    public String getPlayerId() { return playerId; }
    public String getPlayerName() { return playerName; }
    public String getMessage() { return message; }
    public long getTimestamp() { return timestamp; }
}
