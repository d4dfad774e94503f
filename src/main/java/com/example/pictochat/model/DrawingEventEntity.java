package com.example.pictochat.model;

import jakarta.persistence.*;

/** Row of the {@code drawing_events} relation. The payload is kept as JSON text. */
@Entity
@Table(
    name = "drawing_events",
    indexes = @Index(name = "idx_drawing_room", columnList = "room_id")
)
public class DrawingEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 64)
    private String roomId;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "event_type", nullable = false, length = 32)
    private String eventType;

    @Lob
    @Column(name = "event_data", nullable = false)
    private String eventData;

    @Column(name = "`timestamp`", nullable = false)
    private long timestamp;

    protected DrawingEventEntity() {}

    public DrawingEventEntity(String roomId, String playerId, String eventType, String eventData, long timestamp) {
        this.roomId = roomId;
        this.playerId = playerId;
        this.eventType = eventType;
        this.eventData = eventData;
        this.timestamp = timestamp;
    }

    public Long getId() { return id; }
    public String getRoomId() { return roomId; }
    public String getPlayerId() { return playerId; }
    public String getEventType() { return eventType; }
    public String getEventData() { return eventData; }
    public long getTimestamp() { return timestamp; }
}
