package com.example.pictochat.model;

import jakarta.persistence.*;

/** Row of the {@code canvas_snapshots} relation. At most one row per room. */
@Entity
@Table(
    name = "canvas_snapshots",
    indexes = @Index(name = "idx_snapshots_room", columnList = "room_id")
)
public class CanvasSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 64)
    private String roomId;

    @Lob
    @Column(name = "snapshot_data", nullable = false)
    private String snapshotData;

    @Column(name = "`timestamp`", nullable = false)
    private long timestamp;

    protected CanvasSnapshotEntity() {}

    public CanvasSnapshotEntity(String roomId, String snapshotData, long timestamp) {
        this.roomId = roomId;
        this.snapshotData = snapshotData;
        this.timestamp = timestamp;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(roomId, snapshotData, timestamp);
    }

    public Long getId() { return id; }
    public String getRoomId() { return roomId; }
    public String getSnapshotData() { return snapshotData; }
    public long getTimestamp() { return timestamp; }
}
