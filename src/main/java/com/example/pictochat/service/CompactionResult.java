package com.example.pictochat.service;

/** Rows removed by one compaction pass over a room. */
public record CompactionResult(long drawingEventsDeleted, long chatMessagesDeleted) {

    public static final CompactionResult NONE = new CompactionResult(0, 0);

    public CompactionResult plus(CompactionResult other) {
        return new CompactionResult(drawingEventsDeleted + other.drawingEventsDeleted,
                chatMessagesDeleted + other.chatMessagesDeleted);
    }
}
