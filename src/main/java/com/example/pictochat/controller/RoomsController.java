package com.example.pictochat.controller;

import com.example.pictochat.error.*;
import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.Room;
import com.example.pictochat.model.RoomSummary;
import com.example.pictochat.service.RoomSynchronizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/rooms")
public class RoomsController {

  private static final Logger log = LoggerFactory.getLogger(RoomsController.class);

  private final RoomSynchronizationEngine engine;

  public RoomsController(RoomSynchronizationEngine engine) {
    this.engine = engine;
  }

  // --- List ----------------------------------------------------------------

  @GetMapping
  public ResponseEntity<RoomsView> list() {
    return ResponseEntity.ok(new RoomsView(engine.listRooms()));
  }

  // --- Create (custom rooms only) ------------------------------------------

  @PostMapping
  public ResponseEntity<?> create(@RequestBody(required = false) CreateRequest body) {
    try {
      Room room = engine.createRoom(body == null ? null : body.name);
      return ResponseEntity.ok(new RoomView(RoomSummary.of(room, 0)));
    } catch (RoomSyncException e) {
      return error(e);
    }
  }

  // --- Delete ----------------------------------------------------------------

  @DeleteMapping("/{roomId}")
  public ResponseEntity<?> delete(@PathVariable String roomId) {
    try {
      engine.deleteRoom(roomId);
      return ResponseEntity.ok(new SuccessView());
    } catch (RoomSyncException e) {
      return error(e);
    }
  }

  // --- Chat history ----------------------------------------------------------

  @GetMapping("/{roomId}/history")
  public ResponseEntity<?> history(@PathVariable String roomId) {
    try {
      List<HistoryEntry> history = engine.chatHistory(roomId).stream().map(HistoryEntry::from).toList();
      return ResponseEntity.ok(new HistoryView(history));
    } catch (RoomSyncException e) {
      return error(e);
    }
  }

  private static ResponseEntity<ErrorView> error(RoomSyncException e) {
    HttpStatus status = statusOf(e);
    if (status.is5xxServerError()) {
      log.error("Room admin request failed: {}", e.getMessage(), e);
    } else {
      log.debug("Room admin request rejected ({}): {}", status.value(), e.getMessage());
    }
    return ResponseEntity.status(status).body(new ErrorView(e.getMessage()));
  }

  static HttpStatus statusOf(RoomSyncException e) {
    if (e instanceof ValidationException) return HttpStatus.BAD_REQUEST;
    if (e instanceof RoomNotFoundException) return HttpStatus.NOT_FOUND;
    if (e instanceof RoomPermissionException) return HttpStatus.FORBIDDEN;
    if (e instanceof RoomConflictException) return HttpStatus.CONFLICT;
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  // ===== DTOs (Views/Requests) ============================================

  public static final class RoomsView {
    public List<RoomSummary> rooms;
    public RoomsView(List<RoomSummary> rooms) { this.rooms = rooms; }
  }

  public static final class RoomView {
    public RoomSummary room;
    public RoomView(RoomSummary room) { this.room = room; }
  }

  /** POST body */
  public static final class CreateRequest {
    public String name;
  }

  public static final class SuccessView {
    public boolean success = true;
  }

  public static final class HistoryView {
    public List<HistoryEntry> history;
    public HistoryView(List<HistoryEntry> history) { this.history = history; }
  }

  public static final class HistoryEntry {
    public String playerId;
    public String playerName;
    public String text;
    public long timestamp;

    public static HistoryEntry from(ChatMessage m) {
      HistoryEntry h = new HistoryEntry();
      h.playerId = m.playerId();
      h.playerName = m.playerName();
      h.text = m.text();
      h.timestamp = m.timestamp();
      return h;
    }
  }

  /** Compact error body */
  public static final class ErrorView {
    public boolean ok = false;
    public String message;
    public ErrorView(String message) {
      this.message = (message == null ? "Internal error" : message);
    }
  }
}
