package com.example.pictochat.service;

import com.example.pictochat.config.SyncProperties;
import com.example.pictochat.error.*;
import com.example.pictochat.model.*;
import com.example.pictochat.persistence.EventStore;
import com.example.pictochat.persistence.RoomStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point of the room synchronization core. Owns the registry, the event log, the room
 * directory and the maintenance timer; transports feed it connection events through
 * {@link #open}, {@link #handle} and {@link #close}.
 *
 * <p>Instances are independent of each other, so tests can run several side by side.
 */
public class RoomSynchronizationEngine {

    private static final Logger log = LoggerFactory.getLogger(RoomSynchronizationEngine.class);

    static final String INVALID_MESSAGE = "Invalid message format";

    private final SyncProperties props;
    private final Clock clock;
    private final EventLog eventLog;
    private final ConnectionRegistry registry;
    private final RoomDirectory directory;
    private final Broadcaster broadcaster;
    private final RoomEventPublisher publisher;
    private final ReconciliationProtocol protocol;
    private final MaintenanceScheduler maintenance;

    public RoomSynchronizationEngine(SyncProperties props, RoomStore roomStore, EventStore eventStore,
                                     ObjectMapper objectMapper, Clock clock) {
        this.props = props;
        this.clock = clock;
        this.eventLog = new EventLog(eventStore, props);
        this.registry = new ConnectionRegistry(clock);
        this.directory = new RoomDirectory(roomStore, registry, eventLog, props, clock);
        this.broadcaster = new Broadcaster(registry, objectMapper);
        this.publisher = new RoomEventPublisher(registry, eventLog, broadcaster, clock);
        this.protocol = new ReconciliationProtocol(registry, eventLog, broadcaster, publisher, props, clock);
        this.maintenance = new MaintenanceScheduler("room-maintenance", this::runMaintenance);
    }

    // ========================================================================
    //  LIFECYCLE
    // ========================================================================

    /** Loads rooms and starts the maintenance timer. */
    public void start() {
        directory.loadPersistedRooms();
        maintenance.start(props.getMaintenanceInterval());
        log.info("Room synchronization engine started (maxPlayers={}, storeMode={})",
                props.getMaxPlayers(), props.getStoreMode());
    }

    public void shutdown() {
        maintenance.shutdown();
        log.info("Room synchronization engine stopped");
    }

    /**
     * One maintenance round: expire idle custom rooms, then compact every remaining room with
     * cutoff {@code now - retention}, each room under its own lock.
     */
    public MaintenanceReport runMaintenance() {
        int expired = directory.expireIdleCustomRooms(props.getIdleRoomTtl());
        long cutoff = clock.millis() - props.getRetention().toMillis();

        CompactionResult total = CompactionResult.NONE;
        for (LiveRoom live : registry.liveRooms()) {
            String roomId = live.getId();
            try {
                CompactionResult r = registry.inRoom(roomId, l -> eventLog.compactionPass(roomId, cutoff))
                        .orElse(CompactionResult.NONE);
                total = total.plus(r);
            } catch (StorageException e) {
                log.warn("Compaction failed (room={}): {}", roomId, e.toString());
            }
        }
        log.info("Maintenance done: expiredRooms={}, drawingEventsDeleted={}, chatMessagesDeleted={}",
                expired, total.drawingEventsDeleted(), total.chatMessagesDeleted());
        return new MaintenanceReport(expired, total);
    }

    // ========================================================================
    //  CONNECTIONS
    // ========================================================================

    public ConnectionContext open(PlayerConnection connection) {
        log.debug("Connection opened: {}", connection.id());
        return new ConnectionContext(connection);
    }

    /**
     * Dispatches one inbound message. Rejections and invalid input are answered with an
     * {@code error} message to this connection only; nothing escapes to the transport.
     */
    public void handle(ConnectionContext ctx, ClientMessage msg) {
        if (msg == null || msg.type == null) {
            reply(ctx, INVALID_MESSAGE);
            return;
        }
        synchronized (ctx) {
            if (ctx.getState() == ConnectionState.CLOSED) {
                log.debug("Message on closed connection ignored: {}", msg);
                return;
            }
            try {
                dispatch(ctx, msg);
            } catch (RoomSyncException e) {
                log.warn("Message rejected (type={}, room={}, player={}): {}",
                        msg.type, ctx.getRoomId(), ctx.getPlayerId(), e.getMessage());
                reply(ctx, e.getMessage());
            }
        }
    }

    /** Answers a frame that could not be parsed. The connection stays open. */
    public void invalidFrame(ConnectionContext ctx) {
        reply(ctx, INVALID_MESSAGE);
    }

    private void dispatch(ConnectionContext ctx, ClientMessage msg) {
        switch (msg.type) {
            case "join":
                onJoin(ctx, msg, false);
                break;
            case "rejoin":
                onJoin(ctx, msg, true);
                break;
            case "draw":
                if (active(ctx, msg)) {
                    publisher.draw(ctx.getRoomId(), ctx.getPlayerId(),
                            RoomEventPublisher.drawPayload(msg.points, msg.color, msg.size, msg.tool),
                            clock.millis());
                }
                break;
            case "clear":
                if (active(ctx, msg)) {
                    publisher.clear(ctx.getRoomId(), ctx.getPlayerId(), ctx.getPlayerName());
                }
                break;
            case "message":
                if (active(ctx, msg)) {
                    publisher.chat(ctx.getRoomId(), ctx.getPlayerId(), ctx.getPlayerName(), msg.text, clock.millis());
                }
                break;
            case "drawStart":
            case "drawEnd":
                if (active(ctx, msg)) {
                    publisher.drawIndicator(ctx.getRoomId(), ctx.getPlayerId(), ctx.getPlayerName(),
                            "drawStart".equals(msg.type));
                }
                break;
            case "canvasSnapshot":
                if (active(ctx, msg) && msg.snapshotData != null) {
                    publisher.snapshot(ctx.getRoomId(), msg.snapshotData);
                }
                break;
            case "queueReplay":
                if (active(ctx, msg) && msg.events != null) {
                    protocol.applyReplayedEvents(ctx.getRoomId(), ctx.getPlayerId(), ctx.getPlayerName(), msg.events);
                }
                break;
            default:
                log.warn("Unknown message type: {}", msg.type);
        }
    }

    private void onJoin(ConnectionContext ctx, ClientMessage msg, boolean rejoin) {
        String roomId = (msg.roomId == null ? "" : msg.roomId.trim());
        if (roomId.isEmpty()) {
            throw new ValidationException("roomId is required");
        }
        String playerId = (msg.playerId == null || msg.playerId.isBlank())
                ? UUID.randomUUID().toString() : msg.playerId.trim();
        String playerName = (msg.playerName == null || msg.playerName.isBlank())
                ? "Player " + playerId.substring(0, Math.min(4, playerId.length())) : msg.playerName.trim();
        if (playerId.length() > props.getMaxPlayerIdLength()) {
            throw new ValidationException("playerId must be at most " + props.getMaxPlayerIdLength() + " characters");
        }
        if (playerName.length() > props.getMaxPlayerNameLength()) {
            throw new ValidationException("playerName must be at most " + props.getMaxPlayerNameLength() + " characters");
        }

        if (ctx.getState() == ConnectionState.ACTIVE) {
            leave(ctx);
        }

        ctx.joining();
        Player player = new Player(playerId, playerName, ctx.getConnection());
        JoinOutcome outcome = rejoin
                ? protocol.rejoin(roomId, player, msg.lastEventTimestamp)
                : protocol.join(roomId, player);

        if (!outcome.isAccepted()) {
            ctx.detached();
            RoomSyncException reason = outcome.rejection();
            log.warn("{} rejected (room={}, player={}): {}", rejoin ? "Rejoin" : "Join", roomId, playerId,
                    reason.getMessage());
            reply(ctx, clientText(reason, rejoin));
            return;
        }
        ctx.attached(roomId, playerId, playerName);
        outcome.displaced().ifPresent(other -> {
            if (publisher.evict(other, playerId)) {
                log.info("Player {} moved out of {} (joined {})", playerId, other, roomId);
            }
        });
        log.info("{} ({}) {} {}", playerName, playerId, rejoin ? "rejoined" : "joined", roomId);
    }

    /** Detaches the connection from its room and emits {@code userLeft}. */
    public void close(ConnectionContext ctx) {
        synchronized (ctx) {
            if (ctx.getState() == ConnectionState.ACTIVE) {
                leave(ctx);
                log.info("Player {} ({}) disconnected from {}", ctx.getPlayerName(), ctx.getPlayerId(), ctx.getRoomId());
            }
            ctx.closed();
        }
    }

    private void leave(ConnectionContext ctx) {
        publisher.leave(ctx.getRoomId(), ctx.getPlayerId(), ctx.getPlayerName(), ctx.getConnection());
    }

    /**
     * True if the connection may send room events. A connection whose player was moved to
     * another room, or whose room was deleted, falls back to unattached.
     */
    private boolean active(ConnectionContext ctx, ClientMessage msg) {
        if (ctx.getState() != ConnectionState.ACTIVE) {
            log.debug("Ignoring {} from unattached connection {}", msg.type, ctx.getConnection().id());
            return false;
        }
        boolean registered = registry.inRoom(ctx.getRoomId(), live -> {
            Player p = live.getPlayer(ctx.getPlayerId());
            return p != null && p.getConnection() == ctx.getConnection();
        }).orElse(false);
        if (!registered) {
            log.debug("Connection {} no longer attached to {}", ctx.getConnection().id(), ctx.getRoomId());
            ctx.detached();
        }
        return registered;
    }

    private static String clientText(RoomSyncException reason, boolean rejoin) {
        if (reason instanceof RoomFullException) return "Room is full";
        if (reason instanceof RoomNotFoundException) return rejoin ? "Room no longer exists" : "Room does not exist";
        return reason.getMessage();
    }

    private void reply(ConnectionContext ctx, String message) {
        broadcaster.send(ctx.getConnection(), OutboundMessages.error(message));
    }

    // ========================================================================
    //  ADMIN
    // ========================================================================

    public List<RoomSummary> listRooms() {
        return directory.listRooms();
    }

    public Optional<Room> getRoom(String roomId) {
        return directory.getRoom(roomId);
    }

    /** Creates a custom room with a generated id. */
    public Room createRoom(String name) {
        return directory.createRoom(name, null, true);
    }

    public void deleteRoom(String roomId) {
        directory.deleteRoom(roomId);
    }

    /** Bounded chat history of an existing room. */
    public List<ChatMessage> chatHistory(String roomId) {
        if (directory.getRoom(roomId).isEmpty()) throw new RoomNotFoundException(roomId);
        return eventLog.chatHistory(roomId, props.getChatHistoryLimit());
    }

    // --- components (tests, diagnostics) ---

    public EventLog eventLog() { return eventLog; }
    public ConnectionRegistry registry() { return registry; }
    public RoomDirectory directory() { return directory; }
    public ReconciliationProtocol protocol() { return protocol; }
    public boolean isMaintenanceRunning() { return maintenance.isRunning(); }
}
