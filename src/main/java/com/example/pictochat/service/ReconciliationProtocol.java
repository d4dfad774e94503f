package com.example.pictochat.service;

import com.example.pictochat.config.SyncProperties;
import com.example.pictochat.error.RoomFullException;
import com.example.pictochat.error.RoomNotFoundException;
import com.example.pictochat.error.ValidationException;
import com.example.pictochat.model.*;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Join/rejoin handshake and replay of events a client buffered while offline.
 *
 * <p>Registration, the state view and the {@code userJoined} notice are produced under the room
 * lock, so no event can slip in between the view a joiner receives and the live stream that
 * follows it.
 */
public class ReconciliationProtocol {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProtocol.class);

    private final ConnectionRegistry registry;
    private final EventLog eventLog;
    private final Broadcaster broadcaster;
    private final RoomEventPublisher publisher;
    private final SyncProperties props;
    private final Clock clock;

    public ReconciliationProtocol(ConnectionRegistry registry, EventLog eventLog, Broadcaster broadcaster,
                                  RoomEventPublisher publisher, SyncProperties props, Clock clock) {
        this.registry = registry;
        this.eventLog = eventLog;
        this.broadcaster = broadcaster;
        this.publisher = publisher;
        this.props = props;
        this.clock = clock;
    }

    public JoinOutcome join(String roomId, Player player) {
        return attach(roomId, player, false, null);
    }

    /**
     * Like {@link #join}, plus {@code missedEvents}: the drawing events strictly after
     * {@code lastEventTimestamp}. Without a watermark nothing counts as missed.
     */
    public JoinOutcome rejoin(String roomId, Player player, Long lastEventTimestamp) {
        return attach(roomId, player, true, lastEventTimestamp);
    }

    private JoinOutcome attach(String roomId, Player player, boolean rejoin, Long watermark) {
        Optional<JoinOutcome> outcome = registry.inRoom(roomId, live -> {
            ConnectionRegistry.Registration reg = registry.register(roomId, player);
            if (!reg.added()) {
                return JoinOutcome.rejected(new RoomFullException(roomId, live.getRoom().maxPlayers()));
            }
            RoomStateView view;
            try {
                view = stateView(live, rejoin, watermark);
            } catch (RuntimeException e) {
                registry.removePlayer(roomId, player.getPlayerId(), player.getConnection());
                throw e;
            }
            broadcaster.send(player.getConnection(),
                    OutboundMessages.roomState(view, player.getPlayerId(), player.getPlayerName()));
            broadcaster.broadcast(roomId,
                    OutboundMessages.userJoined(player.getPlayerId(), player.getPlayerName(), rejoin, clock.millis()),
                    player.getPlayerId());
            return JoinOutcome.accepted(view, reg.displacedFrom());
        });
        return outcome.orElseGet(() -> JoinOutcome.rejected(new RoomNotFoundException(roomId)));
    }

    /** Caller holds the room lock. */
    private RoomStateView stateView(LiveRoom live, boolean rejoin, Long watermark) {
        String roomId = live.getId();
        Optional<Snapshot> snapshot = eventLog.snapshot(roomId);
        long since = snapshot.map(Snapshot::timestamp).orElse(0L);

        List<DrawingEvent> drawing = eventLog.drawingEventsSince(roomId, since);
        List<DrawingEvent> missed = List.of();
        if (rejoin && watermark != null) {
            missed = eventLog.drawingEventsSince(roomId, watermark);
        }

        return new RoomStateView(
                roomId,
                live.getRoom().name(),
                live.getPlayers(),
                eventLog.chatHistory(roomId, props.getChatHistoryLimit()),
                drawing,
                snapshot.map(Snapshot::data).orElse(null),
                missed,
                rejoin
        );
    }

    /**
     * Re-applies buffered client events as if the player sent them now. Only {@code draw} and
     * {@code message} are accepted. Attribution is always the replaying player's; timestamps come
     * from the event when it has one. Events are not deduplicated: a batch sent twice is stored
     * and broadcast twice.
     *
     * @return the number of events applied
     */
    public int applyReplayedEvents(String roomId, String playerId, String playerName, List<JsonNode> events) {
        if (events == null || events.isEmpty()) return 0;
        return registry.inRoom(roomId, live -> {
            int applied = 0;
            for (JsonNode ev : events) {
                if (ev == null || !ev.isObject()) continue;
                String type = ev.path("type").asText("");
                long ts = timestampOf(ev);
                switch (type) {
                    case DrawingEvent.DRAW:
                        publisher.draw(roomId, playerId, RoomEventPublisher.drawPayload(
                                ev.get("points"), ev.path("color").asText(null), ev.get("size"),
                                ev.path("tool").asText(null)), ts);
                        applied++;
                        break;
                    case "message":
                        try {
                            publisher.chat(roomId, playerId, playerName, ev.path("text").asText(null), ts);
                            applied++;
                        } catch (ValidationException e) {
                            log.warn("Replayed message skipped (room={}, player={}): {}", roomId, playerId, e.getMessage());
                        }
                        break;
                    default:
                        log.debug("Replayed event ignored (room={}, type={})", roomId, type);
                }
            }
            log.info("Replayed {}/{} queued events (room={}, player={})", applied, events.size(), roomId, playerName);
            return applied;
        }).orElse(0);
    }

    private long timestampOf(JsonNode ev) {
        JsonNode ts = ev.get("timestamp");
        if (ts != null && ts.canConvertToLong() && ts.asLong() > 0) return ts.asLong();
        return clock.millis();
    }
}
