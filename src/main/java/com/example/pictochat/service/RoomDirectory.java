package com.example.pictochat.service;

import com.example.pictochat.config.SyncProperties;
import com.example.pictochat.error.*;
import com.example.pictochat.model.LiveRoom;
import com.example.pictochat.model.Room;
import com.example.pictochat.model.RoomSummary;
import com.example.pictochat.persistence.RoomStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.util.*;

/**
 * Room metadata and lifecycle: built-in room seeding, create, delete and idle expiry.
 * Built-in rooms can never be deleted.
 */
public class RoomDirectory {

    private static final Logger log = LoggerFactory.getLogger(RoomDirectory.class);

    static final String CUSTOM_PREFIX = "custom-";

    private static final Comparator<RoomSummary> LISTING_ORDER =
            Comparator.comparing(RoomSummary::custom).thenComparing(RoomSummary::name);

    private final RoomStore store;
    private final ConnectionRegistry registry;
    private final EventLog eventLog;
    private final SyncProperties props;
    private final Clock clock;

    public RoomDirectory(RoomStore store, ConnectionRegistry registry, EventLog eventLog,
                         SyncProperties props, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.eventLog = eventLog;
        this.props = props;
        this.clock = clock;
    }

    /** Seeds missing built-in rooms, then attaches every stored room to the registry. */
    public int loadPersistedRooms() {
        for (String letter : props.getDefaultRooms()) {
            String l = letter.trim();
            if (l.isEmpty()) continue;
            String id = "chat-" + l.toLowerCase(Locale.ROOT);
            if (stored(id).isEmpty()) {
                Room room = new Room(id, "Chat " + l.toUpperCase(Locale.ROOT), clock.instant(),
                        props.getMaxPlayers(), false);
                save(room);
                log.info("Built-in room seeded (id={}, name={})", id, room.name());
            }
        }
        List<Room> all = all();
        all.forEach(registry::attach);
        log.info("Rooms loaded: {}", all.size());
        return all.size();
    }

    /**
     * Creates the room, or replaces the name of an existing room with the same id. An existing
     * room keeps its creation time and its built-in or custom kind. A null or blank id generates
     * {@code custom-xxxxxxxx}.
     */
    public Room createRoom(String name, String id, boolean custom) {
        String cleanName = (name == null ? "" : name.trim());
        if (cleanName.isEmpty()) {
            throw new ValidationException("Room name is required");
        }
        int max = props.getMaxRoomNameLength();
        if (cleanName.codePointCount(0, cleanName.length()) > max) {
            throw new ValidationException("Room name must be at most " + max + " characters");
        }

        String roomId = (id == null || id.isBlank()) ? newCustomId() : id.trim();
        Optional<Room> renamed = registry.inRoom(roomId, live -> {
            Room existing = live.getRoom();
            Room room = new Room(roomId, cleanName, existing.createdAt(), props.getMaxPlayers(), existing.custom());
            save(room);
            live.setRoom(room);
            return room;
        });
        if (renamed.isPresent()) {
            log.info("Room updated (id={}, name={})", roomId, cleanName);
            return renamed.get();
        }

        Room room = new Room(roomId, cleanName, clock.instant(), props.getMaxPlayers(), custom);
        save(room);
        registry.attach(room);
        log.info("Room created (id={}, name={}, custom={})", roomId, cleanName, custom);
        return room;
    }

    public Optional<Room> getRoom(String id) {
        return registry.getRoom(id);
    }

    /** All rooms with their live player counts, built-in rooms first. */
    public List<RoomSummary> listRooms() {
        List<RoomSummary> out = new ArrayList<>();
        for (LiveRoom live : registry.liveRooms()) {
            registry.inRoom(live.getId(), l -> out.add(RoomSummary.of(l.getRoom(), l.playerCount())));
        }
        out.sort(LISTING_ORDER);
        return out;
    }

    /**
     * Deletes a custom room without players, together with its log and snapshot.
     *
     * @throws RoomNotFoundException   unknown id
     * @throws RoomPermissionException built-in room
     * @throws RoomConflictException   players still attached
     */
    public void deleteRoom(String id) {
        Optional<Boolean> done = registry.inRoom(id, live -> {
            if (!live.getRoom().custom()) {
                throw new RoomPermissionException("Cannot delete built-in room: " + id);
            }
            if (live.playerCount() > 0) {
                throw new RoomConflictException("Cannot delete room with active players: " + id);
            }
            purge(id);
            return true;
        });
        if (done.isEmpty()) throw new RoomNotFoundException(id);
        log.info("Room deleted (id={})", id);
    }

    /**
     * Deletes every custom room that has no players and no activity for longer than
     * {@code maxIdle}. Returns the number of rooms removed.
     */
    public int expireIdleCustomRooms(Duration maxIdle) {
        long cutoff = clock.millis() - maxIdle.toMillis();
        int expired = 0;
        for (LiveRoom candidate : registry.liveRooms()) {
            String id = candidate.getId();
            try {
                boolean removed = registry.inRoom(id, live -> {
                    if (!live.getRoom().custom() || live.playerCount() > 0) return false;
                    if (live.getLastActivityAt() >= cutoff) return false;
                    purge(id);
                    return true;
                }).orElse(false);
                if (removed) {
                    expired++;
                    log.info("Idle room expired (id={})", id);
                }
            } catch (StorageException e) {
                log.warn("Idle room expiry failed (id={}): {}", id, e.toString());
            }
        }
        return expired;
    }

    /**
     * Caller holds the room lock. The room row goes first: if that fails the room is untouched.
     * A failure after it leaves orphaned log rows under an id no room uses.
     */
    private void purge(String id) {
        try {
            store.delete(id);
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure: delete room " + id, e);
        }
        registry.detach(id);
        eventLog.deleteRoomData(id);
    }

    private static String newCustomId() {
        return CUSTOM_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private Optional<Room> stored(String id) {
        try {
            return store.findById(id);
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure: read room " + id, e);
        }
    }

    private List<Room> all() {
        try {
            return store.findAll();
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure: list rooms", e);
        }
    }

    private void save(Room room) {
        try {
            store.save(room);
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure: save room " + room.id(), e);
        }
    }
}
