package com.example.pictochat.persistence;

import com.example.pictochat.model.Room;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile room store for deployments without a database (app.sync.store-mode=memory) and tests.
 */
public class InMemoryRoomStore implements RoomStore {

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();

    @Override
    public List<Room> findAll() {
        return rooms.values().stream()
                .sorted(Comparator.comparing(Room::custom).thenComparing(Room::name))
                .toList();
    }

    @Override
    public Optional<Room> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(id));
    }

    @Override
    public void save(Room room) {
        rooms.put(room.id(), room);
    }

    @Override
    public void delete(String id) {
        if (id == null) return;
        rooms.remove(id);
    }
}
