package com.example.pictochat.persistence;

import com.example.pictochat.model.PersistentRoom;
import com.example.pictochat.model.Room;
import com.example.pictochat.repository.PersistentRoomRepository;

import java.util.List;
import java.util.Optional;

/**
 * Adapter on the JPA repository. Active when app.sync.store-mode=jpa (default).
 */
public class JpaRoomStore implements RoomStore {

    private final PersistentRoomRepository repo;

    public JpaRoomStore(PersistentRoomRepository repo) {
        this.repo = repo;
    }

    @Override
    public List<Room> findAll() {
        return repo.findAllByOrderByCustomAscNameAsc().stream()
                .map(PersistentRoom::toRoom)
                .toList();
    }

    @Override
    public Optional<Room> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return repo.findById(id).map(PersistentRoom::toRoom);
    }

    @Override
    public void save(Room room) {
        repo.save(PersistentRoom.from(room));
    }

    @Override
    public void delete(String id) {
        if (id == null) return;
        repo.deleteById(id);
    }
}
