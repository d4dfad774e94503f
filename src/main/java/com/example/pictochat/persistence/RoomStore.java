package com.example.pictochat.persistence;

import com.example.pictochat.model.Room;

import java.util.List;
import java.util.Optional;

/**
 * Port for the {@code rooms} relation.
 * Implementations may throw Spring's DataAccessException on storage failure.
 */
public interface RoomStore {

    /** Built-in rooms first, then by name. */
    List<Room> findAll();

    Optional<Room> findById(String id);

    /** Insert or replace the metadata row for {@code room.id()}. */
    void save(Room room);

    void delete(String id);
}
