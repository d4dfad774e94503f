package com.example.pictochat.repository;

import com.example.pictochat.model.PersistentRoom;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PersistentRoomRepository extends JpaRepository<PersistentRoom, String> {

    // built-in rooms first, then by name
    List<PersistentRoom> findAllByOrderByCustomAscNameAsc();
}
