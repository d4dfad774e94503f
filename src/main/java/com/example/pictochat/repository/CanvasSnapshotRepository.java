package com.example.pictochat.repository;

import com.example.pictochat.model.CanvasSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CanvasSnapshotRepository extends JpaRepository<CanvasSnapshotEntity, Long> {

    Optional<CanvasSnapshotEntity> findFirstByRoomIdOrderByTimestampDescIdDesc(String roomId);

    long deleteByRoomId(String roomId);
}
