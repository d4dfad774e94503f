package com.example.pictochat.repository;

import com.example.pictochat.model.DrawingEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DrawingEventRepository extends JpaRepository<DrawingEventEntity, Long> {

    List<DrawingEventEntity> findByRoomIdAndTimestampGreaterThanOrderByTimestampAscIdAsc(String roomId, long since);

    long deleteByRoomIdAndTimestampLessThan(String roomId, long cutoff);

    long deleteByRoomId(String roomId);
}
