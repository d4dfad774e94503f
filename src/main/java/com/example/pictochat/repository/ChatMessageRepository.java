package com.example.pictochat.repository;

import com.example.pictochat.model.ChatMessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessageEntity, Long> {

    /** Newest first; callers reverse to chronological order. */
    List<ChatMessageEntity> findByRoomIdOrderByTimestampDescIdDesc(String roomId, Pageable page);

    long deleteByRoomIdAndTimestampLessThan(String roomId, long cutoff);

    long deleteByRoomId(String roomId);
}
