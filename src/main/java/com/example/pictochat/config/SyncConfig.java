package com.example.pictochat.config;

import com.example.pictochat.persistence.*;
import com.example.pictochat.repository.CanvasSnapshotRepository;
import com.example.pictochat.repository.ChatMessageRepository;
import com.example.pictochat.repository.DrawingEventRepository;
import com.example.pictochat.repository.PersistentRoomRepository;
import com.example.pictochat.service.RoomSynchronizationEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SyncConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }

  // --- store-mode=jpa (default) -------------------------------------------

  @Bean
  @ConditionalOnProperty(name = "app.sync.store-mode", havingValue = "jpa", matchIfMissing = true)
  public RoomStore jpaRoomStore(PersistentRoomRepository repo) {
    return new JpaRoomStore(repo);
  }

  @Bean
  @ConditionalOnProperty(name = "app.sync.store-mode", havingValue = "jpa", matchIfMissing = true)
  public EventStore jpaEventStore(ChatMessageRepository chat,
                                  DrawingEventRepository drawing,
                                  CanvasSnapshotRepository snapshots,
                                  ObjectMapper objectMapper) {
    return new JpaEventStore(chat, drawing, snapshots, objectMapper);
  }

  // --- store-mode=memory: nothing survives a restart ----------------------

  @Bean
  @ConditionalOnProperty(name = "app.sync.store-mode", havingValue = "memory")
  public RoomStore inMemoryRoomStore() {
    return new InMemoryRoomStore();
  }

  @Bean
  @ConditionalOnProperty(name = "app.sync.store-mode", havingValue = "memory")
  public EventStore inMemoryEventStore() {
    return new InMemoryEventStore();
  }

  @Bean(initMethod = "start", destroyMethod = "shutdown")
  public RoomSynchronizationEngine roomSynchronizationEngine(SyncProperties props,
                                                             RoomStore roomStore,
                                                             EventStore eventStore,
                                                             ObjectMapper objectMapper,
                                                             Clock clock) {
    return new RoomSynchronizationEngine(props, roomStore, eventStore, objectMapper, clock);
  }
}
