package com.example.pictochat.controller;

import com.example.pictochat.config.SyncProperties;
import com.example.pictochat.service.RoomSynchronizationEngine;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final RoomSynchronizationEngine engine;
  private final SyncProperties props;

  public HealthController(RoomSynchronizationEngine engine, SyncProperties props) {
    this.engine = engine;
    this.props = props;
  }

  /** Liveness, no storage access */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  /** Human-readable status, in-memory state only */
  @GetMapping("/admin/health")
  public Map<String, Object> adminHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("app", "ok");
    m.put("storeMode", props.getStoreMode());
    m.put("rooms", engine.registry().liveRooms().size());
    m.put("maintenance", engine.isMaintenanceRunning() ? "scheduled" : "stopped");
    return m;
  }
}
