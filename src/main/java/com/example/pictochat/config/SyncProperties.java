package com.example.pictochat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties("app.sync")
public class SyncProperties {

    /** Capacity given to newly created rooms. */
    private int maxPlayers = 4;

    /** Bound on chatHistory in room state views and the history endpoint. */
    private int chatHistoryLimit = 50;

    /** Chat text bound, in code points after trimming. */
    private int maxMessageLength = 140;

    private int maxRoomNameLength = 20;

    /** Bounds on client-chosen identity; match the player_id / player_name columns. */
    private int maxPlayerIdLength = 64;
    private int maxPlayerNameLength = 100;

    /** Letters of the built-in rooms: "A" becomes chat-a / "Chat A". */
    private List<String> defaultRooms = new ArrayList<>(List.of("A", "B", "C", "D"));

    /** Custom rooms without players are deleted after this much inactivity. */
    private Duration idleRoomTtl = Duration.ofHours(24);

    /** Age cutoff handed to the compaction pass. */
    private Duration retention = Duration.ofDays(7);

    private Duration maintenanceInterval = Duration.ofHours(1);

    /** "jpa" (default) or "memory" */
    private String storeMode = "jpa";

    // --- getters/setters ---

    public int getMaxPlayers() { return maxPlayers; }
    public void setMaxPlayers(int maxPlayers) { this.maxPlayers = maxPlayers; }

    public int getChatHistoryLimit() { return chatHistoryLimit; }
    public void setChatHistoryLimit(int chatHistoryLimit) { this.chatHistoryLimit = chatHistoryLimit; }

    public int getMaxMessageLength() { return maxMessageLength; }
    public void setMaxMessageLength(int maxMessageLength) { this.maxMessageLength = maxMessageLength; }

    public int getMaxRoomNameLength() { return maxRoomNameLength; }
    public void setMaxRoomNameLength(int maxRoomNameLength) { this.maxRoomNameLength = maxRoomNameLength; }

    public int getMaxPlayerIdLength() { return maxPlayerIdLength; }
    public void setMaxPlayerIdLength(int maxPlayerIdLength) { this.maxPlayerIdLength = maxPlayerIdLength; }

    public int getMaxPlayerNameLength() { return maxPlayerNameLength; }
    public void setMaxPlayerNameLength(int maxPlayerNameLength) { this.maxPlayerNameLength = maxPlayerNameLength; }

    public List<String> getDefaultRooms() { return defaultRooms; }
    public void setDefaultRooms(List<String> defaultRooms) { this.defaultRooms = defaultRooms; }

    public Duration getIdleRoomTtl() { return idleRoomTtl; }
    public void setIdleRoomTtl(Duration idleRoomTtl) { this.idleRoomTtl = idleRoomTtl; }

    public Duration getRetention() { return retention; }
    public void setRetention(Duration retention) { this.retention = retention; }

    public Duration getMaintenanceInterval() { return maintenanceInterval; }
    public void setMaintenanceInterval(Duration maintenanceInterval) { this.maintenanceInterval = maintenanceInterval; }

    public String getStoreMode() { return storeMode; }
    public void setStoreMode(String storeMode) { this.storeMode = storeMode; }
}
