package com.example.pictochat.service;

public record MaintenanceReport(int expiredRooms, CompactionResult compaction) { }
