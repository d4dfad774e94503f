package com.example.pictochat.model;

/** The single canvas snapshot of a room. Summarizes all drawing state up to {@code timestamp}. */
public record Snapshot(String roomId, String data, long timestamp) { }
