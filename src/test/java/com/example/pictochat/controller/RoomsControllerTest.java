package com.example.pictochat.controller;

import com.example.pictochat.error.*;
import com.example.pictochat.model.ChatMessage;
import com.example.pictochat.model.Room;
import com.example.pictochat.model.RoomSummary;
import com.example.pictochat.service.RoomSynchronizationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * RoomsControllerTest (standalone MockMvc)
 *
 * Scope:
 * - GET    /api/rooms
 * - POST   /api/rooms
 * - DELETE /api/rooms/{roomId}
 * - GET    /api/rooms/{roomId}/history
 */
class RoomsControllerTest {

    private RoomSynchronizationEngine engine;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        engine = mock(RoomSynchronizationEngine.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new RoomsController(engine))
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
    }

    @Test
    @DisplayName("GET lists rooms with live counts")
    void list() throws Exception {
        when(engine.listRooms()).thenReturn(List.of(
                new RoomSummary("chat-a", "Chat A", 3, 4, false),
                new RoomSummary("custom-1a2b3c4d", "Doodles", 0, 4, true)));

        mockMvc.perform(get("/api/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rooms", hasSize(2)))
                .andExpect(jsonPath("$.rooms[0].id", is("chat-a")))
                .andExpect(jsonPath("$.rooms[0].playerCount", is(3)))
                .andExpect(jsonPath("$.rooms[0].isCustom", is(false)))
                .andExpect(jsonPath("$.rooms[1].isCustom", is(true)));
    }

    @Nested
    @DisplayName("POST /api/rooms")
    class Create {

        @Test
        @DisplayName("creates a custom room")
        void ok() throws Exception {
            when(engine.createRoom("Doodles"))
                    .thenReturn(new Room("custom-1a2b3c4d", "Doodles", Instant.EPOCH, 4, true));

            mockMvc.perform(post("/api/rooms")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Doodles\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.room.id", is("custom-1a2b3c4d")))
                    .andExpect(jsonPath("$.room.name", is("Doodles")))
                    .andExpect(jsonPath("$.room.playerCount", is(0)))
                    .andExpect(jsonPath("$.room.isCustom", is(true)));
        }

        @Test
        @DisplayName("400 on invalid name")
        void invalid() throws Exception {
            when(engine.createRoom(anyString()))
                    .thenThrow(new ValidationException("Room name must be at most 20 characters"));

            mockMvc.perform(post("/api/rooms")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"" + "x".repeat(21) + "\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.ok", is(false)))
                    .andExpect(jsonPath("$.message", containsString("20")));
        }

        @Test
        @DisplayName("500 when storage fails")
        void storage() throws Exception {
            when(engine.createRoom("Doodles")).thenThrow(new StorageException("Storage failure: save room",
                    new DataAccessResourceFailureException("disk full")));

            mockMvc.perform(post("/api/rooms")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Doodles\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.ok", is(false)));
        }
    }

    @Nested
    @DisplayName("DELETE /api/rooms/{roomId}")
    class Delete {

        @Test
        void ok() throws Exception {
            mockMvc.perform(delete("/api/rooms/{id}", "custom-1a2b3c4d"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success", is(true)));
            verify(engine).deleteRoom("custom-1a2b3c4d");
        }

        @Test
        void notFound() throws Exception {
            doThrow(new RoomNotFoundException("nope")).when(engine).deleteRoom("nope");
            mockMvc.perform(delete("/api/rooms/{id}", "nope"))
                    .andExpect(status().isNotFound());
        }

        @Test
        void builtInForbidden() throws Exception {
            doThrow(new RoomPermissionException("Cannot delete built-in room: chat-a")).when(engine).deleteRoom("chat-a");
            mockMvc.perform(delete("/api/rooms/{id}", "chat-a"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.message", containsString("built-in")));
        }

        @Test
        void occupiedConflict() throws Exception {
            doThrow(new RoomConflictException("Cannot delete room with active players: custom-x"))
                    .when(engine).deleteRoom("custom-x");
            mockMvc.perform(delete("/api/rooms/{id}", "custom-x"))
                    .andExpect(status().isConflict());
        }
    }

    @Nested
    @DisplayName("GET /api/rooms/{roomId}/history")
    class History {

        @Test
        void ok() throws Exception {
            when(engine.chatHistory("chat-a")).thenReturn(List.of(
                    new ChatMessage(1L, "chat-a", "p1", "Alice", "hi", 100L),
                    new ChatMessage(2L, "chat-a", "p2", "Bob", "hey", 200L)));

            mockMvc.perform(get("/api/rooms/{id}/history", "chat-a"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.history", hasSize(2)))
                    .andExpect(jsonPath("$.history[0].playerName", is("Alice")))
                    .andExpect(jsonPath("$.history[1].text", is("hey")))
                    .andExpect(jsonPath("$.history[1].timestamp", is(200)));
        }

        @Test
        void unknownRoom() throws Exception {
            when(engine.chatHistory("nope")).thenThrow(new RoomNotFoundException("nope"));
            mockMvc.perform(get("/api/rooms/{id}/history", "nope"))
                    .andExpect(status().isNotFound());
        }
    }
}
