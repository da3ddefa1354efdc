package com.roommesh.controller;

import com.roommesh.repository.RoomRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api")
public class RoomStatusController {

    private final RoomRegistry roomRegistry;

    public RoomStatusController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    @GetMapping("/room/{roomId}/participants")
    public ResponseEntity<?> getRoomParticipants(@PathVariable String roomId) {
        Set<String> participants = roomRegistry.members(roomId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("participantCount", participants.size());
        response.put("participants", participants);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/room/{roomId}/participants/count")
    public ResponseEntity<?> getRoomParticipantCount(@PathVariable String roomId) {
        return ResponseEntity.ok(Map.of("participantCount", roomRegistry.participantCount(roomId)));
    }

    @GetMapping("/rooms")
    public ResponseEntity<?> getRooms() {
        List<Map<String, Object>> rooms = new ArrayList<>();
        for (String roomId : roomRegistry.roomIds()) {
            int count = roomRegistry.participantCount(roomId);
            if (count > 0) {
                Map<String, Object> room = new LinkedHashMap<>();
                room.put("roomId", roomId);
                room.put("participantCount", count);
                rooms.add(room);
            }
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("roomCount", rooms.size());
        response.put("rooms", rooms);
        return ResponseEntity.ok(response);
    }
}
