package com.herotasks.realtime.controller;

import com.herotasks.realtime.infrastructure.ConnectionRegistry;
import com.herotasks.realtime.infrastructure.RoomManager;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Read-only views for operational tooling. Reflects this instance only.
 */
@RestController
@RequestMapping("/api")
public class PresenceController {

    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;

    public PresenceController(ConnectionRegistry connectionRegistry, RoomManager roomManager) {
        this.connectionRegistry = connectionRegistry;
        this.roomManager = roomManager;
    }

    @GetMapping("/connections")
    public Map<String, Object> connections() {
        List<String> userIds = List.copyOf(new TreeSet<>(connectionRegistry.connectedUserIds()));
        return Map.of(
                "count", userIds.size(),
                "userIds", userIds
        );
    }

    @GetMapping("/rooms")
    public Map<String, Object> rooms() {
        List<String> taskIds = List.copyOf(new TreeSet<>(roomManager.roomIds()));
        return Map.of(
                "count", taskIds.size(),
                "taskIds", taskIds
        );
    }

    @GetMapping("/rooms/{taskId}/members")
    public Map<String, Object> roomMembers(@PathVariable String taskId) {
        List<String> members = List.copyOf(new TreeSet<>(roomManager.members(taskId)));
        return Map.of(
                "taskId", taskId,
                "count", members.size(),
                "userIds", members
        );
    }
}
