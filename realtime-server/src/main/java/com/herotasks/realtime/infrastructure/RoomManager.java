package com.herotasks.realtime.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-task rooms of user ids. A room exists only while it has members:
 * it is created on first join and removed in the same atomic step that
 * empties it.
 */
@Component
@Slf4j
public class RoomManager {

    private final ConcurrentHashMap<String, Set<String>> rooms = new ConcurrentHashMap<>();

    public void join(String taskId, String userId) {
        rooms.compute(taskId, (id, members) -> {
            Set<String> target = members != null ? members : ConcurrentHashMap.newKeySet();
            target.add(userId);
            return target;
        });
        log.debug("Joined room: taskId={}, userId={}", taskId, userId);
    }

    public void leave(String taskId, String userId) {
        rooms.computeIfPresent(taskId, (id, members) -> {
            members.remove(userId);
            return members.isEmpty() ? null : members;
        });
        log.debug("Left room: taskId={}, userId={}", taskId, userId);
    }

    public Set<String> members(String taskId) {
        Set<String> members = rooms.get(taskId);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public boolean exists(String taskId) {
        return rooms.containsKey(taskId);
    }

    /**
     * Removes the user from every room.
     *
     * @return ids of the rooms the user was removed from
     */
    public List<String> leaveAll(String userId) {
        List<String> affected = new ArrayList<>();
        for (String taskId : new ArrayList<>(rooms.keySet())) {
            AtomicBoolean removed = new AtomicBoolean(false);
            rooms.computeIfPresent(taskId, (id, members) -> {
                removed.set(members.remove(userId));
                return members.isEmpty() ? null : members;
            });
            if (removed.get()) {
                affected.add(taskId);
            }
        }
        if (!affected.isEmpty()) {
            log.info("User left all rooms: userId={}, rooms={}", userId, affected);
        }
        return affected;
    }

    public List<String> roomIds() {
        return new ArrayList<>(rooms.keySet());
    }
}
